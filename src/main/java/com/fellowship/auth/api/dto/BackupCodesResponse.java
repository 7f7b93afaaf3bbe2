package com.fellowship.auth.api.dto;

import java.util.List;

public record BackupCodesResponse(List<String> backupCodes) {
}
