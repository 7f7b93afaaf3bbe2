package com.fellowship.auth.api.dto;

import java.util.List;

public record SessionListResponse(List<SessionResponse> sessions) {
}
