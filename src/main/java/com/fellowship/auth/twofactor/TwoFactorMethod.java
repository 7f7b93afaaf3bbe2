package com.fellowship.auth.twofactor;

public enum TwoFactorMethod {
    TOTP,
    BACKUP_CODE
}
