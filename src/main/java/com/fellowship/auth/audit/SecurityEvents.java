package com.fellowship.auth.audit;

/**
 * 安全事件名称常量。
 */
public final class SecurityEvents {

    public static final String CSRF_REJECTED = "csrf.rejected";
    public static final String SESSION_CREATED = "session.created";
    public static final String SESSION_REVOKED = "session.revoked";
    public static final String SESSIONS_REVOKED_OTHERS = "session.revoked_others";
    public static final String SESSION_SIGNED_OUT = "session.signed_out";
    public static final String SESSION_CLEANUP_COMPLETED = "session.cleanup_completed";
    public static final String TWO_FACTOR_SETUP = "2fa.setup";
    public static final String TWO_FACTOR_ENABLED = "2fa.enabled";
    public static final String TWO_FACTOR_VERIFIED = "2fa.verified";
    public static final String TWO_FACTOR_FAILED = "2fa.failed";
    public static final String TWO_FACTOR_DISABLED = "2fa.disabled";
    public static final String TWO_FACTOR_BACKUP_CODES_REGENERATED = "2fa.backup_codes_regenerated";
    public static final String CSP_VIOLATION = "csp.violation";
    public static final String STORE_UNAVAILABLE = "store.unavailable";

    private SecurityEvents() {
    }
}
