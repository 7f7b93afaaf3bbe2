package com.fellowship.auth.api.dto;

/**
 * @param revoked 本次撤销的会话数量。
 */
public record RevokeOthersResponse(int revoked) {
}
