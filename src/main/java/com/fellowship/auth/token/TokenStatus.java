package com.fellowship.auth.token;

/**
 * 令牌校验结果。
 */
public enum TokenStatus {
    /** 签名正确且未过期。 */
    VALID,
    /** 结构不符（分段数、编码或长度错误）。 */
    MALFORMED,
    /** 签名不匹配。 */
    FORGED,
    /** 签发时间已超出最大有效期。 */
    EXPIRED;

    public boolean isValid() {
        return this == VALID;
    }
}
