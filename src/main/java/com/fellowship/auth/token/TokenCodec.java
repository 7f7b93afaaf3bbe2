package com.fellowship.auth.token;

/**
 * 安全令牌编解码接口。
 * <p>
 * 负责签发与校验不透明的安全令牌（CSRF 令牌）。实现必须是无状态的：
 * 校验失败以 {@link TokenStatus} 返回，不以异常形式抛出。
 */
public interface TokenCodec {

    /**
     * 签发新令牌。
     *
     * @return 令牌字符串，格式 {@code hex(secret).hex(timestamp).hex(signature)}。
     */
    String issue();

    /**
     * 校验令牌。
     *
     * @param token 待校验令牌，可为 {@code null}。
     * @return 校验结果。
     */
    TokenStatus verify(String token);

    default boolean isValid(String token) {
        return verify(token).isValid();
    }
}
