package com.fellowship.auth.session.client;

import java.util.concurrent.CompletableFuture;

/**
 * 客户端访问服务端会话接口的抽象。
 * <p>
 * 对应 {@code POST /api/v1/auth/session/refresh} 与 {@code POST /api/v1/auth/sign-out}。
 */
public interface SessionRemote {

    /**
     * 请求服务端续期当前会话。
     *
     * @return 续期是否成功；异常完成视同失败。
     */
    CompletableFuture<Boolean> refresh();

    /**
     * 请求服务端登出。
     *
     * @return 完成信号。
     */
    CompletableFuture<Void> signOut();
}
