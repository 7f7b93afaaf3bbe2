package com.fellowship.auth.pipeline;

import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.exception.SecurityStoreException;

/**
 * 安全管线中的一个阶段。
 */
public interface PipelineStage {

    String name();

    StageOutcome evaluate(RequestContext context);

    /**
     * 存储不可用时的处理。默认拒绝为未认证，阶段可按自身语义覆盖。
     *
     * @param context 请求上下文。
     * @param error   存储异常。
     * @return 替代结论。
     */
    default StageOutcome onStoreFailure(RequestContext context, SecurityStoreException error) {
        return StageOutcome.reject(ErrorCode.UNAUTHENTICATED);
    }
}
