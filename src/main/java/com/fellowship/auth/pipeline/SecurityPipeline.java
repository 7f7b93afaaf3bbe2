package com.fellowship.auth.pipeline;

import com.fellowship.auth.audit.SecurityEventSink;
import com.fellowship.auth.audit.SecurityEvents;
import com.fellowship.auth.exception.SecurityStoreException;
import com.fellowship.auth.headers.NonceGenerator;
import com.fellowship.auth.headers.SecurityHeadersWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * 请求安全管线。
 * <p>
 * 按固定顺序执行各阶段，遇到非 CONTINUE 的结论即停止。
 * 无论结论如何（包括阶段抛出异常），安全响应头都会写入上下文。
 */
@Slf4j
public class SecurityPipeline {

    private final List<PipelineStage> stages;
    private final SecurityHeadersWriter headersWriter;
    private final NonceGenerator nonceGenerator;
    private final SecurityEventSink eventSink;

    public SecurityPipeline(List<PipelineStage> stages, SecurityHeadersWriter headersWriter,
                            NonceGenerator nonceGenerator, SecurityEventSink eventSink) {
        this.stages = List.copyOf(stages);
        this.headersWriter = headersWriter;
        this.nonceGenerator = nonceGenerator;
        this.eventSink = eventSink;
    }

    /**
     * 评估一次请求。
     *
     * @param context 请求上下文，执行后携带需要写出的 Cookie 与响应头。
     * @return 最终结论。
     */
    public StageOutcome evaluate(RequestContext context) {
        context.setNonce(nonceGenerator.next());
        try {
            StageOutcome outcome = StageOutcome.proceed();
            for (PipelineStage stage : stages) {
                outcome = runStage(stage, context);
                if (outcome.type() != StageOutcome.Type.CONTINUE) {
                    break;
                }
            }
            return outcome;
        } finally {
            headersWriter.apply(context);
        }
    }

    public List<String> stageNames() {
        return stages.stream().map(PipelineStage::name).toList();
    }

    private StageOutcome runStage(PipelineStage stage, RequestContext context) {
        try {
            return stage.evaluate(context);
        } catch (SecurityStoreException ex) {
            eventSink.critical(SecurityEvents.STORE_UNAVAILABLE, ex, Map.of(
                    "stage", stage.name(),
                    "method", context.getMethod(),
                    "path", context.getPath()));
            return stage.onStoreFailure(context, ex);
        }
    }
}
