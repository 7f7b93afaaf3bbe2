package com.fellowship.auth.audit;

import java.util.Map;

/**
 * 安全事件上报接口。
 * <p>
 * 抽象运维侧的事件投递（日志、告警、监控平台），管线与各服务只依赖此接口。
 * 默认实现输出到日志，生产环境可替换为告警集成。
 */
public interface SecurityEventSink {

    /**
     * 上报普通安全事件（会话创建/撤销、二次验证结果、CSRF 拒绝等）。
     *
     * @param event      事件名称。
     * @param attributes 事件属性。
     */
    void info(String event, Map<String, ?> attributes);

    /**
     * 上报需要人工关注的事件（存储不可用等）。
     *
     * @param event      事件名称。
     * @param error      触发事件的异常，可为 null。
     * @param attributes 事件属性。
     */
    void critical(String event, Throwable error, Map<String, ?> attributes);
}
