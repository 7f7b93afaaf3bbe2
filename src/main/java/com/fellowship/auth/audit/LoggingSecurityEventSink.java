package com.fellowship.auth.audit;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 日志版安全事件上报器。
 * <p>
 * 不接入外部平台，仅记录日志，便于本地开发与集成测试。
 */
@Slf4j
public class LoggingSecurityEventSink implements SecurityEventSink {

    @Override
    public void info(String event, Map<String, ?> attributes) {
        log.info("Security event event={} attributes={}", event, attributes);
    }

    @Override
    public void critical(String event, Throwable error, Map<String, ?> attributes) {
        log.error("Critical security event event={} attributes={}", event, attributes, error);
    }
}
