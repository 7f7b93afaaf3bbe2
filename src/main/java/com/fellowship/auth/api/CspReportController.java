package com.fellowship.auth.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fellowship.auth.audit.SecurityEventSink;
import com.fellowship.auth.audit.SecurityEvents;
import com.fellowship.auth.exception.BusinessException;
import com.fellowship.auth.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSP 违规报告接收（豁免路由）。
 * <p>
 * 浏览器以 {@code application/csp-report} 提交，请求体按原始文本读取后解析。
 * 脚本、插件、base-uri 与表单提交相关的违规按 critical 上报，浏览器扩展引起的报告忽略。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class CspReportController {

    private static final List<String> CRITICAL_DIRECTIVES = List.of("script-src", "object-src", "base-uri", "form-action");
    private static final List<String> IGNORED_BLOCKED_URIS = List.of(
            "chrome-extension:",
            "moz-extension:",
            "safari-extension:",
            "ms-browser-extension:",
            "about:blank",
            "data:text/html,chromewebdata");

    private final ObjectMapper objectMapper;
    private final SecurityEventSink eventSink;

    @PostMapping("/api/security/csp-report")
    public ResponseEntity<Void> report(@RequestBody(required = false) String body,
                                       @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent) {
        JsonNode violation = parse(body).path("csp-report");
        if (!violation.isObject()) {
            log.warn("Rejected CSP report without csp-report field");
            throw new BusinessException(ErrorCode.CSP_REPORT_INVALID);
        }
        String directive = violation.path("violated-directive").asText("");
        String blockedUri = violation.path("blocked-uri").asText("");
        if (IGNORED_BLOCKED_URIS.stream().anyMatch(blockedUri::contains)) {
            return ResponseEntity.noContent().build();
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("documentUri", violation.path("document-uri").asText(""));
        attributes.put("violatedDirective", directive);
        attributes.put("blockedUri", blockedUri);
        attributes.put("sourceFile", violation.path("source-file").asText(""));
        attributes.put("lineNumber", violation.path("line-number").asInt());
        attributes.put("userAgent", userAgent == null ? "" : userAgent);
        if (CRITICAL_DIRECTIVES.stream().anyMatch(directive::contains)) {
            eventSink.critical(SecurityEvents.CSP_VIOLATION, null, attributes);
        } else {
            eventSink.info(SecurityEvents.CSP_VIOLATION, attributes);
        }
        return ResponseEntity.noContent().build();
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new BusinessException(ErrorCode.CSP_REPORT_INVALID);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            log.warn("Rejected malformed CSP report: {}", ex.getOriginalMessage());
            throw new BusinessException(ErrorCode.CSP_REPORT_INVALID);
        }
    }
}
