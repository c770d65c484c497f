package com.ctxlog.logging;

import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * LoggingConfiguration 을 공유하는 BoundLogger 생성기
 * 생성 직후 핸들에는 바인딩된 필드가 없음
 */
@RequiredArgsConstructor
public class StructuredLoggerFactory {

    private final LoggingConfiguration configuration;

    public BoundLogger getLogger(String name) {
        return new BoundLogger(name, Map.of(), configuration);
    }

    public BoundLogger getLogger(Class<?> type) {
        return getLogger(type.getName());
    }

    public LoggingConfiguration configuration() {
        return configuration;
    }
}
