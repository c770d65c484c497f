package com.ctxlog.logging;

import com.ctxlog.logging.sink.LogSink;

import java.time.Clock;
import java.util.Objects;

/**
 * 프로세스 단위 로깅 설정
 *
 * - 기동 시 한 번 생성되어 StructuredLoggerFactory 와 모든 BoundLogger 에 명시적으로 전달됨
 * - threshold 미만 레코드는 버퍼링 없이 즉시 폐기
 */
public record LoggingConfiguration(
        LogLevel threshold,
        LogSink sink,
        Clock clock
) {

    public LoggingConfiguration {
        Objects.requireNonNull(threshold, "threshold");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(clock, "clock");
    }

    public LoggingConfiguration(LogLevel threshold, LogSink sink) {
        this(threshold, sink, Clock.systemUTC());
    }

    public boolean isEnabled(LogLevel level) {
        return level.isAtLeast(threshold);
    }
}
