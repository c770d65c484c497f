package com.ctxlog.logging.sink;

import com.ctxlog.logging.LogRecord;
import com.ctxlog.logging.render.LogRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 렌더링된 한 줄을 SLF4J 전용 로거("structured")로 전달
 * 출력 형식(%msg%n)과 appender 는 logback-spring.xml 에서 결정
 */
public class Slf4jLogSink implements LogSink {

    public static final String LOGGER_NAME = "structured";

    private final LogRenderer renderer;
    private final Logger delegate;

    public Slf4jLogSink(LogRenderer renderer) {
        this(renderer, LoggerFactory.getLogger(LOGGER_NAME));
    }

    Slf4jLogSink(LogRenderer renderer, Logger delegate) {
        this.renderer = renderer;
        this.delegate = delegate;
    }

    @Override
    public void write(LogRecord record) {
        String line = renderer.render(record);

        switch (record.level()) {
            case DEBUG -> delegate.debug(line);
            case INFO -> delegate.info(line);
            case WARNING -> delegate.warn(line);
            case ERROR -> delegate.error(line);
        }
    }
}
