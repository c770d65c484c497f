package com.ctxlog.lifecycle;

import com.ctxlog.logging.BoundLogger;
import com.ctxlog.logging.LogEvent;
import com.ctxlog.logging.StructuredLoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 애플리케이션 기동 / 종료 이벤트 기록
 */
@Component
public class ApplicationLifecycleLogger {

    private final BoundLogger logger;
    private final String version;

    public ApplicationLifecycleLogger(
            StructuredLoggerFactory loggerFactory,
            @Value("${app.version:1.0.0}") String version
    ) {
        this.logger = loggerFactory.getLogger(ApplicationLifecycleLogger.class);
        this.version = version;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        logger.info(LogEvent.APPLICATION_STARTING, Map.of("version", version));
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        logger.info(LogEvent.APPLICATION_SHUTTING_DOWN);
    }
}
