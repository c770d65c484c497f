package com.ctxlog.config.logging;

import com.ctxlog.config.identity.IdentityProperties;
import com.ctxlog.logging.LogEvent;
import com.ctxlog.logging.LoggingConfiguration;
import com.ctxlog.logging.StructuredLoggerFactory;
import com.ctxlog.logging.render.JsonLogRenderer;
import com.ctxlog.logging.render.KeyValueLogRenderer;
import com.ctxlog.logging.render.LogRenderer;
import com.ctxlog.logging.sink.LogSink;
import com.ctxlog.logging.sink.Slf4jLogSink;
import com.ctxlog.logging.sink.StreamLogSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 구조화 로깅 구성
 *
 * - properties → renderer / sink → LoggingConfiguration → StructuredLoggerFactory 순서로 조립
 * - 테스트에서는 @Primary LogSink 빈으로 sink 만 교체 가능
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({StructuredLoggingProperties.class, IdentityProperties.class})
public class StructuredLoggingConfig {

    @Bean
    public LogRenderer logRenderer(
            StructuredLoggingProperties properties,
            ObjectProvider<ObjectMapper> objectMapper
    ) {
        return switch (properties.getFormat()) {
            case JSON -> new JsonLogRenderer(objectMapper.getIfAvailable(ObjectMapper::new));
            case KEY_VALUE -> new KeyValueLogRenderer();
        };
    }

    @Bean
    public LogSink logSink(StructuredLoggingProperties properties, LogRenderer logRenderer) {
        return switch (properties.getDestination()) {
            case SLF4J -> new Slf4jLogSink(logRenderer);
            case STDOUT -> new StreamLogSink(System.out, logRenderer);
            case STDERR -> new StreamLogSink(System.err, logRenderer);
        };
    }

    @Bean
    public LoggingConfiguration loggingConfiguration(
            StructuredLoggingProperties properties,
            LogSink logSink
    ) {
        log.info(
                "event={} format={} level={} destination={} sink={}",
                LogEvent.LOGGING_CONFIGURED,
                properties.getFormat(),
                properties.getLevel(),
                properties.getDestination(),
                logSink.getClass().getSimpleName()
        );

        return new LoggingConfiguration(properties.getLevel(), logSink, Clock.systemUTC());
    }

    @Bean
    public StructuredLoggerFactory structuredLoggerFactory(LoggingConfiguration loggingConfiguration) {
        return new StructuredLoggerFactory(loggingConfiguration);
    }
}
