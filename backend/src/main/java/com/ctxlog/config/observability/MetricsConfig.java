package com.ctxlog.config.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 관측 메트릭 정의
 * - 요청 종료 상태별 Counter 를 명시적으로 등록
 */
@Configuration
public class MetricsConfig {

    /**
     * 모든 메트릭에 공통 tag 부여
     */
    @Bean
    MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
                .commonTags("service", "context-logging-backend");
    }

    /**
     * 정상 종료된 요청 누적 카운터 (status 와 무관)
     */
    @Bean
    public Counter requestCompletedCounter(MeterRegistry registry) {
        return Counter.builder("http_requests_completed_total")
                .description("Total requests that returned from the handler chain")
                .register(registry);
    }

    /**
     * 핸들러 예외로 실패한 요청 누적 카운터
     */
    @Bean
    public Counter requestFailedCounter(MeterRegistry registry) {
        return Counter.builder("http_requests_failed_total")
                .description("Total requests that failed with an unhandled exception")
                .register(registry);
    }
}
