package com.ctxlog.config.filter;

import com.ctxlog.filter.UserContextFilter;
import com.ctxlog.identity.UserIdentityResolver;
import com.ctxlog.logging.StructuredLoggerFactory;
import io.micrometer.core.instrument.Counter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Filter 실행 순서를 명시적으로 고정
 *
 * 1. UserContextFilter : 요청 진입 시 사용자 식별 + 요청 로거 바인딩
 *
 * 로직은 Filter 에 두고, 이 클래스는 "순서"만 책임
 */
@Configuration
public class FilterOrderConfig {

    @Bean
    public FilterRegistrationBean<UserContextFilter> userContextFilterRegistration(
            UserIdentityResolver userIdentityResolver,
            StructuredLoggerFactory structuredLoggerFactory,
            Counter requestCompletedCounter,
            Counter requestFailedCounter
    ) {

        UserContextFilter filter =
                new UserContextFilter(
                        userIdentityResolver,
                        structuredLoggerFactory,
                        requestCompletedCounter,
                        requestFailedCounter
                );

        FilterRegistrationBean<UserContextFilter> registration =
                new FilterRegistrationBean<>();

        registration.setFilter(filter);

        // 다른 어떤 Filter 보다 먼저 요청 로거가 준비되어야 함
        registration.setOrder(1);

        return registration;
    }
}
