package com.ctxlog.config.web;

import com.ctxlog.logging.StructuredLoggerFactory;
import com.ctxlog.web.BoundLoggerArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final StructuredLoggerFactory structuredLoggerFactory;

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new BoundLoggerArgumentResolver(structuredLoggerFactory));
    }
}
