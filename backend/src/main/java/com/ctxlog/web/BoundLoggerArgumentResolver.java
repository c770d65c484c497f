package com.ctxlog.web;

import com.ctxlog.context.RequestContext;
import com.ctxlog.filter.UserContextFilter;
import com.ctxlog.logging.BoundLogger;
import com.ctxlog.logging.StructuredLoggerFactory;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Map;

/**
 * 컨트롤러 메서드의 BoundLogger 파라미터에 요청 로거를 주입
 *
 * - UserContextFilter 가 저장한 요청 attribute 를 그대로 전달 (ThreadLocal / MDC 미사용)
 * - Filter 를 거치지 않은 요청이면 route / method 만 바인딩한 로거로 대체
 */
@RequiredArgsConstructor
public class BoundLoggerArgumentResolver implements HandlerMethodArgumentResolver {

    static final String FALLBACK_LOGGER_NAME = "com.ctxlog.web.request";

    private final StructuredLoggerFactory loggerFactory;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return BoundLogger.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory
    ) {
        Object bound = webRequest.getAttribute(
                UserContextFilter.LOGGER_ATTRIBUTE,
                RequestAttributes.SCOPE_REQUEST
        );

        if (bound instanceof BoundLogger requestLogger) {
            return requestLogger;
        }

        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request == null) {
            return loggerFactory.getLogger(FALLBACK_LOGGER_NAME);
        }

        return loggerFactory.getLogger(FALLBACK_LOGGER_NAME).bind(Map.of(
                RequestContext.ROUTE, UserContextFilter.routeOf(request),
                RequestContext.METHOD, request.getMethod()
        ));
    }
}
