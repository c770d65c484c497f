package com.ctxlog.filter;

import com.ctxlog.context.RequestContext;
import com.ctxlog.identity.UserIdentityResolver;
import com.ctxlog.logging.BoundLogger;
import com.ctxlog.logging.LogEvent;
import com.ctxlog.logging.RequestIdGenerator;
import com.ctxlog.logging.StructuredLoggerFactory;
import io.micrometer.core.instrument.Counter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 요청 단위 사용자 컨텍스트를 구조화 로거에 바인딩하는 Filter
 *
 * 1. 헤더에서 사용자 식별 (UserIdentityResolver)
 * 2. request_id 생성 후 {user, route, method, request_id, user_agent} 바인딩
 * 3. 바인딩된 로거를 요청 attribute 에 저장 → 컨트롤러는 BoundLogger 파라미터로 주입받음
 * 4. "Request started" → 체인 실행 → "Request completed" 또는 "Request failed"
 *
 * 핸들러 예외는 기록만 하고 그대로 다시 던진다 (응답 변환은 컨테이너의 표준 에러 처리 몫)
 * 요청/응답 본문은 읽거나 변경하지 않음
 */
public class UserContextFilter extends OncePerRequestFilter {

    public static final String LOGGER_ATTRIBUTE = UserContextFilter.class.getName() + ".LOGGER";
    public static final String CONTEXT_ATTRIBUTE = UserContextFilter.class.getName() + ".CONTEXT";

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final String UNKNOWN_USER_AGENT = "unknown";

    private final UserIdentityResolver identityResolver;
    private final BoundLogger logger;
    private final Counter requestCompletedCounter;
    private final Counter requestFailedCounter;

    public UserContextFilter(
            UserIdentityResolver identityResolver,
            StructuredLoggerFactory loggerFactory,
            Counter requestCompletedCounter,
            Counter requestFailedCounter
    ) {
        this.identityResolver = identityResolver;
        this.logger = loggerFactory.getLogger(UserContextFilter.class);
        this.requestCompletedCounter = requestCompletedCounter;
        this.requestFailedCounter = requestFailedCounter;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        long start = System.nanoTime();

        RequestContext context = new RequestContext(
                identityResolver.resolve(request).orElse(null),
                routeOf(request),
                request.getMethod(),
                RequestIdGenerator.generate(),
                Optional.ofNullable(request.getHeader(HttpHeaders.USER_AGENT))
                        .orElse(UNKNOWN_USER_AGENT)
        );

        BoundLogger requestLogger = logger.bind(context.toLogFields());

        request.setAttribute(CONTEXT_ATTRIBUTE, context);
        request.setAttribute(LOGGER_ATTRIBUTE, requestLogger);

        // 클라이언트가 장애 문의 시 전달할 수 있도록 응답 헤더에도 포함
        response.setHeader(REQUEST_ID_HEADER, context.requestId());

        requestLogger.info(LogEvent.REQUEST_STARTED, Map.of(
                "query_params", queryParams(request.getQueryString())
        ));

        try {
            filterChain.doFilter(request, response);
        } catch (ServletException | IOException | RuntimeException e) {
            Throwable failure = unwrap(e);

            requestFailedCounter.increment();

            requestLogger.error(LogEvent.REQUEST_FAILED, failure, Map.of(
                    "error", Objects.toString(failure.getMessage(), ""),
                    "error_type", failure.getClass().getSimpleName(),
                    "duration_ms", elapsedMillis(start)
            ));

            throw e;
        }

        requestCompletedCounter.increment();

        requestLogger.info(LogEvent.REQUEST_COMPLETED, Map.of(
                "status_code", response.getStatus(),
                "duration_ms", elapsedMillis(start)
        ));
    }

    /**
     * DispatcherServlet 이 감싼 ServletException 을 벗겨 핸들러가 던진 원래 예외를 찾음
     */
    static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof ServletException servletException
                && servletException.getRootCause() != null
                && servletException.getRootCause() != current) {
            current = servletException.getRootCause();
        }
        return current;
    }

    /**
     * 로그용 route - 퍼센트 인코딩을 풀어 기록 (/hello/j%C3%B6rg → /hello/jörg)
     * 잘못된 인코딩이면 원문 그대로 사용
     */
    public static String routeOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        try {
            return UriUtils.decode(uri, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return uri;
        }
    }

    /**
     * 본문(form)을 소비하지 않도록 query string 만 파싱
     *
     * - form 방식 디코딩 ('+' → 공백)
     * - 같은 키가 반복되면 마지막 값 사용
     * - 디코딩 실패 시 원문 유지 (요청을 실패시키지 않음)
     */
    static Map<String, String> queryParams(String queryString) {
        if (queryString == null || queryString.isEmpty()) {
            return Map.of();
        }

        Map<String, String> result = new LinkedHashMap<>();
        for (String pair : queryString.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int separator = pair.indexOf('=');
            String name = separator < 0 ? pair : pair.substring(0, separator);
            String value = separator < 0 ? "" : pair.substring(separator + 1);
            result.put(decodeOrRaw(name), decodeOrRaw(value));
        }
        return result;
    }

    private static String decodeOrRaw(String text) {
        try {
            return URLDecoder.decode(text, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return text;
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
