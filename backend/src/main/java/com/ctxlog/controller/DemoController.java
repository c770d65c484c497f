package com.ctxlog.controller;

import com.ctxlog.context.RequestContext;
import com.ctxlog.exception.SimulatedErrorException;
import com.ctxlog.logging.BoundLogger;
import com.ctxlog.logging.LogEvent;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 요청 로거 사용 예시 API
 * 모든 메서드는 UserContextFilter 가 바인딩한 BoundLogger 를 파라미터로 받는다
 */
@RestController
public class DemoController {

    static final String ANONYMOUS = "anonymous";

    @GetMapping("/")
    public Map<String, String> root(BoundLogger log) {
        log.info(LogEvent.ROOT_ACCESSED);
        return Map.of("message", "Welcome to the Context Logging Demo");
    }

    @GetMapping("/hello/{name}")
    public Map<String, String> hello(@PathVariable String name, BoundLogger log) {
        log.info(LogEvent.HELLO_ACCESSED, Map.of("target_name", name));
        return Map.of("message", "Hello, " + name + "!");
    }

    /**
     * 보호 리소스 (관례상) - 식별 헤더가 없어도 접근 가능
     */
    @GetMapping("/protected")
    public Map<String, String> protectedResource(BoundLogger log) {
        log.info(LogEvent.PROTECTED_ACCESSED);
        return Map.of(
                "message", "This is a protected resource",
                "status", "authenticated"
        );
    }

    /**
     * 로거에 바인딩된 컨텍스트를 그대로 노출
     * user 가 바인딩되지 않은 익명 요청은 응답에서만 "anonymous" 로 표시
     */
    @GetMapping("/user-info")
    public Map<String, Object> userInfo(HttpServletRequest request, BoundLogger log) {
        Map<String, Object> context = log.context();
        String user = String.valueOf(context.getOrDefault(RequestContext.USER, ANONYMOUS));

        log.info(LogEvent.USER_INFO_REQUESTED, Map.of("requested_user", user));

        // request_id 는 Filter 를 거치지 않은 경우 없을 수 있어 null 허용 Map 사용
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user", user);
        body.put("request_id", context.get(RequestContext.REQUEST_ID));
        body.put("path", request.getRequestURI());
        body.put("method", request.getMethod());
        return body;
    }

    @PostMapping("/simulate-error")
    public Map<String, String> simulateError(BoundLogger log) {
        log.warning(LogEvent.ERROR_SIMULATION_REQUESTED);
        log.info(LogEvent.SIMULATION_PROCESSING);

        SimulatedErrorException error =
                new SimulatedErrorException("This is a simulated error for testing logging");

        log.error(LogEvent.SIMULATED_ERROR, Map.of("error_details", error.getMessage()));

        throw error;
    }
}
