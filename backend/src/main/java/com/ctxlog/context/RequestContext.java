package com.ctxlog.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 요청 한 건의 컨텍스트
 *
 * - UserContextFilter 가 생성하고 요청 attribute 로만 보관 (요청 간 공유 없음)
 * - user 가 null 이면 익명 요청 ("anonymous" 같은 대체 문자열을 쓰지 않음)
 */
public record RequestContext(
        String user,
        String route,
        String method,
        String requestId,
        String userAgent
) {

    public static final String USER = "user";
    public static final String ROUTE = "route";
    public static final String METHOD = "method";
    public static final String REQUEST_ID = "request_id";
    public static final String USER_AGENT = "user_agent";

    public Optional<String> currentUser() {
        return Optional.ofNullable(user);
    }

    /**
     * 로거에 바인딩할 필드
     * 익명 요청이면 user 키 자체를 넣지 않음
     */
    public Map<String, Object> toLogFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (user != null) {
            fields.put(USER, user);
        }
        fields.put(ROUTE, route);
        fields.put(METHOD, method);
        fields.put(REQUEST_ID, requestId);
        fields.put(USER_AGENT, userAgent);
        return fields;
    }
}
