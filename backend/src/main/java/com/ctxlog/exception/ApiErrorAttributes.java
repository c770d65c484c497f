package com.ctxlog.exception;

import com.ctxlog.context.RequestContext;
import com.ctxlog.filter.UserContextFilter;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.servlet.error.DefaultErrorAttributes;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.WebRequest;

import java.util.Map;

/**
 * 표준 /error 응답 본문 확장
 *
 * - 5xx 응답에는 detail 고정 문구 추가 (내부 예외 메시지 비노출)
 * - 실패한 요청의 request_id 를 함께 내려 로그와 대조 가능하게 함
 *
 * 예외 변환은 하지 않는다. 핸들러 예외는 UserContextFilter 가 기록한 뒤
 * 컨테이너의 에러 디스패치를 통해 여기까지 도달한다.
 */
@Component
public class ApiErrorAttributes extends DefaultErrorAttributes {

    static final String DETAIL_KEY = "detail";
    static final String INTERNAL_ERROR_DETAIL = "Internal server error";

    @Override
    public Map<String, Object> getErrorAttributes(WebRequest webRequest, ErrorAttributeOptions options) {
        Map<String, Object> attributes = super.getErrorAttributes(webRequest, options);

        if (attributes.get("status") instanceof Integer status && status >= 500) {
            attributes.put(DETAIL_KEY, INTERNAL_ERROR_DETAIL);
        }

        Object context = webRequest.getAttribute(
                UserContextFilter.CONTEXT_ATTRIBUTE,
                RequestAttributes.SCOPE_REQUEST
        );
        if (context instanceof RequestContext requestContext) {
            attributes.put(RequestContext.REQUEST_ID, requestContext.requestId());
        }

        return attributes;
    }
}
