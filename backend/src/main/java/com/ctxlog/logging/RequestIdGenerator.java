package com.ctxlog.logging;

import java.util.UUID;

/**
 * 요청 단위 request_id 생성
 */
public final class RequestIdGenerator {

    private RequestIdGenerator() {
    }

    /**
     * 하이픈 없는 32자리 hex 문자열
     */
    public static String generate() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
