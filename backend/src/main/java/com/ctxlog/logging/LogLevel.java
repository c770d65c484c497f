package com.ctxlog.logging;

import java.util.Locale;

/**
 * 구조화 로그 심각도
 * - 선언 순서가 곧 심각도 순서 (DEBUG < INFO < WARNING < ERROR)
 */
public enum LogLevel {

    DEBUG,
    INFO,
    WARNING,
    ERROR;

    /**
     * threshold 이상인 경우에만 출력 대상
     */
    public boolean isAtLeast(LogLevel threshold) {
        return compareTo(threshold) >= 0;
    }

    // 로그 레코드에는 소문자로 기록 (debug / info / warning / error)
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
