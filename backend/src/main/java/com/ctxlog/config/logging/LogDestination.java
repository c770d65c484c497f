package com.ctxlog.config.logging;

public enum LogDestination {

    /** Logback "structured" 로거 경유 (기본값) */
    SLF4J,

    STDOUT,

    STDERR
}
