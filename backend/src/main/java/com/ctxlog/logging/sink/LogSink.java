package com.ctxlog.logging.sink;

import com.ctxlog.logging.LogRecord;

/**
 * 구조화 로그 레코드의 최종 출력 대상
 * 구현체는 여러 요청 스레드에서 동시에 호출될 수 있음
 */
public interface LogSink {

    void write(LogRecord record);
}
