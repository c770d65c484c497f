package com.ctxlog.logging.render;

import com.ctxlog.logging.LogRecord;

/**
 * LogRecord 를 한 줄 문자열로 변환
 */
public interface LogRenderer {

    String render(LogRecord record);
}
