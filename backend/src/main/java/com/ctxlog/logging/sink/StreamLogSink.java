package com.ctxlog.logging.sink;

import com.ctxlog.logging.LogRecord;
import com.ctxlog.logging.render.LogRenderer;
import lombok.RequiredArgsConstructor;

import java.io.PrintStream;

/**
 * stdout / stderr 직접 출력
 * PrintStream.println 은 내부 동기화되어 있어 줄 단위로 섞이지 않음
 */
@RequiredArgsConstructor
public class StreamLogSink implements LogSink {

    private final PrintStream stream;
    private final LogRenderer renderer;

    @Override
    public void write(LogRecord record) {
        stream.println(renderer.render(record));
    }
}
