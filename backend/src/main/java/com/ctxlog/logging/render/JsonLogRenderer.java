package com.ctxlog.logging.render;

import com.ctxlog.logging.LogRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

/**
 * 기계 파싱용 JSON 렌더러 (한 레코드 = 한 줄)
 */
@RequiredArgsConstructor
public class JsonLogRenderer implements LogRenderer {

    private final ObjectMapper objectMapper;

    public JsonLogRenderer() {
        this(new ObjectMapper());
    }

    @Override
    public String render(LogRecord record) {
        try {
            return objectMapper.writeValueAsString(record.toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "unable to render log record event=" + record.event(), e);
        }
    }
}
