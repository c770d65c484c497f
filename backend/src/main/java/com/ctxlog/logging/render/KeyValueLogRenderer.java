package com.ctxlog.logging.render;

import com.ctxlog.logging.LogRecord;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * 사람이 읽기 쉬운 key=value 렌더러
 *
 * 예: event="Request started" level=info logger=com.ctxlog.filter.UserContextFilter user=alice
 */
public class KeyValueLogRenderer implements LogRenderer {

    @Override
    public String render(LogRecord record) {
        return record.toMap().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + formatValue(entry.getValue()))
                .collect(Collectors.joining(" "));
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }

        String text = value instanceof Map<?, ?> map
                ? map.entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(",", "{", "}"))
                : String.valueOf(value);

        if (text.isEmpty() || needsQuoting(text)) {
            return "\"" + text
                    .replace("\\", "\\\\")
                    .replace("\"", "\\\"")
                    .replace("\r", "\\r")
                    .replace("\n", "\\n") + "\"";
        }
        return text;
    }

    private static boolean needsQuoting(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '=') {
                return true;
            }
        }
        return false;
    }
}
