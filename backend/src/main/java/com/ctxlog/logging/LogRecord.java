package com.ctxlog.logging;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 구조화 로그 한 건
 *
 * - event / level / logger / timestamp 는 필수 필드
 * - fields 는 바인딩된 컨텍스트 + 호출 시점 필드가 병합된 값
 */
public record LogRecord(
        String event,
        LogLevel level,
        String logger,
        Instant timestamp,
        Map<String, Object> fields
) {

    public static final String EVENT_KEY = "event";
    public static final String LEVEL_KEY = "level";
    public static final String LOGGER_KEY = "logger";
    public static final String TIMESTAMP_KEY = "timestamp";

    // ISO-8601, UTC, 마이크로초 고정 자릿수
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'")
                    .withZone(ZoneOffset.UTC);

    public LogRecord {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(logger, "logger");
        Objects.requireNonNull(timestamp, "timestamp");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String formattedTimestamp() {
        return TIMESTAMP_FORMAT.format(timestamp);
    }

    public Object field(String key) {
        return fields.get(key);
    }

    /**
     * 렌더링용 평탄화 Map
     * 필수 필드가 먼저 오고, 같은 이름의 일반 필드는 필수 필드를 덮어쓰지 못함
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(EVENT_KEY, event);
        map.put(LEVEL_KEY, level.label());
        map.put(LOGGER_KEY, logger);
        map.put(TIMESTAMP_KEY, formattedTimestamp());
        fields.forEach(map::putIfAbsent);
        return map;
    }
}
