package com.ctxlog.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 컨텍스트 필드가 바인딩된 구조화 로거 핸들
 *
 * <p>불변 객체. {@link #bind(Map)} 는 새 핸들을 반환하고 기존 핸들은 그대로 둔다.
 * A 를 바인딩한 뒤 B 를 바인딩한 결과는 A∪B 를 한 번에 바인딩한 결과와 같다 (키 충돌 시 B 우선).
 *
 * <p>호출 시점 필드는 같은 이름의 바인딩 필드를 해당 이벤트에 한해서만 덮어쓴다.
 */
public final class BoundLogger {

    /** error(event, Throwable, ...) 호출 시 스택 트레이스가 담기는 필드 */
    public static final String EXCEPTION_KEY = "exception";

    private final String name;
    private final Map<String, Object> context;
    private final LoggingConfiguration configuration;

    BoundLogger(String name, Map<String, Object> context, LoggingConfiguration configuration) {
        this.name = Objects.requireNonNull(name, "name");
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public String name() {
        return name;
    }

    /**
     * 현재 바인딩된 필드 (읽기 전용)
     */
    public Map<String, Object> context() {
        return context;
    }

    public BoundLogger bind(String key, Object value) {
        return bind(Map.of(key, value));
    }

    /**
     * fields 를 추가 바인딩한 새 핸들 반환
     * null 값은 허용하지 않음 (값이 없으면 키 자체를 바인딩하지 않는다)
     */
    public BoundLogger bind(Map<String, ?> fields) {
        Map<String, Object> merged = new LinkedHashMap<>(context);
        fields.forEach((key, value) -> merged.put(
                Objects.requireNonNull(key, "key"),
                Objects.requireNonNull(value, () -> "value of " + key)
        ));
        return new BoundLogger(name, merged, configuration);
    }

    public void debug(String event) {
        log(LogLevel.DEBUG, event, Map.of());
    }

    public void debug(String event, Map<String, ?> fields) {
        log(LogLevel.DEBUG, event, fields);
    }

    public void info(String event) {
        log(LogLevel.INFO, event, Map.of());
    }

    public void info(String event, Map<String, ?> fields) {
        log(LogLevel.INFO, event, fields);
    }

    public void warning(String event) {
        log(LogLevel.WARNING, event, Map.of());
    }

    public void warning(String event, Map<String, ?> fields) {
        log(LogLevel.WARNING, event, fields);
    }

    public void error(String event) {
        log(LogLevel.ERROR, event, Map.of());
    }

    public void error(String event, Map<String, ?> fields) {
        log(LogLevel.ERROR, event, fields);
    }

    /**
     * 예외 스택 트레이스를 exception 필드로 함께 기록
     */
    public void error(String event, Throwable failure, Map<String, ?> fields) {
        if (!configuration.isEnabled(LogLevel.ERROR)) {
            return;
        }
        Map<String, Object> withTrace = new LinkedHashMap<>(fields);
        withTrace.put(EXCEPTION_KEY, stackTraceOf(failure));
        log(LogLevel.ERROR, event, withTrace);
    }

    public void log(LogLevel level, String event, Map<String, ?> fields) {
        // threshold 미만은 레코드 생성 전에 폐기
        if (!configuration.isEnabled(level)) {
            return;
        }

        Map<String, Object> merged = new LinkedHashMap<>(context);
        merged.putAll(fields);

        configuration.sink().write(new LogRecord(
                event,
                level,
                name,
                configuration.clock().instant(),
                merged
        ));
    }

    private static String stackTraceOf(Throwable failure) {
        StringWriter writer = new StringWriter();
        failure.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
