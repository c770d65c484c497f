package com.ctxlog.logging;

public final class LogEvent {

    private LogEvent() {
        // 인스턴스 생성 방지
    }

    /** 요청 진입 (UserContextFilter) */
    public static final String REQUEST_STARTED = "Request started";

    /** 요청 정상 종료 */
    public static final String REQUEST_COMPLETED = "Request completed";

    /** 핸들러 예외로 인한 요청 실패 */
    public static final String REQUEST_FAILED = "Request failed";

    public static final String ROOT_ACCESSED = "Root endpoint accessed";

    public static final String HELLO_ACCESSED = "Hello endpoint accessed";

    public static final String PROTECTED_ACCESSED = "Protected endpoint accessed";

    public static final String USER_INFO_REQUESTED = "User info requested";

    public static final String ERROR_SIMULATION_REQUESTED = "Error simulation requested";

    public static final String SIMULATION_PROCESSING = "Processing simulation";

    public static final String SIMULATED_ERROR = "Simulated error occurred";

    public static final String HEALTH_CHECKED = "Health check performed";

    public static final String APPLICATION_STARTING = "Application starting up";

    public static final String APPLICATION_SHUTTING_DOWN = "Application shutting down";

    /** Basic 인증 헤더 형식 오류 (SLF4J 진단 로그용) */
    public static final String INVALID_BASIC_AUTH = "INVALID_BASIC_AUTH";

    /** 구조화 로깅 설정 완료 (SLF4J 진단 로그용) */
    public static final String LOGGING_CONFIGURED = "LOGGING_CONFIGURED";

}
