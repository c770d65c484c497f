package com.ctxlog.exception;

/**
 * /simulate-error 에서 의도적으로 던지는 미처리 예외
 * 어떤 ExceptionHandler 도 잡지 않으므로 Filter 의 실패 경로와 500 응답까지 그대로 전파됨
 */
public class SimulatedErrorException extends RuntimeException {

    public SimulatedErrorException(String message) {
        super(message);
    }
}
