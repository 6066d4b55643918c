package com.tencent.scanflow.domain.exception;

/**
 * OrchestrationException - 编排引擎异常基类
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorCode errorCode;

    public OrchestrationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OrchestrationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
