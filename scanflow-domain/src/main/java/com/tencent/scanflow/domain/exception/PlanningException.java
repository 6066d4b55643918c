package com.tencent.scanflow.domain.exception;

/**
 * PlanningException - 规划期异常
 * <p>
 * 均在任何制品执行之前抛出，规划失败即终止。
 * </p>
 */
public abstract class PlanningException extends OrchestrationException {

    protected PlanningException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    protected PlanningException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
