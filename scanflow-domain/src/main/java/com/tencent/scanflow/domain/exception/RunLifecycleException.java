package com.tencent.scanflow.domain.exception;

/**
 * RunLifecycleException - 运行生命周期异常
 * <p>
 * 仅在运行无法开始或无法恢复时抛出。
 * </p>
 */
public abstract class RunLifecycleException extends OrchestrationException {

    private final String runId;

    protected RunLifecycleException(ErrorCode errorCode, String runId, String message) {
        super(errorCode, message);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
