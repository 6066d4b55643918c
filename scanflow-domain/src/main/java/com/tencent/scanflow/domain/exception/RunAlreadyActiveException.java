package com.tencent.scanflow.domain.exception;

public class RunAlreadyActiveException extends RunLifecycleException {

    public RunAlreadyActiveException(String runId) {
        super(ErrorCode.RUN_ALREADY_ACTIVE, runId,
                String.format("Run '%s' is still active and cannot be started again", runId));
    }
}
