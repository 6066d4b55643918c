package com.tencent.scanflow.domain.exception;

public class RunNotFoundException extends RunLifecycleException {

    public RunNotFoundException(String runId) {
        super(ErrorCode.RUN_NOT_FOUND, runId, String.format("Run '%s' not found", runId));
    }
}
