package com.tencent.scanflow.domain.exception;

public class RunbookChangedException extends RunLifecycleException {

    private final String storedFingerprint;
    private final String currentFingerprint;

    public RunbookChangedException(String runId, String storedFingerprint, String currentFingerprint) {
        super(ErrorCode.RUNBOOK_CHANGED, runId,
                String.format("Runbook changed since run '%s' started (stored %s, current %s)",
                        runId, storedFingerprint, currentFingerprint));
        this.storedFingerprint = storedFingerprint;
        this.currentFingerprint = currentFingerprint;
    }

    public String getStoredFingerprint() {
        return storedFingerprint;
    }

    public String getCurrentFingerprint() {
        return currentFingerprint;
    }
}
