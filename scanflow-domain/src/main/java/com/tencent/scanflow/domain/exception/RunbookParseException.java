package com.tencent.scanflow.domain.exception;

public class RunbookParseException extends PlanningException {

    public RunbookParseException(String message) {
        super(ErrorCode.RUNBOOK_PARSE_ERROR, message);
    }

    public RunbookParseException(String message, Throwable cause) {
        super(ErrorCode.RUNBOOK_PARSE_ERROR, message, cause);
    }
}
