package com.tencent.scanflow.adapter.web;

import com.tencent.scanflow.client.dto.Response;
import com.tencent.scanflow.domain.exception.OrchestrationException;
import com.tencent.scanflow.domain.exception.PlanningException;
import com.tencent.scanflow.domain.exception.RunLifecycleException;
import com.tencent.scanflow.domain.exception.RunNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 错误码到 HTTP 状态的映射: 规划错误 400，运行不存在 404，其余运行生命周期冲突 409
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(PlanningException.class)
    public ResponseEntity<Response> handlePlanning(PlanningException e) {
        log.warn("Planning failed: {}", e.getMessage());
        return failure(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<Response> handleNotFound(RunNotFoundException e) {
        return failure(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(RunLifecycleException.class)
    public ResponseEntity<Response> handleLifecycle(RunLifecycleException e) {
        log.warn("Run [{}] rejected: {}", e.getRunId(), e.getMessage());
        return failure(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<Response> handleOrchestration(OrchestrationException e) {
        log.error("Orchestration error", e);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Response> handleInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(Response.buildFailure(INVALID_REQUEST, message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Response> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Response.buildFailure(INVALID_REQUEST, e.getMessage()));
    }

    private static ResponseEntity<Response> failure(HttpStatus status, OrchestrationException e) {
        return ResponseEntity.status(status)
                .body(Response.buildFailure(e.getErrorCode().getCode(), e.getMessage()));
    }
}
