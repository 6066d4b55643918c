package com.tencent.scanflow.domain.exception;

import java.util.List;

/**
 * 运行手册自包含 (直接或间接)，{@link #getChain()} 为包含链
 */
public class CircularRunbookException extends PlanningException {

    private final List<String> chain;

    public CircularRunbookException(List<String> chain) {
        super(ErrorCode.CIRCULAR_RUNBOOK, "Circular runbook reference: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() {
        return chain;
    }
}
