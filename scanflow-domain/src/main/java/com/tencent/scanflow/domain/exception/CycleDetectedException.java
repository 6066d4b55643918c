package com.tencent.scanflow.domain.exception;

import java.util.List;

/**
 * 制品级依赖环，{@link #getCycle()} 按发现顺序给出环上的制品，首尾相同
 */
public class CycleDetectedException extends PlanningException {

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super(ErrorCode.CYCLE_DETECTED, "Cycle detected in artifact dependencies: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
