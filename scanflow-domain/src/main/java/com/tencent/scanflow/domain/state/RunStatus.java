package com.tencent.scanflow.domain.state;

/**
 * RunStatus - 运行状态
 */
public enum RunStatus {

    /**
     * 执行中，同一 runId 不允许再次启动
     */
    ACTIVE("执行中"),

    /**
     * 所有制品均已完成
     */
    COMPLETED("已完成"),

    /**
     * 存在挂起 (pending) 的制品，可恢复
     */
    INTERRUPTED("已中断"),

    /**
     * 存在失败的制品
     */
    FAILED("失败");

    private final String description;

    RunStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
