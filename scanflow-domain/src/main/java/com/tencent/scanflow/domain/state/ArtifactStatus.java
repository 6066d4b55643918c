package com.tencent.scanflow.domain.state;

/**
 * ArtifactStatus - 制品执行状态
 */
public enum ArtifactStatus {

    NOT_STARTED("未开始"),

    RUNNING("执行中"),

    COMPLETED("已完成"),

    FAILED("失败"),

    /**
     * 上游失败，未执行
     */
    SKIPPED("已跳过");

    private final String description;

    ArtifactStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
