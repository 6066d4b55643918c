package com.tencent.scanflow.domain.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * RunMetadata - 运行元数据
 * <p>
 * 首次执行某个 runId 时创建，执行结束时记录终态。
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RunMetadata {

    /**
     * 运行 ID
     */
    private String runId;

    /**
     * 运行手册名称
     */
    private String runbookName;

    /**
     * 执行计划指纹 (sha256:...)
     */
    private String fingerprint;

    /**
     * 运行状态
     */
    private RunStatus status;

    /**
     * 首次启动时间
     */
    private Instant startedAt;

    /**
     * 最近一次结束时间，执行中为空
     */
    private Instant completedAt;

    public boolean isActive() {
        return status == RunStatus.ACTIVE;
    }
}
