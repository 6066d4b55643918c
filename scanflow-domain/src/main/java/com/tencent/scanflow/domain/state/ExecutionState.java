package com.tencent.scanflow.domain.state;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ExecutionState - 运行的制品状态表
 * <p>
 * 多个工作线程会并发更新不同制品的状态，每次迁移都是针对单个制品的原子比较并替换;
 * 迁移前状态不符合预期时为空操作并返回 false。
 * </p>
 */
public class ExecutionState {

    private final String runId;
    private final String fingerprint;
    private final Map<String, ArtifactStatus> statuses;
    private final Map<String, String> errors;
    private volatile Instant lastCheckpoint;

    private ExecutionState(String runId, String fingerprint, Map<String, ArtifactStatus> statuses,
                           Map<String, String> errors, Instant lastCheckpoint) {
        this.runId = runId;
        this.fingerprint = fingerprint;
        this.statuses = new ConcurrentHashMap<>(statuses);
        this.errors = new ConcurrentHashMap<>(errors);
        this.lastCheckpoint = lastCheckpoint;
    }

    /**
     * 新运行: 所有制品为 NOT_STARTED
     */
    public static ExecutionState fresh(String runId, String fingerprint, Collection<String> artifactIds) {
        Map<String, ArtifactStatus> statuses = new LinkedHashMap<>();
        artifactIds.forEach(id -> statuses.put(id, ArtifactStatus.NOT_STARTED));
        return new ExecutionState(runId, fingerprint, statuses, Collections.emptyMap(), Instant.now());
    }

    /**
     * 从持久化数据恢复
     */
    public static ExecutionState restore(String runId, String fingerprint, Map<String, ArtifactStatus> statuses,
                                         Map<String, String> errors, Instant lastCheckpoint) {
        return new ExecutionState(runId, fingerprint, statuses,
                errors == null ? Collections.emptyMap() : errors, lastCheckpoint);
    }

    public String getRunId() {
        return runId;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public Instant getLastCheckpoint() {
        return lastCheckpoint;
    }

    public ArtifactStatus getStatus(String artifactId) {
        ArtifactStatus status = statuses.get(artifactId);
        if (status == null) {
            throw new IllegalArgumentException("Unknown artifact: " + artifactId);
        }
        return status;
    }

    public String getError(String artifactId) {
        return errors.get(artifactId);
    }

    /**
     * 原子迁移
     */
    public boolean transition(String artifactId, ArtifactStatus expected, ArtifactStatus target) {
        boolean changed = statuses.replace(artifactId, expected, target);
        if (changed) {
            lastCheckpoint = Instant.now();
        }
        return changed;
    }

    public boolean markRunning(String artifactId) {
        return transition(artifactId, ArtifactStatus.NOT_STARTED, ArtifactStatus.RUNNING);
    }

    public boolean markCompleted(String artifactId) {
        return transition(artifactId, ArtifactStatus.RUNNING, ArtifactStatus.COMPLETED);
    }

    public boolean markFailed(String artifactId, String error) {
        boolean changed = transition(artifactId, ArtifactStatus.RUNNING, ArtifactStatus.FAILED)
                || transition(artifactId, ArtifactStatus.NOT_STARTED, ArtifactStatus.FAILED);
        if (changed && error != null) {
            errors.put(artifactId, error);
        }
        return changed;
    }

    public boolean markSkipped(String artifactId, String reason) {
        boolean changed = transition(artifactId, ArtifactStatus.NOT_STARTED, ArtifactStatus.SKIPPED);
        if (changed && reason != null) {
            errors.put(artifactId, reason);
        }
        return changed;
    }

    /**
     * 挂起: 执行中的制品退回 NOT_STARTED，等待显式恢复
     */
    public boolean markPending(String artifactId) {
        return transition(artifactId, ArtifactStatus.RUNNING, ArtifactStatus.NOT_STARTED);
    }

    /**
     * 恢复前重置: FAILED / SKIPPED / 遗留的 RUNNING 重置为 NOT_STARTED，COMPLETED 保持不变
     */
    public void resetForResume() {
        statuses.replaceAll((id, status) -> status == ArtifactStatus.COMPLETED ? status : ArtifactStatus.NOT_STARTED);
        errors.clear();
        lastCheckpoint = Instant.now();
    }

    public Set<String> getArtifactsIn(ArtifactStatus status) {
        Set<String> result = new LinkedHashSet<>();
        statuses.forEach((id, s) -> {
            if (s == status) {
                result.add(id);
            }
        });
        return result;
    }

    public boolean isFullyCompleted() {
        return statuses.values().stream().allMatch(s -> s == ArtifactStatus.COMPLETED);
    }

    public Map<String, ArtifactStatus> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public Map<String, String> errorSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }
}
