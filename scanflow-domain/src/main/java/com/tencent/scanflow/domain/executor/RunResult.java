package com.tencent.scanflow.domain.executor;

import com.tencent.scanflow.domain.state.ArtifactStatus;
import com.tencent.scanflow.domain.state.RunStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * RunResult - 一次 run / resume 调用的结果
 * <p>
 * 普通的组件失败不会抛出异常，而是体现在各制品的状态中。
 * </p>
 */
@Value
@Builder
public class RunResult {

    String runId;

    RunStatus status;

    /**
     * 本次调用开始时间
     */
    Instant startedAt;

    Duration duration;

    /**
     * 制品 ID -> 最终状态
     */
    Map<String, ArtifactStatus> artifactStatuses;

    /**
     * 制品 ID -> 失败或跳过原因
     */
    Map<String, String> errors;

    /**
     * 本次调用中返回挂起信号的制品
     */
    @Builder.Default
    Set<String> pendingArtifacts = Collections.emptySet();

    /**
     * 对外名称 -> 内部制品 ID
     */
    @Builder.Default
    Map<String, String> aliases = Collections.emptyMap();

    public Set<String> completed() {
        return in(ArtifactStatus.COMPLETED);
    }

    public Set<String> failed() {
        return in(ArtifactStatus.FAILED);
    }

    public Set<String> skipped() {
        return in(ArtifactStatus.SKIPPED);
    }

    public Set<String> pending() {
        return pendingArtifacts;
    }

    /**
     * 按制品 ID 或别名查询状态
     */
    public ArtifactStatus statusOf(String idOrAlias) {
        return artifactStatuses.get(aliases.getOrDefault(idOrAlias, idOrAlias));
    }

    private Set<String> in(ArtifactStatus status) {
        Set<String> result = new LinkedHashSet<>();
        artifactStatuses.forEach((id, s) -> {
            if (s == status) {
                result.add(id);
            }
        });
        return result;
    }
}
