package com.tencent.scanflow.app.assembler;

import com.tencent.scanflow.client.dto.RunSummaryDTO;
import com.tencent.scanflow.domain.executor.RunResult;
import com.tencent.scanflow.domain.plan.ExecutionPlan;
import com.tencent.scanflow.domain.state.ArtifactStatus;
import com.tencent.scanflow.domain.state.ExecutionState;
import com.tencent.scanflow.domain.state.RunMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 领域对象 -> RunSummaryDTO
 */
public final class RunAssembler {

    private RunAssembler() {
    }

    public static RunSummaryDTO toSummary(RunMetadata metadata, RunResult result, ExecutionPlan plan) {
        List<String> outputs = plan.getRunbook().getArtifacts().entrySet().stream()
                .filter(entry -> entry.getValue().isOutput())
                .map(entry -> plan.getReversedAliases().getOrDefault(entry.getKey(), entry.getKey()))
                .collect(Collectors.toList());
        return RunSummaryDTO.builder()
                .runId(result.getRunId())
                .runbookName(metadata.getRunbookName())
                .status(lower(result.getStatus()))
                .fingerprint(metadata.getFingerprint())
                .startedAt(metadata.getStartedAt())
                .completedAt(metadata.getCompletedAt())
                .artifacts(statuses(result.getArtifactStatuses()))
                .errors(new LinkedHashMap<>(result.getErrors()))
                .aliases(new LinkedHashMap<>(result.getAliases()))
                .outputs(outputs)
                .build();
    }

    /**
     * 查询场景没有执行计划，aliases 与 outputs 为空
     */
    public static RunSummaryDTO toSummary(RunMetadata metadata, ExecutionState state) {
        return RunSummaryDTO.builder()
                .runId(metadata.getRunId())
                .runbookName(metadata.getRunbookName())
                .status(lower(metadata.getStatus()))
                .fingerprint(metadata.getFingerprint())
                .startedAt(metadata.getStartedAt())
                .completedAt(metadata.getCompletedAt())
                .artifacts(state == null ? Collections.emptyMap() : statuses(state.snapshot()))
                .errors(state == null ? Collections.emptyMap() : new LinkedHashMap<>(state.errorSnapshot()))
                .aliases(Collections.emptyMap())
                .outputs(Collections.emptyList())
                .build();
    }

    private static Map<String, String> statuses(Map<String, ArtifactStatus> statuses) {
        Map<String, String> result = new LinkedHashMap<>();
        statuses.forEach((id, status) -> result.put(id, lower(status)));
        return result;
    }

    private static String lower(Enum<?> value) {
        return value == null ? null : value.name().toLowerCase(Locale.ROOT);
    }
}
