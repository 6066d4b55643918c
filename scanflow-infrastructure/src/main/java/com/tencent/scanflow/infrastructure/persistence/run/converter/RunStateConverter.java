package com.tencent.scanflow.infrastructure.persistence.run.converter;

import com.tencent.scanflow.domain.state.ArtifactStatus;
import com.tencent.scanflow.domain.state.ExecutionState;
import com.tencent.scanflow.domain.state.RunMetadata;
import com.tencent.scanflow.domain.state.RunStatus;
import com.tencent.scanflow.infrastructure.persistence.run.entity.ExecutionStateDO;
import com.tencent.scanflow.infrastructure.persistence.run.entity.RunMetadataDO;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RunStateConverter - 运行状态领域对象与数据对象转换
 *
 * @author scanflow
 */
public final class RunStateConverter {

    private RunStateConverter() {
    }

    public static RunMetadataDO toDataObject(RunMetadata metadata) {
        RunMetadataDO dataObject = new RunMetadataDO();
        copy(metadata, dataObject);
        return dataObject;
    }

    /**
     * 覆盖已有数据对象的可变字段，保留主键
     */
    public static void copy(RunMetadata metadata, RunMetadataDO target) {
        target.setRunId(metadata.getRunId());
        target.setRunbookName(metadata.getRunbookName());
        target.setFingerprint(metadata.getFingerprint());
        target.setStatus(metadata.getStatus() == null ? null : metadata.getStatus().name());
        target.setStartedAt(metadata.getStartedAt());
        target.setCompletedAt(metadata.getCompletedAt());
    }

    public static RunMetadata toDomain(RunMetadataDO dataObject) {
        return RunMetadata.builder()
                .runId(dataObject.getRunId())
                .runbookName(dataObject.getRunbookName())
                .fingerprint(dataObject.getFingerprint())
                .status(dataObject.getStatus() == null ? null : RunStatus.valueOf(dataObject.getStatus()))
                .startedAt(dataObject.getStartedAt())
                .completedAt(dataObject.getCompletedAt())
                .build();
    }

    public static void copy(ExecutionState state, ExecutionStateDO target) {
        Map<String, String> statuses = new LinkedHashMap<>();
        state.snapshot().forEach((id, status) -> statuses.put(id, status.name()));
        target.setRunId(state.getRunId());
        target.setFingerprint(state.getFingerprint());
        target.setStatuses(statuses);
        target.setErrors(new LinkedHashMap<>(state.errorSnapshot()));
        target.setLastCheckpoint(state.getLastCheckpoint());
    }

    public static ExecutionState toDomain(ExecutionStateDO dataObject) {
        Map<String, ArtifactStatus> statuses = new LinkedHashMap<>();
        if (dataObject.getStatuses() != null) {
            dataObject.getStatuses().forEach((id, status) -> statuses.put(id, ArtifactStatus.valueOf(status)));
        }
        return ExecutionState.restore(dataObject.getRunId(), dataObject.getFingerprint(), statuses,
                dataObject.getErrors(), dataObject.getLastCheckpoint());
    }
}
