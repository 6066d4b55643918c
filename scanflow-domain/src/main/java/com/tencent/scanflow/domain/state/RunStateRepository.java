package com.tencent.scanflow.domain.state;

import java.util.List;
import java.util.Optional;

/**
 * RunStateRepository - 运行元数据与执行状态仓储
 */
public interface RunStateRepository {

    Optional<RunMetadata> findMetadata(String runId);

    void saveMetadata(RunMetadata metadata);

    Optional<ExecutionState> findState(String runId);

    void saveState(ExecutionState state);

    /**
     * 所有运行，按启动时间倒序
     */
    List<RunMetadata> listRuns();
}
