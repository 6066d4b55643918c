package com.tencent.scanflow.domain.state;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryRunStateRepository - 内存运行状态仓储
 * <p>
 * 保存副本，调用方持有的对象后续修改不会影响已保存的数据。
 * </p>
 */
public class InMemoryRunStateRepository implements RunStateRepository {

    private final Map<String, RunMetadata> metadata = new ConcurrentHashMap<>();
    private final Map<String, ExecutionState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<RunMetadata> findMetadata(String runId) {
        return Optional.ofNullable(metadata.get(runId)).map(InMemoryRunStateRepository::copy);
    }

    @Override
    public void saveMetadata(RunMetadata runMetadata) {
        metadata.put(runMetadata.getRunId(), copy(runMetadata));
    }

    @Override
    public Optional<ExecutionState> findState(String runId) {
        return Optional.ofNullable(states.get(runId)).map(InMemoryRunStateRepository::copy);
    }

    @Override
    public void saveState(ExecutionState state) {
        states.put(state.getRunId(), copy(state));
    }

    @Override
    public List<RunMetadata> listRuns() {
        List<RunMetadata> runs = new ArrayList<>();
        metadata.values().forEach(m -> runs.add(copy(m)));
        runs.sort(Comparator.comparing(RunMetadata::getStartedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return runs;
    }

    private static RunMetadata copy(RunMetadata source) {
        return source.toBuilder().build();
    }

    private static ExecutionState copy(ExecutionState source) {
        return ExecutionState.restore(source.getRunId(), source.getFingerprint(), source.snapshot(),
                source.errorSnapshot(), source.getLastCheckpoint());
    }
}
