package com.tencent.scanflow.infrastructure.persistence.run;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.tencent.scanflow.domain.state.ExecutionState;
import com.tencent.scanflow.domain.state.RunMetadata;
import com.tencent.scanflow.domain.state.RunStateRepository;
import com.tencent.scanflow.infrastructure.persistence.run.converter.RunStateConverter;
import com.tencent.scanflow.infrastructure.persistence.run.entity.ExecutionStateDO;
import com.tencent.scanflow.infrastructure.persistence.run.entity.RunMetadataDO;
import com.tencent.scanflow.infrastructure.persistence.run.mapper.ExecutionStateMapper;
import com.tencent.scanflow.infrastructure.persistence.run.mapper.RunMetadataMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * MybatisRunStateRepository - 运行状态仓储的数据库实现
 *
 * @author scanflow
 */
@Repository
@ConditionalOnProperty(prefix = "scanflow.store", name = "type", havingValue = "database")
public class MybatisRunStateRepository implements RunStateRepository {

    private final RunMetadataMapper runMetadataMapper;
    private final ExecutionStateMapper executionStateMapper;

    public MybatisRunStateRepository(RunMetadataMapper runMetadataMapper,
                                     ExecutionStateMapper executionStateMapper) {
        this.runMetadataMapper = runMetadataMapper;
        this.executionStateMapper = executionStateMapper;
    }

    @Override
    public Optional<RunMetadata> findMetadata(String runId) {
        return Optional.ofNullable(selectMetadata(runId)).map(RunStateConverter::toDomain);
    }

    @Override
    @Transactional
    public void saveMetadata(RunMetadata metadata) {
        RunMetadataDO existing = selectMetadata(metadata.getRunId());
        if (existing == null) {
            runMetadataMapper.insert(RunStateConverter.toDataObject(metadata));
        } else {
            RunStateConverter.copy(metadata, existing);
            runMetadataMapper.updateById(existing);
        }
    }

    @Override
    public Optional<ExecutionState> findState(String runId) {
        return Optional.ofNullable(selectState(runId)).map(RunStateConverter::toDomain);
    }

    @Override
    @Transactional
    public void saveState(ExecutionState state) {
        ExecutionStateDO existing = selectState(state.getRunId());
        if (existing == null) {
            ExecutionStateDO created = new ExecutionStateDO();
            RunStateConverter.copy(state, created);
            executionStateMapper.insert(created);
        } else {
            RunStateConverter.copy(state, existing);
            executionStateMapper.updateById(existing);
        }
    }

    @Override
    public List<RunMetadata> listRuns() {
        return runMetadataMapper.selectList(
                new LambdaQueryWrapper<RunMetadataDO>()
                        .orderByDesc(RunMetadataDO::getStartedAt)
        ).stream()
                .map(RunStateConverter::toDomain)
                .collect(Collectors.toList());
    }

    private RunMetadataDO selectMetadata(String runId) {
        return runMetadataMapper.selectOne(
                new LambdaQueryWrapper<RunMetadataDO>()
                        .eq(RunMetadataDO::getRunId, runId)
        );
    }

    private ExecutionStateDO selectState(String runId) {
        return executionStateMapper.selectOne(
                new LambdaQueryWrapper<ExecutionStateDO>()
                        .eq(ExecutionStateDO::getRunId, runId)
        );
    }
}
