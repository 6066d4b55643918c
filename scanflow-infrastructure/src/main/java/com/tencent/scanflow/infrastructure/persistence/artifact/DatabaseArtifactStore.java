package com.tencent.scanflow.infrastructure.persistence.artifact;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.tencent.scanflow.domain.schema.Message;
import com.tencent.scanflow.domain.store.ArtifactStore;
import com.tencent.scanflow.infrastructure.persistence.artifact.converter.ArtifactConverter;
import com.tencent.scanflow.infrastructure.persistence.artifact.entity.ArtifactDO;
import com.tencent.scanflow.infrastructure.persistence.artifact.mapper.ArtifactMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * DatabaseArtifactStore - 制品存储的数据库实现
 * <p>
 * (run_id, artifact_id) 唯一，重复写入覆盖原有内容。
 * </p>
 *
 * @author scanflow
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "scanflow.store", name = "type", havingValue = "database")
public class DatabaseArtifactStore implements ArtifactStore {

    private final ArtifactMapper artifactMapper;

    public DatabaseArtifactStore(ArtifactMapper artifactMapper) {
        this.artifactMapper = artifactMapper;
    }

    @Override
    @Transactional
    public void put(String runId, String artifactId, Message artifact) {
        ArtifactDO existing = select(runId, artifactId);
        if (existing == null) {
            ArtifactDO created = new ArtifactDO();
            ArtifactConverter.copy(runId, artifactId, artifact, created);
            artifactMapper.insert(created);
        } else {
            ArtifactConverter.copy(runId, artifactId, artifact, existing);
            artifactMapper.updateById(existing);
        }
        log.debug("Stored artifact [{}] for run [{}]", artifactId, runId);
    }

    @Override
    public Optional<Message> get(String runId, String artifactId) {
        return Optional.ofNullable(select(runId, artifactId)).map(ArtifactConverter::toDomain);
    }

    @Override
    public boolean exists(String runId, String artifactId) {
        Long count = artifactMapper.selectCount(query(runId).eq(ArtifactDO::getArtifactId, artifactId));
        return count != null && count > 0;
    }

    @Override
    @Transactional
    public void delete(String runId, String artifactId) {
        artifactMapper.delete(query(runId).eq(ArtifactDO::getArtifactId, artifactId));
    }

    @Override
    public List<String> listArtifacts(String runId) {
        return artifactMapper.selectList(query(runId).orderByAsc(ArtifactDO::getArtifactId))
                .stream()
                .map(ArtifactDO::getArtifactId)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public void clear(String runId) {
        artifactMapper.delete(query(runId));
    }

    private ArtifactDO select(String runId, String artifactId) {
        return artifactMapper.selectOne(query(runId).eq(ArtifactDO::getArtifactId, artifactId));
    }

    private static LambdaQueryWrapper<ArtifactDO> query(String runId) {
        return new LambdaQueryWrapper<ArtifactDO>().eq(ArtifactDO::getRunId, runId);
    }
}
