package com.tencent.scanflow.domain.store;

import com.tencent.scanflow.domain.schema.Message;

import java.util.List;
import java.util.Optional;

/**
 * ArtifactStore - 制品存储
 * <p>
 * 按 (runId, artifactId) 持久化制品。实现必须支持同一运行内不同制品的并发读写。
 * </p>
 */
public interface ArtifactStore {

    void put(String runId, String artifactId, Message artifact);

    Optional<Message> get(String runId, String artifactId);

    boolean exists(String runId, String artifactId);

    void delete(String runId, String artifactId);

    /**
     * 某次运行的所有制品 ID
     */
    List<String> listArtifacts(String runId);

    /**
     * 清除某次运行的所有制品
     */
    void clear(String runId);
}
