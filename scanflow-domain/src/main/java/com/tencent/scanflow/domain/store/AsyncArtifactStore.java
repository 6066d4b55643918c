package com.tencent.scanflow.domain.store;

import com.tencent.scanflow.domain.schema.Message;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * AsyncArtifactStore - 异步制品存储
 * <p>
 * 语义与 {@link ArtifactStore} 相同，所有操作返回 {@link CompletableFuture}。
 * </p>
 */
public interface AsyncArtifactStore {

    CompletableFuture<Void> put(String runId, String artifactId, Message artifact);

    CompletableFuture<Optional<Message>> get(String runId, String artifactId);

    CompletableFuture<Boolean> exists(String runId, String artifactId);

    CompletableFuture<Void> delete(String runId, String artifactId);

    CompletableFuture<List<String>> listArtifacts(String runId);

    CompletableFuture<Void> clear(String runId);
}
