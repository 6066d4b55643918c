package com.tencent.scanflow.domain.store;

import com.tencent.scanflow.domain.schema.Message;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * InMemoryAsyncArtifactStore - 内存异步制品存储
 * <p>
 * 在给定线程池上执行 {@link InMemoryArtifactStore} 的操作。
 * </p>
 */
public class InMemoryAsyncArtifactStore implements AsyncArtifactStore {

    private final InMemoryArtifactStore delegate = new InMemoryArtifactStore();
    private final Executor executor;

    public InMemoryAsyncArtifactStore() {
        this(ForkJoinPool.commonPool());
    }

    public InMemoryAsyncArtifactStore(Executor executor) {
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> put(String runId, String artifactId, Message artifact) {
        return CompletableFuture.runAsync(() -> delegate.put(runId, artifactId, artifact), executor);
    }

    @Override
    public CompletableFuture<Optional<Message>> get(String runId, String artifactId) {
        return CompletableFuture.supplyAsync(() -> delegate.get(runId, artifactId), executor);
    }

    @Override
    public CompletableFuture<Boolean> exists(String runId, String artifactId) {
        return CompletableFuture.supplyAsync(() -> delegate.exists(runId, artifactId), executor);
    }

    @Override
    public CompletableFuture<Void> delete(String runId, String artifactId) {
        return CompletableFuture.runAsync(() -> delegate.delete(runId, artifactId), executor);
    }

    @Override
    public CompletableFuture<List<String>> listArtifacts(String runId) {
        return CompletableFuture.supplyAsync(() -> delegate.listArtifacts(runId), executor);
    }

    @Override
    public CompletableFuture<Void> clear(String runId) {
        return CompletableFuture.runAsync(() -> delegate.clear(runId), executor);
    }
}
