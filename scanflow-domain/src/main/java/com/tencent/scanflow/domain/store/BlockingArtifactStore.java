package com.tencent.scanflow.domain.store;

import com.tencent.scanflow.domain.schema.Message;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * BlockingArtifactStore - 将异步存储适配为同步接口
 * <p>
 * 执行器工作线程本身允许阻塞，因此可直接在异步存储之上运行。
 * </p>
 */
public class BlockingArtifactStore implements ArtifactStore {

    private final AsyncArtifactStore delegate;

    public BlockingArtifactStore(AsyncArtifactStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public void put(String runId, String artifactId, Message artifact) {
        await(delegate.put(runId, artifactId, artifact));
    }

    @Override
    public Optional<Message> get(String runId, String artifactId) {
        return await(delegate.get(runId, artifactId));
    }

    @Override
    public boolean exists(String runId, String artifactId) {
        return await(delegate.exists(runId, artifactId));
    }

    @Override
    public void delete(String runId, String artifactId) {
        await(delegate.delete(runId, artifactId));
    }

    @Override
    public List<String> listArtifacts(String runId) {
        return await(delegate.listArtifacts(runId));
    }

    @Override
    public void clear(String runId) {
        await(delegate.clear(runId));
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for artifact store", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new CompletionException(cause);
        }
    }
}
