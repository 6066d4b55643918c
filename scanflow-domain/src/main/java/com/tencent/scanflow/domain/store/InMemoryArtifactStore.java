package com.tencent.scanflow.domain.store;

import com.tencent.scanflow.domain.schema.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryArtifactStore - 内存制品存储
 */
@Slf4j
public class InMemoryArtifactStore implements ArtifactStore {

    // runId -> (artifactId -> message)
    private final Map<String, Map<String, Message>> runs = new ConcurrentHashMap<>();

    @Override
    public void put(String runId, String artifactId, Message artifact) {
        runs.computeIfAbsent(runId, k -> new ConcurrentHashMap<>()).put(artifactId, artifact);
        log.debug("Stored artifact [{}] for run [{}]", artifactId, runId);
    }

    @Override
    public Optional<Message> get(String runId, String artifactId) {
        Map<String, Message> artifacts = runs.get(runId);
        return artifacts == null ? Optional.empty() : Optional.ofNullable(artifacts.get(artifactId));
    }

    @Override
    public boolean exists(String runId, String artifactId) {
        Map<String, Message> artifacts = runs.get(runId);
        return artifacts != null && artifacts.containsKey(artifactId);
    }

    @Override
    public void delete(String runId, String artifactId) {
        Map<String, Message> artifacts = runs.get(runId);
        if (artifacts != null) {
            artifacts.remove(artifactId);
        }
    }

    @Override
    public List<String> listArtifacts(String runId) {
        Map<String, Message> artifacts = runs.get(runId);
        if (artifacts == null) {
            return Collections.emptyList();
        }
        List<String> ids = new ArrayList<>(artifacts.keySet());
        Collections.sort(ids);
        return ids;
    }

    @Override
    public void clear(String runId) {
        runs.remove(runId);
    }
}
