package com.tencent.scanflow.infrastructure.filesystem;

import com.tencent.scanflow.domain.schema.Message;
import com.tencent.scanflow.domain.store.ArtifactStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * FilesystemArtifactStore - 文件系统制品存储
 * <p>
 * 目录结构: {basePath}/runs/{runId}/artifacts/{artifactId}.json
 * </p>
 */
@Slf4j
public class FilesystemArtifactStore implements ArtifactStore {

    private static final String SUFFIX = ".json";

    private final Path runsDirectory;

    public FilesystemArtifactStore(Path basePath) {
        this.runsDirectory = basePath.resolve("runs");
    }

    @Override
    public void put(String runId, String artifactId, Message artifact) {
        Path file = artifactFile(runId, artifactId);
        JsonFiles.write(file, artifact);
        log.debug("Stored artifact [{}] for run [{}] at {}", artifactId, runId, file);
    }

    @Override
    public Optional<Message> get(String runId, String artifactId) {
        return JsonFiles.read(artifactFile(runId, artifactId), Message.class);
    }

    @Override
    public boolean exists(String runId, String artifactId) {
        return Files.isRegularFile(artifactFile(runId, artifactId));
    }

    @Override
    public void delete(String runId, String artifactId) {
        try {
            Files.deleteIfExists(artifactFile(runId, artifactId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete artifact " + artifactId + " of run " + runId, e);
        }
    }

    @Override
    public List<String> listArtifacts(String runId) {
        Path directory = artifactsDirectory(runId);
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(file -> file.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .forEach(name -> ids.add(name.substring(0, name.length() - SUFFIX.length())));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list artifacts of run " + runId, e);
        }
        Collections.sort(ids);
        return ids;
    }

    /**
     * 只删除制品目录，运行状态 (_system) 保留
     */
    @Override
    public void clear(String runId) {
        Path directory = artifactsDirectory(runId);
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear artifacts of run " + runId, e);
        }
    }

    private Path artifactsDirectory(String runId) {
        return runsDirectory.resolve(StoreKeys.validate("run id", runId)).resolve("artifacts");
    }

    private Path artifactFile(String runId, String artifactId) {
        return artifactsDirectory(runId).resolve(StoreKeys.validate("artifact id", artifactId) + SUFFIX);
    }
}
