package com.tencent.scanflow.infrastructure.filesystem;

import com.tencent.scanflow.domain.state.ArtifactStatus;
import com.tencent.scanflow.domain.state.ExecutionState;
import com.tencent.scanflow.domain.state.RunMetadata;
import com.tencent.scanflow.domain.state.RunStateRepository;
import lombok.Data;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * FilesystemRunStateRepository - 运行状态写在制品旁边
 * <p>
 * {basePath}/runs/{runId}/_system/run.json 与 state.json，进程重启后可据此恢复运行。
 * </p>
 */
public class FilesystemRunStateRepository implements RunStateRepository {

    private static final String SYSTEM_DIRECTORY = "_system";

    private final Path runsDirectory;

    public FilesystemRunStateRepository(Path basePath) {
        this.runsDirectory = basePath.resolve("runs");
    }

    @Override
    public Optional<RunMetadata> findMetadata(String runId) {
        return JsonFiles.read(systemDirectory(runId).resolve("run.json"), RunMetadata.class);
    }

    @Override
    public void saveMetadata(RunMetadata metadata) {
        JsonFiles.write(systemDirectory(metadata.getRunId()).resolve("run.json"), metadata);
    }

    @Override
    public Optional<ExecutionState> findState(String runId) {
        return JsonFiles.read(systemDirectory(runId).resolve("state.json"), StateFile.class)
                .map(StateFile::toDomain);
    }

    @Override
    public void saveState(ExecutionState state) {
        JsonFiles.write(systemDirectory(state.getRunId()).resolve("state.json"), StateFile.of(state));
    }

    @Override
    public List<RunMetadata> listRuns() {
        List<RunMetadata> runs = new ArrayList<>();
        if (!Files.isDirectory(runsDirectory)) {
            return runs;
        }
        try (Stream<Path> directories = Files.list(runsDirectory)) {
            directories.filter(Files::isDirectory)
                    .map(directory -> directory.resolve(SYSTEM_DIRECTORY).resolve("run.json"))
                    .forEach(file -> JsonFiles.read(file, RunMetadata.class).ifPresent(runs::add));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list runs under " + runsDirectory, e);
        }
        runs.sort(Comparator.comparing(RunMetadata::getStartedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return runs;
    }

    private Path systemDirectory(String runId) {
        return runsDirectory.resolve(StoreKeys.validate("run id", runId)).resolve(SYSTEM_DIRECTORY);
    }

    /**
     * state.json 的文件格式
     */
    @Data
    static class StateFile {
        private String runId;
        private String fingerprint;
        private Map<String, ArtifactStatus> statuses = new LinkedHashMap<>();
        private Map<String, String> errors = new LinkedHashMap<>();
        private Instant lastCheckpoint;

        static StateFile of(ExecutionState state) {
            StateFile file = new StateFile();
            file.setRunId(state.getRunId());
            file.setFingerprint(state.getFingerprint());
            file.setStatuses(new LinkedHashMap<>(state.snapshot()));
            file.setErrors(new LinkedHashMap<>(state.errorSnapshot()));
            file.setLastCheckpoint(state.getLastCheckpoint());
            return file;
        }

        ExecutionState toDomain() {
            return ExecutionState.restore(runId, fingerprint, statuses, errors, lastCheckpoint);
        }
    }
}
