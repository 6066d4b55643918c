package com.tencent.scanflow.infrastructure.persistence.run;

import com.tencent.scanflow.domain.state.ArtifactStatus;
import com.tencent.scanflow.domain.state.ExecutionState;
import com.tencent.scanflow.domain.state.RunMetadata;
import com.tencent.scanflow.domain.state.RunStateRepository;
import com.tencent.scanflow.domain.state.RunStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MybatisRunStateRepository 集成测试
 */
@SpringBootTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.ANY)
@ActiveProfiles("test")
@Transactional
class MybatisRunStateRepositoryTest {

    @Autowired
    private RunStateRepository runStateRepository;

    private static RunMetadata metadata(String runId, Instant startedAt) {
        return RunMetadata.builder()
                .runId(runId)
                .runbookName("personal-data-scan")
                .fingerprint("sha256:abc")
                .status(RunStatus.ACTIVE)
                .startedAt(startedAt)
                .build();
    }

    @Test
    void savesAndUpdatesMetadata() {
        Instant started = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        runStateRepository.saveMetadata(metadata("run-1", started));

        RunMetadata completed = runStateRepository.findMetadata("run-1").orElseThrow().toBuilder()
                .status(RunStatus.COMPLETED)
                .completedAt(started.plusSeconds(5))
                .build();
        runStateRepository.saveMetadata(completed);

        Optional<RunMetadata> found = runStateRepository.findMetadata("run-1");
        assertThat(found).isPresent();
        assertThat(found.get().getRunbookName()).isEqualTo("personal-data-scan");
        assertThat(found.get().getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(found.get().getStartedAt()).isEqualTo(started);
        assertThat(found.get().getCompletedAt()).isEqualTo(started.plusSeconds(5));
        assertThat(runStateRepository.listRuns()).hasSize(1);
    }

    @Test
    void savesAndRestoresExecutionState() {
        ExecutionState state = ExecutionState.fresh("run-2", "sha256:abc", List.of("source_a", "findings_b"));
        runStateRepository.saveState(state);

        state.markRunning("source_a");
        state.markCompleted("source_a");
        state.markFailed("findings_b", "analyser crashed");
        runStateRepository.saveState(state);

        ExecutionState restored = runStateRepository.findState("run-2").orElseThrow();
        assertThat(restored.getFingerprint()).isEqualTo("sha256:abc");
        assertThat(restored.getStatus("source_a")).isEqualTo(ArtifactStatus.COMPLETED);
        assertThat(restored.getStatus("findings_b")).isEqualTo(ArtifactStatus.FAILED);
        assertThat(restored.getError("findings_b")).isEqualTo("analyser crashed");
    }

    @Test
    void listsRunsNewestFirst() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        runStateRepository.saveMetadata(metadata("older", now.minusSeconds(60)));
        runStateRepository.saveMetadata(metadata("newer", now));

        assertThat(runStateRepository.listRuns()).extracting(RunMetadata::getRunId)
                .containsExactly("newer", "older");
    }

    @Test
    void unknownRunIsEmpty() {
        assertThat(runStateRepository.findMetadata("missing")).isEmpty();
        assertThat(runStateRepository.findState("missing")).isEmpty();
    }
}
