package com.tencent.scanflow.domain.executor;

import com.tencent.scanflow.domain.component.ComponentRegistry;
import com.tencent.scanflow.domain.component.ComponentResult;
import com.tencent.scanflow.domain.component.StubAnalyserFactory;
import com.tencent.scanflow.domain.component.StubConnectorFactory;
import com.tencent.scanflow.domain.exception.RunAlreadyActiveException;
import com.tencent.scanflow.domain.exception.RunNotFoundException;
import com.tencent.scanflow.domain.exception.RunbookChangedException;
import com.tencent.scanflow.domain.plan.ExecutionPlan;
import com.tencent.scanflow.domain.plan.InMemoryRunbookLoader;
import com.tencent.scanflow.domain.plan.Planner;
import com.tencent.scanflow.domain.runbook.ArtifactDefinition;
import com.tencent.scanflow.domain.runbook.ReuseConfig;
import com.tencent.scanflow.domain.runbook.Runbook;
import com.tencent.scanflow.domain.runbook.RunbookConfig;
import com.tencent.scanflow.domain.schema.Message;
import com.tencent.scanflow.domain.schema.Schema;
import com.tencent.scanflow.domain.state.ArtifactStatus;
import com.tencent.scanflow.domain.state.ExecutionState;
import com.tencent.scanflow.domain.state.InMemoryRunStateRepository;
import com.tencent.scanflow.domain.state.RunMetadata;
import com.tencent.scanflow.domain.state.RunStatus;
import com.tencent.scanflow.domain.store.InMemoryArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.tencent.scanflow.domain.runbook.RunbookFixtures.child;
import static com.tencent.scanflow.domain.runbook.RunbookFixtures.derived;
import static com.tencent.scanflow.domain.runbook.RunbookFixtures.input;
import static com.tencent.scanflow.domain.runbook.RunbookFixtures.output;
import static com.tencent.scanflow.domain.runbook.RunbookFixtures.passthrough;
import static com.tencent.scanflow.domain.runbook.RunbookFixtures.runbook;
import static com.tencent.scanflow.domain.runbook.RunbookFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DagExecutorTest {

    private static final Schema STANDARD_INPUT = Schema.of("standard_input");
    private static final Schema FINDING = Schema.of("personal_data_finding");

    private StubConnectorFactory filesystem;
    private StubAnalyserFactory analyser1;
    private StubAnalyserFactory analyser2;
    private InMemoryRunbookLoader loader;
    private Planner planner;
    private InMemoryArtifactStore store;
    private InMemoryRunStateRepository repository;
    private DagExecutor executor;

    @BeforeEach
    void setUp() {
        filesystem = new StubConnectorFactory("filesystem", STANDARD_INPUT);
        analyser1 = new StubAnalyserFactory("analyser1", FINDING);
        analyser2 = new StubAnalyserFactory("analyser2", FINDING);
        ComponentRegistry registry = ComponentRegistry.builder()
                .connector(filesystem)
                .analyser(analyser1)
                .analyser(analyser2)
                .build();
        loader = new InMemoryRunbookLoader();
        planner = new Planner(registry, loader);
        store = new InMemoryArtifactStore();
        repository = new InMemoryRunStateRepository();
        executor = new DagExecutor(registry, store, repository, DagExecutorConfig.defaults());
    }

    private static Map<String, Object> label(String label) {
        return Map.of("label", label);
    }

    private static ComponentResult failWhenLabelled(String label, Map<String, Object> properties,
                                                    List<Message> inputs, Schema schema) {
        if (label.equals(properties.get("label"))) {
            return ComponentResult.failure("boom in " + label);
        }
        return ComponentResult.success(Message.builder().id(String.valueOf(properties.get("label")))
                .schema(schema).entry("data", List.of(inputs.size())).build());
    }

    @Test
    void singleExecutionProducesEveryArtifactFromSharedSource() {
        ExecutionPlan plan = planner.plan(runbook("scan",
                "source_a", source("filesystem", Map.of("value", "file-content")),
                "findings_b", derived("analyser1", "source_a"),
                "findings_c", derived("analyser2", "source_a")));

        RunResult result = executor.run(plan, "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.completed()).containsExactlyInAnyOrder("source_a", "findings_b", "findings_c");
        assertThat(store.listArtifacts("run-1")).containsExactly("findings_b", "findings_c", "source_a");
        assertThat(filesystem.getInvocations()).hasSize(1);

        Message persistedSource = store.get("run-1", "source_a").orElseThrow();
        assertThat(analyser1.getInvocations()).singleElement()
                .satisfies(call -> assertThat(call.getInputs()).containsExactly(persistedSource));
        assertThat(analyser2.getInvocations()).singleElement()
                .satisfies(call -> assertThat(call.getInputs()).containsExactly(persistedSource));
        assertThat(persistedSource.getContent().get("data")).isEqualTo(List.of("file-content"));

        RunMetadata metadata = repository.findMetadata("run-1").orElseThrow();
        assertThat(metadata.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(metadata.getFingerprint()).isEqualTo(plan.getFingerprint());
        assertThat(metadata.getCompletedAt()).isNotNull();
    }

    @Test
    void failureIsIsolatedToItsBranch() {
        analyser1.behaving((properties, inputs, schema) -> failWhenLabelled("b", properties, inputs, schema));
        ExecutionPlan plan = planner.plan(runbook("scan",
                "a", source("filesystem"),
                "b", derived("analyser1", label("b"), "a"),
                "c", derived("analyser1", label("c"), "a"),
                "d", derived("analyser2", "b")));

        RunResult result = executor.run(plan, "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.statusOf("a")).isEqualTo(ArtifactStatus.COMPLETED);
        assertThat(result.statusOf("b")).isEqualTo(ArtifactStatus.FAILED);
        assertThat(result.statusOf("c")).isEqualTo(ArtifactStatus.COMPLETED);
        assertThat(result.statusOf("d")).isEqualTo(ArtifactStatus.SKIPPED);
        assertThat(result.getErrors()).containsEntry("b", "boom in b");
        assertThat(result.getErrors().get("d")).contains("'b' failed");
        assertThat(analyser2.getInvocationCount()).isZero();
        assertThat(store.exists("run-1", "c")).isTrue();
        assertThat(store.exists("run-1", "b")).isFalse();
    }

    @Test
    void thrownExceptionIsAFailureNotAnAbort() {
        filesystem.behaving((properties, schema) -> {
            throw new IllegalStateException("disk unavailable");
        });
        ExecutionPlan plan = planner.plan(runbook("scan",
                "a", source("filesystem"),
                "b", derived("analyser1", "a")));

        RunResult result = executor.run(plan, "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.failed()).containsExactly("a");
        assertThat(result.skipped()).containsExactly("b");
        assertThat(result.getErrors().get("a")).contains("disk unavailable");
    }

    @Test
    void connectorThatCannotBeCreatedFails() {
        filesystem.creatable(false);
        ExecutionPlan plan = planner.plan(runbook("scan", "a", source("filesystem")));

        RunResult result = executor.run(plan, "run-1");

        assertThat(result.failed()).containsExactly("a");
        assertThat(filesystem.getInvocations()).isEmpty();
    }

    @Test
    void pendingInterruptsOneChainWhileOthersComplete() {
        analyser1.behaving((properties, inputs, schema) -> "b".equals(properties.get("label"))
                ? ComponentResult.pending("batch submitted")
                : ComponentResult.success(Message.builder().id("y").schema(schema).entry("data", List.of()).build()));
        ExecutionPlan plan = planner.plan(runbook("scan",
                "a", source("filesystem"),
                "b", derived("analyser1", label("b"), "a"),
                "x", source("filesystem"),
                "y", derived("analyser1", label("y"), "x")));

        RunResult result = executor.run(plan, "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.INTERRUPTED);
        assertThat(result.statusOf("a")).isEqualTo(ArtifactStatus.COMPLETED);
        assertThat(result.statusOf("b")).isEqualTo(ArtifactStatus.NOT_STARTED);
        assertThat(result.statusOf("x")).isEqualTo(ArtifactStatus.COMPLETED);
        assertThat(result.statusOf("y")).isEqualTo(ArtifactStatus.COMPLETED);
        assertThat(result.pending()).containsExactly("b");
        assertThat(repository.findMetadata("run-1").orElseThrow().getStatus()).isEqualTo(RunStatus.INTERRUPTED);
    }

    @Test
    void pendingTakesPriorityOverFailure() {
        analyser1.behaving((properties, inputs, schema) -> {
            if ("pending".equals(properties.get("label"))) {
                return ComponentResult.pending("waiting");
            }
            return ComponentResult.failure("broken");
        });
        ExecutionPlan plan = planner.plan(runbook("scan",
                "a", source("filesystem"),
                "p", derived("analyser1", label("pending"), "a"),
                "f", derived("analyser1", label("fail"), "a"),
                "ok", derived("analyser2", "a")));

        RunResult result = executor.run(plan, "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.INTERRUPTED);
        assertThat(result.failed()).containsExactly("f");
        assertThat(result.completed()).contains("ok");
    }

    @Test
    void resumeCompletesPendingArtifactsWithoutRecomputingOthers() {
        AtomicBoolean batchReady = new AtomicBoolean(false);
        analyser1.behaving((properties, inputs, schema) -> batchReady.get()
                ? ComponentResult.success(Message.builder().id("b").schema(schema).entry("data", List.of("done")).build())
                : ComponentResult.pending("batch running"));
        ExecutionPlan plan = planner.plan(runbook("scan",
                "a", source("filesystem"),
                "b", derived("analyser1", "a"),
                "c", derived("analyser2", "b")));

        RunResult first = executor.run(plan, "run-1");
        assertThat(first.getStatus()).isEqualTo(RunStatus.INTERRUPTED);
        assertThat(first.statusOf("c")).isEqualTo(ArtifactStatus.NOT_STARTED);
        Message sourceBefore = store.get("run-1", "a").orElseThrow();

        batchReady.set(true);
        RunResult resumed = executor.resume(plan, "run-1");

        assertThat(resumed.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(resumed.completed()).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(filesystem.getInvocations()).hasSize(1);
        assertThat(store.get("run-1", "a")).containsSame(sourceBefore);
        assertThat(analyser2.getInvocationCount()).isEqualTo(1);
    }

    @Test
    void resumeRetriesFailedAndSkippedArtifacts() {
        AtomicBoolean healthy = new AtomicBoolean(false);
        analyser1.behaving((properties, inputs, schema) -> healthy.get()
                ? ComponentResult.success(Message.builder().id("b").schema(schema).entry("data", List.of()).build())
                : ComponentResult.failure("transient"));
        ExecutionPlan plan = planner.plan(runbook("scan",
                "a", source("filesystem"),
                "b", derived("analyser1", "a"),
                "c", derived("analyser2", "b")));

        assertThat(executor.run(plan, "run-1").getStatus()).isEqualTo(RunStatus.FAILED);

        healthy.set(true);
        RunResult resumed = executor.resume(plan, "run-1");

        assertThat(resumed.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(filesystem.getInvocations()).hasSize(1);
        assertThat(analyser1.getInvocationCount()).isEqualTo(2);
    }

    @Test
    void resumingCompletedRunPerformsNoInvocations() {
        ExecutionPlan plan = planner.plan(runbook("scan",
                "source_a", source("filesystem"),
                "findings_b", derived("analyser1", "source_a")));
        executor.run(plan, "run-1");
        Message before = store.get("run-1", "findings_b").orElseThrow();

        RunResult again = executor.resume(plan, "run-1");
        RunResult rerun = executor.run(plan, "run-1");

        assertThat(again.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(rerun.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(again.completed()).containsExactlyInAnyOrder("source_a", "findings_b");
        assertThat(filesystem.getInvocations()).hasSize(1);
        assertThat(analyser1.getInvocationCount()).isEqualTo(1);
        assertThat(store.get("run-1", "findings_b")).containsSame(before);
        assertThat(store.listArtifacts("run-1")).containsExactly("findings_b", "source_a");
    }

    @Test
    void resumeUnknownRunFails() {
        ExecutionPlan plan = planner.plan(runbook("scan", "a", source("filesystem")));

        assertThatThrownBy(() -> executor.resume(plan, "ghost"))
                .isInstanceOf(RunNotFoundException.class)
                .satisfies(e -> assertThat(((RunNotFoundException) e).getRunId()).isEqualTo("ghost"));
    }

    @Test
    void resumeAfterStructuralChangeFails() {
        ExecutionPlan original = planner.plan(runbook("scan",
                "a", source("filesystem"),
                "b", derived("analyser1", "a")));
        executor.run(original, "run-1");
        ExecutionPlan changed = planner.plan(runbook("scan",
                "a", source("filesystem"),
                "b", derived("analyser2", "a")));

        assertThatThrownBy(() -> executor.resume(changed, "run-1"))
                .isInstanceOf(RunbookChangedException.class)
                .satisfies(e -> assertThat(((RunbookChangedException) e).getStoredFingerprint())
                        .isEqualTo(original.getFingerprint()));
        assertThatThrownBy(() -> executor.run(changed, "run-1"))
                .isInstanceOf(RunbookChangedException.class);
    }

    @Test
    void startingActiveRunFails() {
        ExecutionPlan plan = planner.plan(runbook("scan", "a", source("filesystem")));
        repository.saveMetadata(RunMetadata.builder()
                .runId("run-1")
                .runbookName("scan")
                .fingerprint(plan.getFingerprint())
                .status(RunStatus.ACTIVE)
                .startedAt(Instant.now())
                .build());

        assertThatThrownBy(() -> executor.run(plan, "run-1")).isInstanceOf(RunAlreadyActiveException.class);
        assertThatThrownBy(() -> executor.resume(plan, "run-1")).isInstanceOf(RunAlreadyActiveException.class);
        assertThat(filesystem.getInvocations()).isEmpty();
    }

    @Test
    void reuseCopiesArtifactFromPriorRun() {
        ExecutionPlan first = planner.plan(runbook("scan",
                "a", source("filesystem", Map.of("value", "expensive")),
                "b", derived("analyser1", "a")));
        executor.run(first, "run-1");

        ArtifactDefinition reused = source("filesystem").toBuilder()
                .reuse(ReuseConfig.builder().fromRun("run-1").artifact("a").build())
                .build();
        ExecutionPlan second = planner.plan(runbook("scan",
                "a", reused,
                "b", derived("analyser1", "a")));
        RunResult result = executor.run(second, "run-2");

        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(filesystem.getInvocations()).hasSize(1);
        Message copied = store.get("run-2", "a").orElseThrow();
        assertThat(copied.getSource()).isEqualTo("reuse:run-1/a");
        assertThat(copied.getContent()).isEqualTo(store.get("run-1", "a").orElseThrow().getContent());
        assertThat(analyser1.getInvocations().get(1).getInputs()).containsExactly(copied);
    }

    @Test
    void missingReuseSourceFailsOnlyThatArtifact() {
        ArtifactDefinition reused = ArtifactDefinition.builder()
                .reuse(ReuseConfig.builder().fromRun("old-run").artifact("gone").build())
                .outputSchema(STANDARD_INPUT)
                .build();
        ExecutionPlan plan = planner.plan(runbook("scan",
                "a", reused,
                "b", derived("analyser1", "a"),
                "x", source("filesystem")));

        RunResult result = executor.run(plan, "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.getErrors().get("a")).contains("gone").contains("old-run");
        assertThat(result.statusOf("b")).isEqualTo(ArtifactStatus.SKIPPED);
        assertThat(result.statusOf("x")).isEqualTo(ArtifactStatus.COMPLETED);
    }

    @Test
    void passthroughFanInConcatenatesData() {
        ExecutionPlan plan = planner.plan(runbook("scan",
                "a", source("filesystem", Map.of("value", "first")),
                "b", source("filesystem", Map.of("value", "second")),
                "merged", passthrough("a", "b")));

        executor.run(plan, "run-1");

        Message merged = store.get("run-1", "merged").orElseThrow();
        assertThat(merged.getSchema()).isEqualTo(STANDARD_INPUT);
        assertThat(merged.getContent().get("data")).isEqualTo(List.of("first", "second"));
    }

    @Test
    void timeoutFailsOnlyTheSlowArtifact() {
        CountDownLatch never = new CountDownLatch(1);
        analyser1.behaving((properties, inputs, schema) -> {
            if ("slow".equals(properties.get("label"))) {
                never.await(30, TimeUnit.SECONDS);
            }
            return ComponentResult.success(Message.builder().id("ok").schema(schema).entry("data", List.of()).build());
        });
        Runbook runbook = runbook("scan",
                "a", source("filesystem"),
                "slow", derived("analyser1", label("slow"), "a"),
                "fast", derived("analyser1", label("fast"), "a")).toBuilder()
                .config(RunbookConfig.builder().timeout(1).build())
                .build();

        RunResult result = executor.run(planner.plan(runbook), "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.statusOf("slow")).isEqualTo(ArtifactStatus.FAILED);
        assertThat(result.getErrors().get("slow")).contains("Timed out");
        assertThat(result.statusOf("fast")).isEqualTo(ArtifactStatus.COMPLETED);
        assertThat(result.getDuration()).isLessThan(Duration.ofSeconds(20));
        assertThat(store.exists("run-1", "slow")).isFalse();
    }

    @Test
    void timeoutIsNotConsumedWhileWaitingForAWorker() {
        filesystem.behaving((properties, schema) -> {
            try {
                Thread.sleep(600);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ComponentResult.success(Message.builder().id("s").schema(schema).entry("data", List.of()).build());
        });
        Runbook runbook = runbook("scan",
                "s1", source("filesystem"),
                "s2", source("filesystem"),
                "s3", source("filesystem")).toBuilder()
                .config(RunbookConfig.builder().maxConcurrency(1).timeout(1).build())
                .build();

        RunResult result = executor.run(planner.plan(runbook), "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.completed()).containsExactlyInAnyOrder("s1", "s2", "s3");
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void stateStoreFailureDoesNotLeaveRunActive() {
        AtomicInteger saves = new AtomicInteger();
        InMemoryRunStateRepository flaky = new InMemoryRunStateRepository() {
            @Override
            public void saveState(ExecutionState state) {
                if (saves.incrementAndGet() == 3) {
                    throw new IllegalStateException("disk full");
                }
                super.saveState(state);
            }
        };
        ComponentRegistry registry = ComponentRegistry.builder().connector(filesystem).analyser(analyser1).build();
        DagExecutor flakyExecutor = new DagExecutor(registry, store, flaky, DagExecutorConfig.defaults());
        ExecutionPlan plan = planner.plan(runbook("scan",
                "a", source("filesystem"),
                "b", derived("analyser1", "a")));

        assertThatThrownBy(() -> flakyExecutor.run(plan, "run-1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("disk full");
        assertThat(flaky.findMetadata("run-1").orElseThrow().getStatus()).isEqualTo(RunStatus.FAILED);

        RunResult resumed = flakyExecutor.resume(plan, "run-1");

        assertThat(resumed.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(resumed.completed()).containsExactlyInAnyOrder("a", "b");
        assertThat(flaky.findMetadata("run-1").orElseThrow().getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void concurrencyIsBounded() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        filesystem.behaving((properties, schema) -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
            }
            return ComponentResult.success(Message.builder().id("s").schema(schema).entry("data", List.of()).build());
        });
        Runbook runbook = runbook("scan",
                "s1", source("filesystem"),
                "s2", source("filesystem"),
                "s3", source("filesystem"),
                "s4", source("filesystem"),
                "s5", source("filesystem"),
                "s6", source("filesystem")).toBuilder()
                .config(RunbookConfig.builder().maxConcurrency(2).build())
                .build();

        RunResult result = executor.run(planner.plan(runbook), "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void childRunbookExecutesUnderNamespacedIds() {
        loader.register("child.yaml", runbook("child", "processed", derived("analyser1", "source_data")).toBuilder()
                .inputs(Map.of("source_data", input("standard_input")))
                .outputs(Map.of("result", output("processed")))
                .build());
        ExecutionPlan plan = planner.plan(runbook("parent",
                "data", source("filesystem"),
                "final", child("child.yaml", Map.of("source_data", "data"), "result", "data"),
                "report", derived("analyser2", "final")), "parent.yaml");

        RunResult result = executor.run(plan, "run-1");

        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.statusOf("final")).isEqualTo(ArtifactStatus.COMPLETED);
        assertThat(store.exists("run-1", "final__processed")).isTrue();
        assertThat(analyser2.getInvocations()).singleElement()
                .satisfies(call -> assertThat(call.getInputs())
                        .containsExactly(store.get("run-1", "final__processed").orElseThrow()));
    }
}
