package com.tencent.scanflow.domain.executor;

import com.tencent.scanflow.domain.component.Analyser;
import com.tencent.scanflow.domain.component.AnalyserFactory;
import com.tencent.scanflow.domain.component.ComponentRegistry;
import com.tencent.scanflow.domain.component.ComponentResult;
import com.tencent.scanflow.domain.component.Connector;
import com.tencent.scanflow.domain.component.ConnectorFactory;
import com.tencent.scanflow.domain.dag.ExecutionDag;
import com.tencent.scanflow.domain.exception.ArtifactNotFoundException;
import com.tencent.scanflow.domain.exception.RunAlreadyActiveException;
import com.tencent.scanflow.domain.exception.RunNotFoundException;
import com.tencent.scanflow.domain.exception.RunbookChangedException;
import com.tencent.scanflow.domain.plan.ExecutionPlan;
import com.tencent.scanflow.domain.runbook.ArtifactDefinition;
import com.tencent.scanflow.domain.runbook.ReuseConfig;
import com.tencent.scanflow.domain.runbook.RunbookConfig;
import com.tencent.scanflow.domain.schema.Message;
import com.tencent.scanflow.domain.schema.MessageMerger;
import com.tencent.scanflow.domain.schema.Schema;
import com.tencent.scanflow.domain.state.ArtifactStatus;
import com.tencent.scanflow.domain.state.ExecutionState;
import com.tencent.scanflow.domain.state.RunMetadata;
import com.tencent.scanflow.domain.state.RunStateRepository;
import com.tencent.scanflow.domain.state.RunStatus;
import com.tencent.scanflow.domain.store.ArtifactStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * DagExecutor - 执行计划执行器
 * <p>
 * 按依赖顺序执行制品，相互独立的分支在有界线程池中并发执行。
 * 调度只由调用线程完成: 计算就绪集合、派发、等待任一制品结束、更新状态，循环直到没有可派发的制品。
 * 只有工作线程会并发访问制品存储；执行状态只在调度线程中修改，每次迁移后持久化。
 * </p>
 * <p>
 * 单个制品的结果:
 * <ul>
 *   <li>成功: 写入存储，标记 COMPLETED</li>
 *   <li>挂起: 保持 NOT_STARTED，运行以 INTERRUPTED 结束，不依赖它的分支继续执行</li>
 *   <li>失败或超时: 标记 FAILED，所有下游标记 SKIPPED，其余分支不受影响</li>
 * </ul>
 * </p>
 */
@Slf4j
public class DagExecutor {

    private final ComponentRegistry registry;
    private final ArtifactStore store;
    private final RunStateRepository repository;
    private final DagExecutorConfig config;

    private final Object lifecycleLock = new Object();

    public DagExecutor(ComponentRegistry registry, ArtifactStore store, RunStateRepository repository,
                       DagExecutorConfig config) {
        this.registry = registry;
        this.store = store;
        this.repository = repository;
        this.config = config;
    }

    /**
     * 启动运行
     * <p>
     * runId 已存在且不处于执行中时，等价于 {@link #resume(ExecutionPlan, String)}。
     * </p>
     *
     * @throws RunAlreadyActiveException runId 仍在执行中
     * @throws RunbookChangedException   runId 已存在且执行计划已变更
     */
    public RunResult run(ExecutionPlan plan, String runId) {
        return execute(plan, begin(plan, runId, false));
    }

    /**
     * 恢复运行: 已完成的制品既不重新计算也不重新写入
     *
     * @throws RunNotFoundException      runId 不存在
     * @throws RunAlreadyActiveException runId 仍在执行中
     * @throws RunbookChangedException   执行计划指纹与首次运行不一致
     */
    public RunResult resume(ExecutionPlan plan, String runId) {
        return execute(plan, begin(plan, runId, true));
    }

    private ExecutionState begin(ExecutionPlan plan, String runId, boolean resume) {
        synchronized (lifecycleLock) {
            Optional<RunMetadata> existing = repository.findMetadata(runId);
            if (existing.isEmpty()) {
                if (resume) {
                    throw new RunNotFoundException(runId);
                }
                RunMetadata metadata = RunMetadata.builder()
                        .runId(runId)
                        .runbookName(plan.getRunbook().getName())
                        .fingerprint(plan.getFingerprint())
                        .status(RunStatus.ACTIVE)
                        .startedAt(Instant.now())
                        .build();
                ExecutionState state = ExecutionState.fresh(runId, plan.getFingerprint(), plan.getDag().getNodes());
                repository.saveMetadata(metadata);
                repository.saveState(state);
                log.info("Starting run [{}] of runbook [{}]", runId, plan.getRunbook().getName());
                return state;
            }

            RunMetadata metadata = existing.get();
            if (metadata.isActive()) {
                throw new RunAlreadyActiveException(runId);
            }
            if (!plan.getFingerprint().equals(metadata.getFingerprint())) {
                throw new RunbookChangedException(runId, metadata.getFingerprint(), plan.getFingerprint());
            }

            ExecutionState state = repository.findState(runId)
                    .orElseGet(() -> ExecutionState.fresh(runId, plan.getFingerprint(), plan.getDag().getNodes()));
            state.resetForResume();
            metadata.setStatus(RunStatus.ACTIVE);
            metadata.setCompletedAt(null);
            repository.saveMetadata(metadata);
            repository.saveState(state);
            log.info("Resuming run [{}] of runbook [{}], {} artifacts already completed", runId,
                    plan.getRunbook().getName(), state.getArtifactsIn(ArtifactStatus.COMPLETED).size());
            return state;
        }
    }

    private RunResult execute(ExecutionPlan plan, ExecutionState state) {
        Instant startedAt = Instant.now();
        String runId = state.getRunId();
        RunbookConfig runbookConfig = plan.getRunbook().getConfig();
        int concurrency = runbookConfig.getMaxConcurrency() != null
                ? runbookConfig.getMaxConcurrency() : config.getMaxConcurrency();
        Duration timeout = runbookConfig.getTimeout() != null
                ? Duration.ofSeconds(runbookConfig.getTimeout()) : config.getStepTimeout();

        ExecutorService workers = Executors.newFixedThreadPool(Math.max(1, concurrency), namedThreads("scanflow-" + runId));
        ScheduledExecutorService watchdog = timeout == null ? null
                : Executors.newSingleThreadScheduledExecutor(namedThreads("scanflow-watchdog-" + runId));
        BlockingQueue<Outcome> completions = new LinkedBlockingQueue<>();
        Set<String> inFlight = new HashSet<>();
        Set<String> pending = new LinkedHashSet<>();

        RunStatus status;
        try {
            schedule(plan, state, workers, watchdog, timeout, completions, inFlight, pending);
            status = terminalStatus(state, pending);
            finish(runId, status);
        } catch (RuntimeException | Error e) {
            abandon(runId, e);
            throw e;
        } finally {
            workers.shutdownNow();
            if (watchdog != null) {
                watchdog.shutdownNow();
            }
        }

        Duration duration = Duration.between(startedAt, Instant.now());
        log.info("Run [{}] finished with status {} in {} ms: {} completed, {} failed, {} skipped, {} pending",
                runId, status, duration.toMillis(), state.getArtifactsIn(ArtifactStatus.COMPLETED).size(),
                state.getArtifactsIn(ArtifactStatus.FAILED).size(), state.getArtifactsIn(ArtifactStatus.SKIPPED).size(),
                pending.size());

        return RunResult.builder()
                .runId(runId)
                .status(status)
                .startedAt(startedAt)
                .duration(duration)
                .artifactStatuses(state.snapshot())
                .errors(state.errorSnapshot())
                .pendingArtifacts(pending)
                .aliases(plan.getAliases())
                .build();
    }

    private void schedule(ExecutionPlan plan, ExecutionState state, ExecutorService workers,
                          ScheduledExecutorService watchdog, Duration timeout, BlockingQueue<Outcome> completions,
                          Set<String> inFlight, Set<String> pending) {
        String runId = state.getRunId();
        ExecutionDag dag = plan.getDag();
        try {
            while (true) {
                Set<String> excluded = new HashSet<>(inFlight);
                excluded.addAll(pending);
                excluded.addAll(state.getArtifactsIn(ArtifactStatus.FAILED));
                excluded.addAll(state.getArtifactsIn(ArtifactStatus.SKIPPED));
                List<String> ready = dag.getReadySet(state.getArtifactsIn(ArtifactStatus.COMPLETED), excluded);

                for (String artifactId : ready) {
                    if (!state.markRunning(artifactId)) {
                        continue;
                    }
                    repository.saveState(state);
                    inFlight.add(artifactId);
                    dispatch(plan, runId, artifactId, workers, watchdog, timeout, completions);
                }

                if (inFlight.isEmpty()) {
                    return;
                }

                Outcome outcome = completions.take();
                inFlight.remove(outcome.artifactId);
                handle(plan, state, outcome, pending);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run [{}] interrupted while waiting for {} in-flight artifacts", runId, inFlight.size());
            for (String artifactId : inFlight) {
                state.markPending(artifactId);
                pending.add(artifactId);
            }
            repository.saveState(state);
        }
    }

    /**
     * 调度过程中出现非组件错误(如状态持久化失败)时，将运行标记为 FAILED，保证之后可以恢复
     */
    private void abandon(String runId, Throwable cause) {
        log.error("Run [{}] aborted by an unexpected error, marking it {}", runId, RunStatus.FAILED, cause);
        try {
            finish(runId, RunStatus.FAILED);
        } catch (RuntimeException e) {
            log.error("Failed to release run [{}] after abort", runId, e);
            cause.addSuppressed(e);
        }
    }

    private void dispatch(ExecutionPlan plan, String runId, String artifactId, ExecutorService workers,
                          ScheduledExecutorService watchdog, Duration timeout, BlockingQueue<Outcome> completions) {
        AtomicBoolean settled = new AtomicBoolean(false);
        AtomicReference<Future<?>> task = new AtomicReference<>();
        log.debug("Dispatching artifact [{}] of run [{}]", artifactId, runId);
        task.set(workers.submit(() -> {
            // 超时从工作线程真正开始执行时计算，排队等待的时间不计入
            ScheduledFuture<?> deadline = watchdog == null ? null : watchdog.schedule(() -> {
                if (settled.compareAndSet(false, true)) {
                    Future<?> running = task.get();
                    if (running != null) {
                        running.cancel(true);
                    }
                    completions.add(new Outcome(artifactId,
                            ComponentResult.failure("Timed out after " + timeout.toMillis() + " ms")));
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);

            ComponentResult result;
            try {
                result = produce(plan, runId, artifactId);
            } catch (Throwable e) {
                // 组件的任何错误都只影响当前制品
                result = ComponentResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            }
            if (!settled.compareAndSet(false, true)) {
                log.debug("Discarding late result of timed out artifact [{}]", artifactId);
                return;
            }
            if (deadline != null) {
                deadline.cancel(false);
            }
            if (result.isSuccess()) {
                try {
                    store.put(runId, artifactId, result.getMessage());
                } catch (RuntimeException e) {
                    result = ComponentResult.failure("Failed to persist artifact: " + e.getMessage(), e);
                }
            }
            completions.add(new Outcome(artifactId, result));
        }));
    }

    /**
     * 在工作线程中执行: 复用、连接器抽取或分析器转换
     */
    private ComponentResult produce(ExecutionPlan plan, String runId, String artifactId) {
        ArtifactDefinition artifact = plan.getArtifact(artifactId);
        Schema outputSchema = plan.getSchemas(artifactId).getOutputSchema();

        if (artifact.hasReuse()) {
            ReuseConfig reuse = artifact.getReuse();
            Optional<Message> prior = store.get(reuse.getFromRun(), reuse.getArtifact());
            if (prior.isEmpty()) {
                return ComponentResult.failure(String.format("Reuse source '%s' not found in run '%s'",
                        reuse.getArtifact(), reuse.getFromRun()));
            }
            return ComponentResult.success(prior.get().toBuilder().source(reuse.describe()).build());
        }

        if (artifact.isSource()) {
            ConnectorFactory factory = registry.getConnector(artifact.getSource().getType());
            if (!factory.canCreate(artifact.getSource().getProperties())) {
                return ComponentResult.failure("Connector '" + factory.getComponentName()
                        + "' cannot be created with the given configuration");
            }
            Connector connector = factory.create(artifact.getSource().getProperties());
            return withSchema(connector.extract(outputSchema), outputSchema);
        }

        List<Message> inputs = new ArrayList<>(artifact.getInputs().size());
        for (String input : artifact.getInputs()) {
            inputs.add(store.get(runId, input).orElseThrow(() -> new ArtifactNotFoundException(runId, input)));
        }

        if (!artifact.hasTransform()) {
            return ComponentResult.success(MessageMerger.concatenate(artifactId, outputSchema, inputs));
        }

        AnalyserFactory factory = registry.getAnalyser(artifact.getTransform().getType());
        if (!factory.canCreate(artifact.getTransform().getProperties())) {
            return ComponentResult.failure("Analyser '" + factory.getComponentName()
                    + "' cannot be created with the given configuration");
        }
        Analyser analyser = factory.create(artifact.getTransform().getProperties());
        return withSchema(analyser.process(inputs, outputSchema), outputSchema);
    }

    private static ComponentResult withSchema(ComponentResult result, Schema outputSchema) {
        if (result == null) {
            return ComponentResult.failure("Component returned no result");
        }
        if (result.isSuccess() && result.getMessage().getSchema() == null) {
            return ComponentResult.success(result.getMessage().toBuilder().schema(outputSchema).build());
        }
        return result;
    }

    private void handle(ExecutionPlan plan, ExecutionState state, Outcome outcome, Set<String> pending) {
        String artifactId = outcome.artifactId;
        ComponentResult result = outcome.result;
        switch (result.getKind()) {
            case SUCCESS:
                state.markCompleted(artifactId);
                repository.saveState(state);
                log.info("Artifact [{}] completed", artifactId);
                break;
            case PENDING:
                state.markPending(artifactId);
                pending.add(artifactId);
                repository.saveState(state);
                log.warn("Artifact [{}] is pending: {}", artifactId, result.getReason());
                break;
            default:
                state.markFailed(artifactId, result.getReason());
                if (plan.getArtifact(artifactId).isOptional()) {
                    log.warn("Optional artifact [{}] failed: {}", artifactId, result.getReason());
                } else {
                    log.error("Artifact [{}] failed: {}", artifactId, result.getReason(), result.getCause());
                }
                for (String dependent : plan.getDag().getTransitiveDependents(artifactId)) {
                    if (state.markSkipped(dependent, "Upstream artifact '" + artifactId + "' failed")) {
                        log.warn("Artifact [{}] skipped because upstream [{}] failed", dependent, artifactId);
                    }
                }
                repository.saveState(state);
                break;
        }
    }

    /**
     * 终态优先级: INTERRUPTED > FAILED > COMPLETED
     */
    private static RunStatus terminalStatus(ExecutionState state, Set<String> pending) {
        if (!pending.isEmpty()) {
            return RunStatus.INTERRUPTED;
        }
        if (!state.getArtifactsIn(ArtifactStatus.FAILED).isEmpty()) {
            return RunStatus.FAILED;
        }
        return state.isFullyCompleted() ? RunStatus.COMPLETED : RunStatus.INTERRUPTED;
    }

    private void finish(String runId, RunStatus status) {
        synchronized (lifecycleLock) {
            RunMetadata metadata = repository.findMetadata(runId).orElseThrow(() -> new RunNotFoundException(runId));
            metadata.setStatus(status);
            metadata.setCompletedAt(Instant.now());
            repository.saveMetadata(metadata);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Outcome {
        private final String artifactId;
        private final ComponentResult result;

        private Outcome(String artifactId, ComponentResult result) {
            this.artifactId = artifactId;
            this.result = result;
        }
    }
}
