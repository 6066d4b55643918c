package com.tencent.scanflow.app.service;

import com.tencent.scanflow.app.assembler.RunAssembler;
import com.tencent.scanflow.app.loader.FileRunbookLoader;
import com.tencent.scanflow.client.dto.RunSummaryDTO;
import com.tencent.scanflow.domain.exception.RunNotFoundException;
import com.tencent.scanflow.domain.executor.DagExecutor;
import com.tencent.scanflow.domain.executor.RunResult;
import com.tencent.scanflow.domain.plan.ExecutionPlan;
import com.tencent.scanflow.domain.plan.Planner;
import com.tencent.scanflow.domain.plan.RunbookLoader.LoadedRunbook;
import com.tencent.scanflow.domain.state.RunMetadata;
import com.tencent.scanflow.domain.state.RunStateRepository;
import com.tencent.scanflow.domain.state.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RunbookAppService {

    private final FileRunbookLoader runbookLoader;
    private final Planner planner;
    private final DagExecutor dagExecutor;
    private final RunStateRepository runStateRepository;

    public ExecutionPlan plan(String runbookPath) {
        LoadedRunbook loaded = runbookLoader.loadRoot(runbookPath);
        return planner.plan(loaded.getRunbook(), loaded.getLocation());
    }

    /**
     * 启动运行，runId 为空时生成新的 ID
     */
    public RunSummaryDTO run(String runbookPath, String runId) {
        ExecutionPlan plan = plan(runbookPath);
        String id = runId == null || runId.isBlank() ? UUID.randomUUID().toString() : runId;
        log.info("Submitting runbook {} as run [{}]", runbookPath, id);
        RunResult result = dagExecutor.run(plan, id);
        return summarize(result, plan);
    }

    public RunSummaryDTO resume(String runbookPath, String runId) {
        ExecutionPlan plan = plan(runbookPath);
        log.info("Resuming run [{}] with runbook {}", runId, runbookPath);
        RunResult result = dagExecutor.resume(plan, runId);
        return summarize(result, plan);
    }

    public RunSummaryDTO getRun(String runId) {
        RunMetadata metadata = runStateRepository.findMetadata(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
        return RunAssembler.toSummary(metadata, runStateRepository.findState(runId).orElse(null));
    }

    /**
     * @param status 可为空，按运行状态过滤 (不区分大小写)
     */
    public List<RunSummaryDTO> listRuns(String status) {
        RunStatus filter = status == null || status.isBlank() ? null : RunStatus.valueOf(status.toUpperCase(Locale.ROOT));
        return runStateRepository.listRuns().stream()
                .filter(metadata -> filter == null || metadata.getStatus() == filter)
                .map(metadata -> RunAssembler.toSummary(metadata,
                        runStateRepository.findState(metadata.getRunId()).orElse(null)))
                .collect(Collectors.toList());
    }

    private RunSummaryDTO summarize(RunResult result, ExecutionPlan plan) {
        RunMetadata metadata = runStateRepository.findMetadata(result.getRunId())
                .orElseThrow(() -> new RunNotFoundException(result.getRunId()));
        return RunAssembler.toSummary(metadata, result, plan);
    }
}
