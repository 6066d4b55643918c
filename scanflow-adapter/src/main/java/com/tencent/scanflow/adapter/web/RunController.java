package com.tencent.scanflow.adapter.web;

import com.tencent.scanflow.app.service.RunbookAppService;
import com.tencent.scanflow.client.dto.MultiResponse;
import com.tencent.scanflow.client.dto.ResumeRunCmd;
import com.tencent.scanflow.client.dto.RunSummaryDTO;
import com.tencent.scanflow.client.dto.SingleResponse;
import com.tencent.scanflow.client.dto.StartRunCmd;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 运行管理接口
 * <p>
 * run / resume 同步执行，返回时运行已经结束 (completed / failed / interrupted)。
 * </p>
 */
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
public class RunController {

    private final RunbookAppService runbookAppService;

    @PostMapping
    public SingleResponse<RunSummaryDTO> start(@Valid @RequestBody StartRunCmd cmd) {
        return SingleResponse.of(runbookAppService.run(cmd.getRunbookPath(), cmd.getRunId()));
    }

    @PostMapping("/{runId}/resume")
    public SingleResponse<RunSummaryDTO> resume(@PathVariable String runId, @Valid @RequestBody ResumeRunCmd cmd) {
        return SingleResponse.of(runbookAppService.resume(cmd.getRunbookPath(), runId));
    }

    @GetMapping("/{runId}")
    public SingleResponse<RunSummaryDTO> get(@PathVariable String runId) {
        return SingleResponse.of(runbookAppService.getRun(runId));
    }

    @GetMapping
    public MultiResponse<RunSummaryDTO> list(@RequestParam(required = false) String status) {
        return MultiResponse.of(runbookAppService.listRuns(status));
    }
}
