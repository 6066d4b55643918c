package com.tencent.scanflow.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * RunSummaryDTO - 运行概要
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummaryDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private String runId;

    private String runbookName;

    /**
     * active / completed / interrupted / failed
     */
    private String status;

    private String fingerprint;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * 制品 ID -> not_started / running / completed / failed / skipped
     */
    private Map<String, String> artifacts;

    /**
     * 制品 ID -> 失败原因
     */
    private Map<String, String> errors;

    /**
     * 对外名称 -> 内部制品 ID
     */
    private Map<String, String> aliases;

    /**
     * 标记为 output 的制品
     */
    private List<String> outputs;
}
