package com.tencent.scanflow.infrastructure.persistence.run.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * RunMetadataDO - 运行元数据
 *
 * @author scanflow
 */
@Data
@TableName("scan_run")
public class RunMetadataDO {

    /**
     * 主键ID
     */
    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 运行ID (唯一)
     */
    private String runId;

    private String runbookName;

    /**
     * 执行计划指纹
     */
    private String fingerprint;

    /**
     * ACTIVE / COMPLETED / INTERRUPTED / FAILED
     */
    private String status;

    private Instant startedAt;

    private Instant completedAt;
}
