package com.tencent.scanflow.infrastructure.persistence.run.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * ExecutionStateDO - 运行的制品状态表
 *
 * @author scanflow
 */
@Data
@TableName(value = "scan_execution_state", autoResultMap = true)
public class ExecutionStateDO {

    /**
     * 主键ID
     */
    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 运行ID (唯一)
     */
    private String runId;

    private String fingerprint;

    /**
     * 制品ID -> 状态（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, String> statuses;

    /**
     * 制品ID -> 失败原因（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, String> errors;

    /**
     * 最近一次保存时间
     */
    private Instant lastCheckpoint;
}
