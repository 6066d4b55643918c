package com.tencent.scanflow.infrastructure.persistence.artifact.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * ArtifactDO - 制品数据对象
 *
 * @author scanflow
 */
@Data
@TableName(value = "scan_artifact", autoResultMap = true)
public class ArtifactDO {

    /**
     * 主键ID
     */
    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 运行ID，与 artifactId 组成唯一键
     */
    private String runId;

    private String artifactId;

    /**
     * 消息ID
     */
    private String messageId;

    /**
     * Schema，格式 name/version
     */
    private String schemaRef;

    /**
     * 消息内容（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> content;

    private String source;

    private Instant storedAt;
}
