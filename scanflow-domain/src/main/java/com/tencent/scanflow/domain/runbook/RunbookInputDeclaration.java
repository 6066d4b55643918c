package com.tencent.scanflow.domain.runbook;

import com.tencent.scanflow.domain.schema.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * RunbookInputDeclaration - 作为子运行手册时声明的输入
 */
@Value
@Builder(toBuilder = true)
public class RunbookInputDeclaration {

    /**
     * 期望的输入 Schema
     */
    Schema inputSchema;

    /**
     * 是否可选，可选输入未映射时被忽略
     */
    boolean optional;

    /**
     * 默认值，仅可选输入允许设置
     */
    Object defaultValue;

    /**
     * 敏感输入不会出现在日志中
     */
    boolean sensitive;

    String description;
}
