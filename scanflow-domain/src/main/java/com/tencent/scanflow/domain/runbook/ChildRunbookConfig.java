package com.tencent.scanflow.domain.runbook;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * ChildRunbookConfig - 子运行手册引用
 * <p>
 * output 与 outputMapping 二选一:
 * output 暴露子运行手册的单个输出，作为当前制品本身；
 * outputMapping 暴露多个输出，每个输出在父运行手册中以新的名称出现。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ChildRunbookConfig {

    /**
     * 子运行手册路径 (相对于父运行手册所在目录或模板目录)
     */
    String path;

    /**
     * 输入映射: 子运行手册输入名 -> 父运行手册制品 ID
     */
    @Builder.Default
    Map<String, String> inputMapping = Collections.emptyMap();

    /**
     * 暴露的子运行手册输出名
     */
    String output;

    /**
     * 输出映射: 子运行手册输出名 -> 父运行手册中的名称
     */
    @Builder.Default
    Map<String, String> outputMapping = Collections.emptyMap();
}
