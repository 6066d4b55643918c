package com.tencent.scanflow.domain.exception;

/**
 * ErrorCode - 编排错误码
 * <p>
 * 每一种可区分的失败类型对应一个错误码，调用方据此分支处理，无需解析错误信息文本。
 * </p>
 */
public enum ErrorCode {

    RUNBOOK_PARSE_ERROR("RUNBOOK_PARSE_ERROR", "运行手册结构非法"),
    COMPONENT_NOT_FOUND("COMPONENT_NOT_FOUND", "连接器或分析器类型未注册"),
    MISSING_ARTIFACT("MISSING_ARTIFACT", "引用了未声明的制品"),
    CYCLE_DETECTED("CYCLE_DETECTED", "制品依赖存在环"),
    CIRCULAR_RUNBOOK("CIRCULAR_RUNBOOK", "子运行手册循环引用"),
    SCHEMA_COMPATIBILITY("SCHEMA_COMPATIBILITY", "Schema 不兼容"),
    MISSING_INPUT_MAPPING("MISSING_INPUT_MAPPING", "子运行手册输入映射缺失"),
    INVALID_OUTPUT_MAPPING("INVALID_OUTPUT_MAPPING", "子运行手册输出映射非法"),
    RUN_ALREADY_ACTIVE("RUN_ALREADY_ACTIVE", "运行仍处于活动状态"),
    RUNBOOK_CHANGED("RUNBOOK_CHANGED", "运行手册已变更，无法恢复"),
    RUN_NOT_FOUND("RUN_NOT_FOUND", "运行不存在"),
    ARTIFACT_NOT_FOUND("ARTIFACT_NOT_FOUND", "制品不存在");

    private final String code;
    private final String description;

    ErrorCode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
