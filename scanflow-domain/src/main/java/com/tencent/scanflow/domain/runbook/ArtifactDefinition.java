package com.tencent.scanflow.domain.runbook;

import com.tencent.scanflow.domain.exception.RunbookParseException;
import com.tencent.scanflow.domain.schema.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * ArtifactDefinition - 制品定义
 * <p>
 * 制品按生产方式分为三类:
 * <ul>
 *   <li>源制品: 声明 source，由连接器产出</li>
 *   <li>派生制品: 声明 inputs，可选 transform 对合并后的输入做分析</li>
 *   <li>子运行手册制品: 声明 inputs 与 child_runbook，由嵌套运行手册产出</li>
 * </ul>
 * reuse 可叠加在任一类之上，执行时以历史运行的产出替代重新计算。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ArtifactDefinition {

    public static final String MERGE_CONCATENATE = "concatenate";

    /**
     * 可读名称
     */
    String name;

    String description;

    /**
     * 负责人
     */
    String contact;

    /**
     * 连接器配置 (源制品)
     */
    SourceConfig source;

    /**
     * 上游制品 ID，多个即扇入
     */
    @Builder.Default
    List<String> inputs = Collections.emptyList();

    /**
     * 分析器配置
     */
    TransformConfig transform;

    /**
     * 复用配置
     */
    ReuseConfig reuse;

    /**
     * 扇入合并策略
     */
    @Builder.Default
    String merge = MERGE_CONCATENATE;

    /**
     * 输出 Schema 覆盖，优先级最高
     */
    Schema outputSchema;

    /**
     * 是否作为运行结果导出
     */
    boolean output;

    /**
     * 可选制品失败时仅告警
     */
    boolean optional;

    /**
     * 子运行手册引用
     */
    ChildRunbookConfig childRunbook;

    public boolean isSource() {
        return source != null;
    }

    public boolean hasInputs() {
        return inputs != null && !inputs.isEmpty();
    }

    public boolean hasTransform() {
        return transform != null;
    }

    public boolean hasReuse() {
        return reuse != null;
    }

    public boolean isChildRunbook() {
        return childRunbook != null;
    }

    /**
     * 结构校验，不访问组件注册表
     */
    public void validate(String artifactId) {
        if (artifactId == null || artifactId.trim().isEmpty()) {
            throw new RunbookParseException("Artifact ID cannot be empty");
        }
        if (artifactId.contains("__")) {
            throw new RunbookParseException(
                    "Artifact ID '" + artifactId + "' must not contain '__' (reserved for child runbook namespaces)");
        }
        if (isSource() && hasInputs()) {
            throw new RunbookParseException(
                    "Artifact '" + artifactId + "' cannot have both 'source' and 'inputs'");
        }
        if (!isSource() && !hasInputs()) {
            if (!hasReuse()) {
                throw new RunbookParseException(
                        "Artifact '" + artifactId + "' must have either 'source' or 'inputs'");
            }
            if (outputSchema == null) {
                throw new RunbookParseException(
                        "Reuse artifact '" + artifactId + "' without 'source' or 'inputs' must declare 'output_schema'");
            }
        }
        if (isSource() && (source.getType() == null || source.getType().trim().isEmpty())) {
            throw new RunbookParseException("Artifact '" + artifactId + "' has a source without a type");
        }
        if (hasTransform()) {
            if (!hasInputs()) {
                throw new RunbookParseException(
                        "Artifact '" + artifactId + "' declares 'transform' but has no 'inputs'");
            }
            if (transform.getType() == null || transform.getType().trim().isEmpty()) {
                throw new RunbookParseException("Artifact '" + artifactId + "' has a transform without a type");
            }
        }
        if (hasInputs()) {
            for (String input : inputs) {
                if (input == null || input.trim().isEmpty()) {
                    throw new RunbookParseException("Artifact '" + artifactId + "' has an empty input reference");
                }
            }
        }
        if (!MERGE_CONCATENATE.equals(merge)) {
            throw new RunbookParseException(
                    "Artifact '" + artifactId + "' uses unsupported merge strategy '" + merge + "'");
        }
        if (hasReuse() && (isBlank(reuse.getFromRun()) || isBlank(reuse.getArtifact()))) {
            throw new RunbookParseException(
                    "Artifact '" + artifactId + "' reuse requires both 'from_run' and 'artifact'");
        }
        if (isChildRunbook()) {
            validateChildRunbook(artifactId);
        }
    }

    private void validateChildRunbook(String artifactId) {
        if (hasTransform()) {
            throw new RunbookParseException(
                    "Artifact '" + artifactId + "' cannot combine 'child_runbook' with 'transform'");
        }
        if (!hasInputs()) {
            throw new RunbookParseException(
                    "Child runbook artifact '" + artifactId + "' requires 'inputs'");
        }
        if (hasReuse()) {
            throw new RunbookParseException(
                    "Child runbook artifact '" + artifactId + "' cannot declare 'reuse'");
        }
        if (isBlank(childRunbook.getPath())) {
            throw new RunbookParseException("Child runbook artifact '" + artifactId + "' has no 'path'");
        }
        boolean hasOutput = !isBlank(childRunbook.getOutput());
        boolean hasOutputMapping = !childRunbook.getOutputMapping().isEmpty();
        if (hasOutput == hasOutputMapping) {
            throw new RunbookParseException("Child runbook artifact '" + artifactId
                    + "' must declare exactly one of 'output' or 'output_mapping'");
        }
        for (String mapped : childRunbook.getInputMapping().values()) {
            if (!inputs.contains(mapped)) {
                throw new RunbookParseException("Child runbook artifact '" + artifactId
                        + "' maps input from '" + mapped + "' which is not listed in its 'inputs'");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
