package com.tencent.scanflow.domain.runbook;

import com.tencent.scanflow.domain.exception.MissingArtifactException;
import com.tencent.scanflow.domain.exception.RunbookParseException;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Runbook - 运行手册
 * <p>
 * 声明式地定义一组命名制品及其生产方式。artifacts 保持声明顺序。
 * inputs / outputs 仅在作为子运行手册被引用时生效，定义其对外契约。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class Runbook {

    /**
     * 运行手册名称
     */
    String name;

    String description;

    /**
     * 负责人
     */
    String contact;

    /**
     * 适用的合规框架 (如 GDPR)
     */
    String framework;

    /**
     * 执行配置
     */
    @Builder.Default
    RunbookConfig config = RunbookConfig.defaults();

    /**
     * 作为子运行手册时的输入声明
     */
    @Builder.Default
    Map<String, RunbookInputDeclaration> inputs = Collections.emptyMap();

    /**
     * 作为子运行手册时的输出声明
     */
    @Builder.Default
    Map<String, RunbookOutputDeclaration> outputs = Collections.emptyMap();

    /**
     * 制品定义: 制品 ID -> 定义
     */
    @Builder.Default
    Map<String, ArtifactDefinition> artifacts = new LinkedHashMap<>();

    public ArtifactDefinition getArtifact(String artifactId) {
        return artifacts.get(artifactId);
    }

    /**
     * 结构校验
     * <p>
     * 不访问组件注册表，只检查运行手册自身的一致性。
     * </p>
     */
    public void validate() {
        if (name == null || name.trim().isEmpty()) {
            throw new RunbookParseException("Runbook name cannot be empty");
        }
        if (artifacts == null || artifacts.isEmpty()) {
            throw new RunbookParseException("Runbook '" + name + "' declares no artifacts");
        }
        if (config != null && config.getMaxConcurrency() != null && config.getMaxConcurrency() < 1) {
            throw new RunbookParseException("Runbook '" + name + "' max_concurrency must be at least 1");
        }
        if (config != null && config.getTimeout() != null && config.getTimeout() < 1) {
            throw new RunbookParseException("Runbook '" + name + "' timeout must be at least 1 second");
        }

        artifacts.forEach((id, artifact) -> artifact.validate(id));
        validateInputDeclarations();
        validateOutputDeclarations();
        validateReferences();
    }

    private void validateInputDeclarations() {
        for (Map.Entry<String, RunbookInputDeclaration> entry : inputs.entrySet()) {
            RunbookInputDeclaration declaration = entry.getValue();
            if (artifacts.containsKey(entry.getKey())) {
                throw new RunbookParseException("Runbook input '" + entry.getKey() + "' collides with an artifact ID");
            }
            if (declaration.getInputSchema() == null) {
                throw new RunbookParseException("Runbook input '" + entry.getKey() + "' must declare 'input_schema'");
            }
            if (declaration.getDefaultValue() != null && !declaration.isOptional()) {
                throw new RunbookParseException(
                        "Runbook input '" + entry.getKey() + "' declares a default but is not optional");
            }
        }
        if (!inputs.isEmpty()) {
            artifacts.forEach((id, artifact) -> {
                if (artifact.isSource()) {
                    throw new RunbookParseException("Runbook '" + name
                            + "' declares inputs and cannot contain source artifact '" + id + "'");
                }
            });
        }
    }

    private void validateOutputDeclarations() {
        for (Map.Entry<String, RunbookOutputDeclaration> entry : outputs.entrySet()) {
            String target = entry.getValue().getArtifact();
            if (target == null || !artifacts.containsKey(target)) {
                throw new RunbookParseException("Runbook output '" + entry.getKey()
                        + "' references unknown artifact '" + target + "'");
            }
        }
    }

    private void validateReferences() {
        Set<String> known = new HashSet<>(artifacts.keySet());
        known.addAll(inputs.keySet());
        artifacts.values().stream()
                .filter(ArtifactDefinition::isChildRunbook)
                .forEach(a -> known.addAll(a.getChildRunbook().getOutputMapping().values()));

        artifacts.forEach((id, artifact) -> {
            for (String input : artifact.getInputs()) {
                if (!known.contains(input)) {
                    throw new MissingArtifactException(id, input);
                }
            }
        });
    }
}
