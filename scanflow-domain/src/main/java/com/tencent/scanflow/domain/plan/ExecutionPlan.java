package com.tencent.scanflow.domain.plan;

import com.tencent.scanflow.domain.dag.ExecutionDag;
import com.tencent.scanflow.domain.runbook.ArtifactDefinition;
import com.tencent.scanflow.domain.runbook.Runbook;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ExecutionPlan - 执行计划
 * <p>
 * 由规划器一次性构建，之后不再修改。runbook 为展开子运行手册之后的扁平运行手册，
 * aliases 记录对外名称到内部 (可能带命名空间的) 制品 ID 的映射。
 * </p>
 */
@Getter
public final class ExecutionPlan {

    private final Runbook runbook;
    private final ExecutionDag dag;
    private final Map<String, ArtifactSchemas> artifactSchemas;
    private final Map<String, String> aliases;
    private final Map<String, String> reversedAliases;
    private final String fingerprint;

    public ExecutionPlan(Runbook runbook, ExecutionDag dag, Map<String, ArtifactSchemas> artifactSchemas,
                         Map<String, String> aliases, String fingerprint) {
        this.runbook = runbook;
        this.dag = dag;
        this.artifactSchemas = Collections.unmodifiableMap(new LinkedHashMap<>(artifactSchemas));
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        Map<String, String> reversed = new LinkedHashMap<>();
        aliases.forEach((external, internal) -> reversed.putIfAbsent(internal, external));
        this.reversedAliases = Collections.unmodifiableMap(reversed);
        this.fingerprint = fingerprint;
    }

    public ArtifactDefinition getArtifact(String artifactId) {
        ArtifactDefinition artifact = runbook.getArtifacts().get(artifactId);
        if (artifact == null) {
            throw new IllegalArgumentException("Unknown artifact: " + artifactId);
        }
        return artifact;
    }

    public ArtifactSchemas getSchemas(String artifactId) {
        ArtifactSchemas schemas = artifactSchemas.get(artifactId);
        if (schemas == null) {
            throw new IllegalArgumentException("Unknown artifact: " + artifactId);
        }
        return schemas;
    }

    /**
     * 对外名称解析为内部制品 ID，非别名原样返回
     */
    public String resolve(String name) {
        return aliases.getOrDefault(name, name);
    }
}
