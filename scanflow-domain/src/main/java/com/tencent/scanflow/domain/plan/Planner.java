package com.tencent.scanflow.domain.plan;

import com.tencent.scanflow.domain.component.AnalyserFactory;
import com.tencent.scanflow.domain.component.ComponentFactory;
import com.tencent.scanflow.domain.component.ComponentRegistry;
import com.tencent.scanflow.domain.dag.ExecutionDag;
import com.tencent.scanflow.domain.exception.ComponentNotFoundException;
import com.tencent.scanflow.domain.exception.SchemaCompatibilityException;
import com.tencent.scanflow.domain.runbook.ArtifactDefinition;
import com.tencent.scanflow.domain.runbook.Runbook;
import com.tencent.scanflow.domain.schema.Schema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Planner - 执行计划编译器
 * <p>
 * 将运行手册与组件注册表编译为不可变的 {@link ExecutionPlan}。所有校验都在任何制品执行前完成，
 * 步骤依次为:
 * <ol>
 *   <li>解析 source / transform 的组件类型</li>
 *   <li>递归展开子运行手册</li>
 *   <li>构建依赖图并检测环</li>
 *   <li>按拓扑序解析每个制品的输出 Schema</li>
 *   <li>校验扇入、子运行手册输入与分析器输入的 Schema 兼容性</li>
 * </ol>
 * </p>
 */
@Slf4j
public class Planner {

    private final ComponentRegistry registry;
    private final ChildRunbookFlattener flattener;

    public Planner(ComponentRegistry registry, RunbookLoader loader) {
        this.registry = registry;
        this.flattener = new ChildRunbookFlattener(loader);
    }

    public ExecutionPlan plan(Runbook runbook) {
        return plan(runbook, null);
    }

    /**
     * @param location 运行手册所在位置，子运行手册相对它解析；直接由映射构建时为空
     */
    public ExecutionPlan plan(Runbook runbook, String location) {
        runbook.validate();

        resolveComponents(runbook.getArtifacts());

        ChildRunbookFlattener.Result flattened = flattener.flatten(runbook, location);
        Map<String, ArtifactDefinition> artifacts = flattened.getArtifacts();
        resolveComponents(artifacts);

        ExecutionDag dag = ExecutionDag.fromArtifacts(artifacts);
        List<String> order = dag.topologicalOrder();

        Map<String, ArtifactSchemas> schemas = resolveSchemas(artifacts, order);
        validateFanIn(artifacts, schemas);
        validateChildInputs(flattened.getInputRequirements(), schemas);
        validateAnalyserInputs(artifacts, schemas);

        Map<String, ArtifactSchemas> ordered = new LinkedHashMap<>();
        artifacts.keySet().forEach(id -> ordered.put(id, schemas.get(id)));

        Runbook flat = runbook.toBuilder().artifacts(artifacts).build();
        String fingerprint = PlanFingerprint.compute(artifacts, ordered);
        log.info("Planned runbook [{}]: {} artifacts, {} aliases, fingerprint {}",
                runbook.getName(), artifacts.size(), flattened.getAliases().size(), fingerprint);
        return new ExecutionPlan(flat, dag, ordered, flattened.getAliases(), fingerprint);
    }

    private void resolveComponents(Map<String, ArtifactDefinition> artifacts) {
        artifacts.values().forEach(artifact -> {
            if (artifact.isSource()) {
                registry.getConnector(artifact.getSource().getType());
            }
            if (artifact.hasTransform()) {
                registry.getAnalyser(artifact.getTransform().getType());
            }
        });
    }

    private Map<String, ArtifactSchemas> resolveSchemas(Map<String, ArtifactDefinition> artifacts, List<String> order) {
        Map<String, ArtifactSchemas> schemas = new LinkedHashMap<>();
        for (String id : order) {
            ArtifactDefinition artifact = artifacts.get(id);
            Schema override = artifact.getOutputSchema();

            if (artifact.isSource()) {
                Schema output = override != null ? override
                        : defaultOutput(registry.getConnector(artifact.getSource().getType()));
                schemas.put(id, new ArtifactSchemas(null, output));
            } else if (artifact.hasInputs()) {
                Schema input = schemas.get(artifact.getInputs().get(0)).getOutputSchema();
                Schema output;
                if (override != null) {
                    output = override;
                } else if (artifact.hasTransform()) {
                    output = defaultOutput(registry.getAnalyser(artifact.getTransform().getType()));
                } else {
                    output = input;
                }
                schemas.put(id, new ArtifactSchemas(input, output));
            } else {
                // 独立复用制品，校验阶段已保证声明了 output_schema
                schemas.put(id, new ArtifactSchemas(null, override));
            }
        }
        return schemas;
    }

    private static Schema defaultOutput(ComponentFactory<?> factory) {
        List<Schema> outputs = factory.getOutputSchemas();
        if (outputs == null || outputs.isEmpty()) {
            throw new ComponentNotFoundException(factory.getComponentName(),
                    "Component '" + factory.getComponentName() + "' has no output schemas");
        }
        return outputs.get(0);
    }

    private void validateFanIn(Map<String, ArtifactDefinition> artifacts, Map<String, ArtifactSchemas> schemas) {
        artifacts.forEach((id, artifact) -> {
            if (artifact.getInputs().size() < 2) {
                return;
            }
            String firstInput = artifact.getInputs().get(0);
            Schema expected = schemas.get(firstInput).getOutputSchema();
            for (String input : artifact.getInputs()) {
                Schema actual = schemas.get(input).getOutputSchema();
                if (!expected.equals(actual)) {
                    throw new SchemaCompatibilityException(id, List.of(expected.toString(), actual.toString()),
                            String.format("Schema mismatch in fan-in for artifact '%s': '%s' produces %s but '%s' produces %s",
                                    id, firstInput, expected, input, actual));
                }
            }
        });
    }

    private void validateChildInputs(List<ChildRunbookFlattener.InputRequirement> requirements,
                                     Map<String, ArtifactSchemas> schemas) {
        for (ChildRunbookFlattener.InputRequirement requirement : requirements) {
            Schema actual = schemas.get(requirement.getSourceArtifactId()).getOutputSchema();
            Schema expected = requirement.getExpectedSchema();
            if (!expected.equals(actual)) {
                throw new SchemaCompatibilityException(requirement.getChildArtifactId(),
                        List.of(expected.toString(), actual.toString()),
                        String.format("Child runbook input '%s' of artifact '%s' expects %s but '%s' produces %s",
                                requirement.getInputName(), requirement.getChildArtifactId(), expected,
                                requirement.getSourceArtifactId(), actual));
            }
        }
    }

    private void validateAnalyserInputs(Map<String, ArtifactDefinition> artifacts, Map<String, ArtifactSchemas> schemas) {
        artifacts.forEach((id, artifact) -> {
            if (!artifact.hasTransform()) {
                return;
            }
            AnalyserFactory factory = registry.getAnalyser(artifact.getTransform().getType());
            List<Schema> accepted = factory.getInputSchemas();
            Schema input = schemas.get(id).getInputSchema();
            if (accepted != null && !accepted.isEmpty() && !accepted.contains(input)) {
                List<String> conflicting = new ArrayList<>();
                conflicting.add(input.toString());
                accepted.forEach(s -> conflicting.add(s.toString()));
                throw new SchemaCompatibilityException(id, conflicting,
                        String.format("Analyser '%s' of artifact '%s' does not accept input schema %s (accepts %s)",
                                factory.getComponentName(), id, input, accepted));
            }
        });
    }
}
