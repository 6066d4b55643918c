package com.tencent.scanflow.domain.runbook;

import com.tencent.scanflow.domain.schema.Schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行手册构造工具
 */
public final class RunbookFixtures {

    private RunbookFixtures() {
    }

    public static ArtifactDefinition source(String type) {
        return source(type, Map.of());
    }

    public static ArtifactDefinition source(String type, Map<String, Object> properties) {
        return ArtifactDefinition.builder()
                .source(SourceConfig.builder().type(type).properties(properties).build())
                .build();
    }

    public static ArtifactDefinition derived(String type, String... inputs) {
        return derived(type, Map.of(), inputs);
    }

    public static ArtifactDefinition derived(String type, Map<String, Object> properties, String... inputs) {
        return ArtifactDefinition.builder()
                .inputs(List.of(inputs))
                .transform(TransformConfig.builder().type(type).properties(properties).build())
                .build();
    }

    public static ArtifactDefinition passthrough(String... inputs) {
        return ArtifactDefinition.builder().inputs(List.of(inputs)).build();
    }

    public static ArtifactDefinition child(String path, Map<String, String> inputMapping, String output,
                                           String... inputs) {
        return ArtifactDefinition.builder()
                .inputs(List.of(inputs))
                .childRunbook(ChildRunbookConfig.builder()
                        .path(path)
                        .inputMapping(inputMapping)
                        .output(output)
                        .build())
                .build();
    }

    public static RunbookInputDeclaration input(String schema) {
        return RunbookInputDeclaration.builder().inputSchema(Schema.parse(schema)).build();
    }

    public static RunbookOutputDeclaration output(String artifact) {
        return RunbookOutputDeclaration.builder().artifact(artifact).build();
    }

    /**
     * 按参数顺序构建: id1, def1, id2, def2 ...
     */
    public static Runbook runbook(String name, Object... idAndDefinitions) {
        return Runbook.builder().name(name).artifacts(artifacts(idAndDefinitions)).build();
    }

    public static Map<String, ArtifactDefinition> artifacts(Object... idAndDefinitions) {
        Map<String, ArtifactDefinition> artifacts = new LinkedHashMap<>();
        for (int i = 0; i < idAndDefinitions.length; i += 2) {
            artifacts.put((String) idAndDefinitions[i], (ArtifactDefinition) idAndDefinitions[i + 1]);
        }
        return artifacts;
    }
}
