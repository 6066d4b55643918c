package com.tencent.scanflow.app.parser;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tencent.scanflow.app.dto.ArtifactYamlDto;
import com.tencent.scanflow.app.dto.ChildRunbookYamlDto;
import com.tencent.scanflow.app.dto.ComponentYamlDto;
import com.tencent.scanflow.app.dto.InputDeclarationYamlDto;
import com.tencent.scanflow.app.dto.OutputDeclarationYamlDto;
import com.tencent.scanflow.app.dto.RunbookConfigYamlDto;
import com.tencent.scanflow.app.dto.RunbookYamlDto;
import com.tencent.scanflow.domain.exception.RunbookParseException;
import com.tencent.scanflow.domain.runbook.ArtifactDefinition;
import com.tencent.scanflow.domain.runbook.ChildRunbookConfig;
import com.tencent.scanflow.domain.runbook.ReuseConfig;
import com.tencent.scanflow.domain.runbook.Runbook;
import com.tencent.scanflow.domain.runbook.RunbookConfig;
import com.tencent.scanflow.domain.runbook.RunbookInputDeclaration;
import com.tencent.scanflow.domain.runbook.RunbookOutputDeclaration;
import com.tencent.scanflow.domain.runbook.SourceConfig;
import com.tencent.scanflow.domain.runbook.TransformConfig;
import com.tencent.scanflow.domain.schema.Schema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * RunbookYamlParser - 运行手册解析
 * <p>
 * YAML 文本先做 ${VAR} 环境变量替换，再映射为 DTO，最后转换为领域对象并做结构校验。
 * 已解析的映射 (如来自其他配置源) 可通过 {@link #parseMap(Map)} 直接转换，不做环境变量替换。
 * </p>
 */
@Component
public class RunbookYamlParser {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private final EnvironmentSubstitutor substitutor;

    public RunbookYamlParser() {
        this(System::getenv);
    }

    public RunbookYamlParser(Function<String, String> environment) {
        this.substitutor = new EnvironmentSubstitutor(environment);
    }

    public Runbook parse(String yamlContent) {
        String content = substitutor.substitute(yamlContent);
        RunbookYamlDto dto;
        try {
            dto = mapper.readValue(content, RunbookYamlDto.class);
        } catch (JsonProcessingException e) {
            throw new RunbookParseException("Failed to parse runbook YAML: " + e.getOriginalMessage(), e);
        }
        if (dto == null) {
            throw new RunbookParseException("Runbook YAML is empty");
        }
        return convert(dto);
    }

    public Runbook parseFile(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RunbookParseException("Failed to read runbook file " + path, e);
        }
        return parse(content);
    }

    public Runbook parseMap(Map<String, Object> raw) {
        RunbookYamlDto dto;
        try {
            dto = mapper.convertValue(raw, RunbookYamlDto.class);
        } catch (IllegalArgumentException e) {
            throw new RunbookParseException("Invalid runbook mapping: " + e.getMessage(), e);
        }
        return convert(dto);
    }

    private Runbook convert(RunbookYamlDto dto) {
        Map<String, ArtifactDefinition> artifacts = new LinkedHashMap<>();
        if (dto.getArtifacts() != null) {
            dto.getArtifacts().forEach((id, artifact) -> artifacts.put(id, convertArtifact(id, artifact)));
        }
        Map<String, RunbookInputDeclaration> inputs = new LinkedHashMap<>();
        if (dto.getInputs() != null) {
            dto.getInputs().forEach((name, input) -> inputs.put(name, convertInput(name, input)));
        }
        Map<String, RunbookOutputDeclaration> outputs = new LinkedHashMap<>();
        if (dto.getOutputs() != null) {
            dto.getOutputs().forEach((name, output) -> outputs.put(name, convertOutput(output)));
        }

        Runbook runbook = Runbook.builder()
                .name(dto.getName())
                .description(dto.getDescription())
                .contact(dto.getContact())
                .framework(dto.getFramework())
                .config(convertConfig(dto.getConfig()))
                .inputs(inputs)
                .outputs(outputs)
                .artifacts(artifacts)
                .build();
        runbook.validate();
        return runbook;
    }

    private ArtifactDefinition convertArtifact(String id, ArtifactYamlDto dto) {
        if (dto == null) {
            throw new RunbookParseException("Artifact '" + id + "' has no definition");
        }
        ArtifactDefinition.ArtifactDefinitionBuilder builder = ArtifactDefinition.builder()
                .name(dto.getName())
                .description(dto.getDescription())
                .contact(dto.getContact())
                .inputs(dto.getInputs() == null ? Collections.emptyList() : List.copyOf(dto.getInputs()))
                .output(Boolean.TRUE.equals(dto.getOutput()))
                .optional(Boolean.TRUE.equals(dto.getOptional()));

        if (dto.getSource() != null) {
            builder.source(SourceConfig.builder()
                    .type(dto.getSource().getType())
                    .properties(properties(dto.getSource()))
                    .build());
        }
        if (dto.getTransform() != null) {
            builder.transform(TransformConfig.builder()
                    .type(dto.getTransform().getType())
                    .properties(properties(dto.getTransform()))
                    .build());
        }
        if (dto.getReuse() != null) {
            builder.reuse(ReuseConfig.builder()
                    .fromRun(dto.getReuse().getFromRun())
                    .artifact(dto.getReuse().getArtifact())
                    .build());
        }
        if (dto.getMerge() != null) {
            builder.merge(dto.getMerge());
        }
        if (dto.getOutputSchema() != null) {
            builder.outputSchema(parseSchema(dto.getOutputSchema(), "output_schema of artifact '" + id + "'"));
        }
        if (dto.getChildRunbook() != null) {
            builder.childRunbook(convertChild(dto.getChildRunbook()));
        }
        return builder.build();
    }

    private ChildRunbookConfig convertChild(ChildRunbookYamlDto dto) {
        return ChildRunbookConfig.builder()
                .path(dto.getPath())
                .inputMapping(dto.getInputMapping() == null ? Collections.emptyMap() : dto.getInputMapping())
                .output(dto.getOutput())
                .outputMapping(dto.getOutputMapping() == null ? Collections.emptyMap() : dto.getOutputMapping())
                .build();
    }

    private RunbookInputDeclaration convertInput(String name, InputDeclarationYamlDto dto) {
        if (dto == null || dto.getInputSchema() == null) {
            throw new RunbookParseException("Runbook input '" + name + "' must declare 'input_schema'");
        }
        return RunbookInputDeclaration.builder()
                .inputSchema(parseSchema(dto.getInputSchema(), "input_schema of input '" + name + "'"))
                .optional(Boolean.TRUE.equals(dto.getOptional()))
                .defaultValue(dto.getDefaultValue())
                .sensitive(Boolean.TRUE.equals(dto.getSensitive()))
                .description(dto.getDescription())
                .build();
    }

    private RunbookOutputDeclaration convertOutput(OutputDeclarationYamlDto dto) {
        return RunbookOutputDeclaration.builder()
                .artifact(dto == null ? null : dto.getArtifact())
                .description(dto == null ? null : dto.getDescription())
                .build();
    }

    private RunbookConfig convertConfig(RunbookConfigYamlDto dto) {
        if (dto == null) {
            return RunbookConfig.defaults();
        }
        RunbookConfig.RunbookConfigBuilder builder = RunbookConfig.builder()
                .timeout(dto.getTimeout())
                .maxConcurrency(dto.getMaxConcurrency());
        if (dto.getMaxChildDepth() != null) {
            builder.maxChildDepth(dto.getMaxChildDepth());
        }
        if (dto.getTemplatePaths() != null) {
            builder.templatePaths(List.copyOf(dto.getTemplatePaths()));
        }
        return builder.build();
    }

    private static Map<String, Object> properties(ComponentYamlDto dto) {
        return dto.getProperties() == null ? Collections.emptyMap() : dto.getProperties();
    }

    private static Schema parseSchema(String value, String context) {
        try {
            return Schema.parse(value);
        } catch (IllegalArgumentException e) {
            throw new RunbookParseException("Invalid " + context + ": " + e.getMessage(), e);
        }
    }
}
