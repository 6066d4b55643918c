package com.tencent.scanflow.domain.plan;

import com.tencent.scanflow.domain.exception.CircularRunbookException;
import com.tencent.scanflow.domain.exception.InvalidOutputMappingException;
import com.tencent.scanflow.domain.exception.MissingInputMappingException;
import com.tencent.scanflow.domain.exception.RunbookParseException;
import com.tencent.scanflow.domain.plan.RunbookLoader.LoadedRunbook;
import com.tencent.scanflow.domain.runbook.ArtifactDefinition;
import com.tencent.scanflow.domain.runbook.ChildRunbookConfig;
import com.tencent.scanflow.domain.runbook.Runbook;
import com.tencent.scanflow.domain.runbook.RunbookInputDeclaration;
import com.tencent.scanflow.domain.runbook.RunbookOutputDeclaration;
import com.tencent.scanflow.domain.schema.Schema;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ChildRunbookFlattener - 子运行手册展开
 * <p>
 * 递归地将 child_runbook 制品内联到父运行手册:
 * <ul>
 *   <li>子运行手册的制品 ID 加上 "&lt;父制品ID&gt;__" 前缀</li>
 *   <li>对子运行手册输入的引用改写为 input_mapping 指定的父制品</li>
 *   <li>父制品 ID (或 output_mapping 中的名称) 记为指向子运行手册输出制品的别名</li>
 * </ul>
 * 递归时携带"正在展开"的运行手册集合，重复进入即为循环引用。
 * </p>
 */
@Slf4j
public class ChildRunbookFlattener {

    public static final String NAMESPACE_SEPARATOR = "__";

    private final RunbookLoader loader;

    public ChildRunbookFlattener(RunbookLoader loader) {
        this.loader = loader;
    }

    /**
     * 展开结果
     */
    @Value
    public static class Result {

        /**
         * 扁平制品集合，保持声明顺序
         */
        Map<String, ArtifactDefinition> artifacts;

        /**
         * 别名: 对外名称 -> 内部制品 ID
         */
        Map<String, String> aliases;

        /**
         * 子运行手册输入的 Schema 约束
         */
        List<InputRequirement> inputRequirements;
    }

    /**
     * 父制品映射给子运行手册输入时，必须产出子运行手册声明的 Schema
     */
    @Value
    public static class InputRequirement {
        String childArtifactId;
        String inputName;
        String sourceArtifactId;
        Schema expectedSchema;
    }

    public Result flatten(Runbook runbook, String location) {
        Set<String> including = new LinkedHashSet<>();
        including.add(location == null ? runbook.getName() : location);
        List<String> templatePaths = runbook.getConfig().getTemplatePaths();
        return flatten(runbook, location, including, 0, runbook.getConfig().getMaxChildDepth(), templatePaths);
    }

    private Result flatten(Runbook runbook, String location, Set<String> including, int depth,
                           int maxDepth, List<String> rootTemplatePaths) {
        Map<String, ArtifactDefinition> artifacts = new LinkedHashMap<>();
        Map<String, String> aliases = new LinkedHashMap<>();
        List<InputRequirement> requirements = new ArrayList<>();

        for (Map.Entry<String, ArtifactDefinition> entry : runbook.getArtifacts().entrySet()) {
            String id = entry.getKey();
            ArtifactDefinition artifact = entry.getValue();
            if (!artifact.isChildRunbook()) {
                put(artifacts, id, artifact);
                continue;
            }
            expand(id, artifact, runbook, location, including, depth, maxDepth, rootTemplatePaths,
                    artifacts, aliases, requirements);
        }

        for (String alias : aliases.keySet()) {
            if (artifacts.containsKey(alias)) {
                throw new RunbookParseException("Child runbook output name '" + alias + "' collides with an artifact ID");
            }
        }

        // 引用子运行手册制品的 inputs 改写为真实制品 ID
        Map<String, ArtifactDefinition> resolved = new LinkedHashMap<>();
        artifacts.forEach((id, artifact) -> resolved.put(id, rewriteInputs(artifact, aliases)));
        List<InputRequirement> resolvedRequirements = new ArrayList<>();
        for (InputRequirement requirement : requirements) {
            resolvedRequirements.add(new InputRequirement(requirement.getChildArtifactId(), requirement.getInputName(),
                    resolveAlias(aliases, requirement.getSourceArtifactId()), requirement.getExpectedSchema()));
        }
        return new Result(resolved, aliases, resolvedRequirements);
    }

    private void expand(String parentId, ArtifactDefinition artifact, Runbook parent, String parentLocation,
                        Set<String> including, int depth, int maxDepth, List<String> rootTemplatePaths,
                        Map<String, ArtifactDefinition> artifacts, Map<String, String> aliases,
                        List<InputRequirement> requirements) {
        ChildRunbookConfig config = artifact.getChildRunbook();
        if (depth + 1 > maxDepth) {
            throw new RunbookParseException(String.format(
                    "Child runbook '%s' of artifact '%s' exceeds maximum nesting depth %d",
                    config.getPath(), parentId, maxDepth));
        }
        if (loader == null) {
            throw new RunbookParseException(
                    "Artifact '" + parentId + "' references a child runbook but no runbook loader is configured");
        }

        List<String> templatePaths = new ArrayList<>(parent.getConfig().getTemplatePaths());
        rootTemplatePaths.stream().filter(p -> !templatePaths.contains(p)).forEach(templatePaths::add);
        LoadedRunbook loaded = loader.load(config.getPath(), parentLocation, templatePaths);
        if (including.contains(loaded.getLocation())) {
            List<String> chain = new ArrayList<>(including);
            chain.add(loaded.getLocation());
            throw new CircularRunbookException(chain);
        }

        Runbook child = loaded.getRunbook();
        child.validate();
        log.debug("Expanding child runbook [{}] into artifact [{}]", loaded.getLocation(), parentId);

        Map<String, String> inputMapping = config.getInputMapping();
        validateInputMapping(parentId, child, inputMapping);
        List<String> exposed = validateOutputMapping(parentId, child, config);

        Set<String> nested = new LinkedHashSet<>(including);
        nested.add(loaded.getLocation());
        Result flattened = flatten(child, loaded.getLocation(), nested, depth + 1, maxDepth, rootTemplatePaths);

        String prefix = parentId + NAMESPACE_SEPARATOR;
        for (Map.Entry<String, ArtifactDefinition> entry : flattened.getArtifacts().entrySet()) {
            String childId = entry.getKey();
            ArtifactDefinition childArtifact = entry.getValue();
            List<String> inputs = new ArrayList<>();
            for (String input : childArtifact.getInputs()) {
                if (child.getInputs().containsKey(input)) {
                    String mapped = inputMapping.get(input);
                    if (mapped != null) {
                        inputs.add(mapped);
                    }
                } else {
                    inputs.add(prefix + input);
                }
            }
            if (childArtifact.hasInputs() && inputs.isEmpty()) {
                throw new MissingInputMappingException(parentId, childArtifact.getInputs().get(0), String.format(
                        "Child runbook artifact '%s' has no inputs left after dropping unmapped optional inputs",
                        childId));
            }
            ArtifactDefinition namespaced = childArtifact.toBuilder().inputs(inputs).build();
            put(artifacts, prefix + childId, namespaced);
        }
        flattened.getAliases().forEach((name, target) -> aliases.put(prefix + name, prefix + target));

        for (Map.Entry<String, String> mapping : inputMapping.entrySet()) {
            RunbookInputDeclaration declaration = child.getInputs().get(mapping.getKey());
            requirements.add(new InputRequirement(parentId, mapping.getKey(), mapping.getValue(),
                    declaration.getInputSchema()));
        }
        for (InputRequirement nestedRequirement : flattened.getInputRequirements()) {
            String source = nestedRequirement.getSourceArtifactId();
            if (child.getInputs().containsKey(source)) {
                source = inputMapping.get(source);
                if (source == null) {
                    continue;
                }
            } else {
                source = prefix + source;
            }
            requirements.add(new InputRequirement(prefix + nestedRequirement.getChildArtifactId(),
                    nestedRequirement.getInputName(), source, nestedRequirement.getExpectedSchema()));
        }

        if (config.getOutput() != null && !config.getOutput().isEmpty()) {
            String target = prefix + resolveAlias(flattened.getAliases(), exposed.get(0));
            registerAlias(aliases, parentId, target);
            if (artifact.isOutput()) {
                artifacts.computeIfPresent(target, (k, v) -> v.toBuilder().output(true).build());
            }
        } else {
            int index = 0;
            for (String parentName : config.getOutputMapping().values()) {
                String target = prefix + resolveAlias(flattened.getAliases(), exposed.get(index++));
                registerAlias(aliases, parentName, target);
            }
        }
    }

    private void validateInputMapping(String parentId, Runbook child, Map<String, String> inputMapping) {
        for (String mapped : inputMapping.keySet()) {
            if (!child.getInputs().containsKey(mapped)) {
                throw new MissingInputMappingException(parentId, mapped, String.format(
                        "Artifact '%s' maps unknown input '%s' of child runbook '%s'",
                        parentId, mapped, child.getName()));
            }
        }
        child.getInputs().forEach((name, declaration) -> {
            if (!inputMapping.containsKey(name) && !declaration.isOptional()) {
                throw new MissingInputMappingException(parentId, name, String.format(
                        "Artifact '%s' does not map required input '%s' of child runbook '%s'",
                        parentId, name, child.getName()));
            }
        });
    }

    /**
     * @return 暴露的子运行手册内部制品 ID，顺序与 output / output_mapping 一致
     */
    private List<String> validateOutputMapping(String parentId, Runbook child, ChildRunbookConfig config) {
        List<String> outputNames = new ArrayList<>();
        if (config.getOutput() != null && !config.getOutput().isEmpty()) {
            outputNames.add(config.getOutput());
        } else {
            outputNames.addAll(config.getOutputMapping().keySet());
        }
        List<String> exposed = new ArrayList<>();
        for (String outputName : outputNames) {
            RunbookOutputDeclaration declaration = child.getOutputs().get(outputName);
            if (declaration == null) {
                throw new InvalidOutputMappingException(parentId, outputName, String.format(
                        "Artifact '%s' exposes output '%s' which child runbook '%s' does not declare (declared: %s)",
                        parentId, outputName, child.getName(), child.getOutputs().keySet()));
            }
            exposed.add(declaration.getArtifact());
        }
        return exposed;
    }

    private static void registerAlias(Map<String, String> aliases, String name, String target) {
        String previous = aliases.putIfAbsent(name, target);
        if (previous != null) {
            throw new RunbookParseException("Duplicate child runbook output name '" + name + "'");
        }
    }

    private static void put(Map<String, ArtifactDefinition> artifacts, String id, ArtifactDefinition artifact) {
        if (artifacts.putIfAbsent(id, artifact) != null) {
            throw new RunbookParseException("Duplicate artifact ID '" + id + "' after flattening child runbooks");
        }
    }

    private static ArtifactDefinition rewriteInputs(ArtifactDefinition artifact, Map<String, String> aliases) {
        if (!artifact.hasInputs()) {
            return artifact;
        }
        List<String> inputs = new ArrayList<>(artifact.getInputs().size());
        for (String input : artifact.getInputs()) {
            inputs.add(resolveAlias(aliases, input));
        }
        return inputs.equals(artifact.getInputs()) ? artifact : artifact.toBuilder().inputs(inputs).build();
    }

    private static String resolveAlias(Map<String, String> aliases, String name) {
        String current = name;
        Set<String> seen = new LinkedHashSet<>();
        while (aliases.containsKey(current) && seen.add(current)) {
            String next = aliases.get(current);
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        return current;
    }
}
