package com.tencent.scanflow.app.loader;

import com.tencent.scanflow.app.config.ScanflowProperties;
import com.tencent.scanflow.app.parser.RunbookYamlParser;
import com.tencent.scanflow.domain.exception.RunbookParseException;
import com.tencent.scanflow.domain.plan.RunbookLoader;
import com.tencent.scanflow.domain.runbook.Runbook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * FileRunbookLoader - 从文件系统加载运行手册
 * <p>
 * 子运行手册路径必须是相对路径且不能包含 ".."。查找顺序:
 * <ol>
 *   <li>父运行手册所在目录</li>
 *   <li>运行手册 config.template_paths (相对路径基于父运行手册所在目录)</li>
 *   <li>全局 scanflow.runbook.template-paths</li>
 * </ol>
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileRunbookLoader implements RunbookLoader {

    private final RunbookYamlParser parser;
    private final ScanflowProperties properties;

    /**
     * 加载顶层运行手册
     */
    public LoadedRunbook loadRoot(String path) {
        Path file = toPath(path).toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new RunbookParseException("Runbook file not found: " + path);
        }
        return new LoadedRunbook(file.toString(), parser.parseFile(file));
    }

    @Override
    public LoadedRunbook load(String path, String parentLocation, List<String> templatePaths) {
        Path relative = toPath(path);
        if (relative.isAbsolute()) {
            throw new RunbookParseException("Child runbook path must be relative: " + path);
        }
        for (Path segment : relative) {
            if ("..".equals(segment.toString())) {
                throw new RunbookParseException("Child runbook path must not contain '..': " + path);
            }
        }

        List<Path> searched = new ArrayList<>();
        for (Path directory : searchDirectories(parentLocation, templatePaths)) {
            Path candidate = directory.resolve(relative).toAbsolutePath().normalize();
            searched.add(candidate);
            if (Files.isRegularFile(candidate)) {
                log.debug("Resolved child runbook [{}] to {}", path, candidate);
                Runbook runbook = parser.parseFile(candidate);
                return new LoadedRunbook(candidate.toString(), runbook);
            }
        }
        throw new RunbookParseException("Child runbook '" + path + "' not found, searched " + searched);
    }

    private List<Path> searchDirectories(String parentLocation, List<String> templatePaths) {
        Path parentDirectory = parentLocation == null ? null : toPath(parentLocation).toAbsolutePath().getParent();
        List<Path> directories = new ArrayList<>();
        if (parentDirectory != null) {
            directories.add(parentDirectory);
        }
        if (templatePaths != null) {
            for (String templatePath : templatePaths) {
                Path template = toPath(templatePath);
                if (!template.isAbsolute() && parentDirectory != null) {
                    template = parentDirectory.resolve(template);
                }
                directories.add(template);
            }
        }
        for (String templatePath : properties.getRunbook().getTemplatePaths()) {
            directories.add(toPath(templatePath));
        }
        return directories;
    }

    private static Path toPath(String value) {
        if (value == null || value.isBlank()) {
            throw new RunbookParseException("Runbook path must not be empty");
        }
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            throw new RunbookParseException("Invalid runbook path: " + value, e);
        }
    }
}
