package com.tencent.scanflow.app.parser;

import com.tencent.scanflow.domain.exception.RunbookParseException;
import org.springframework.util.PropertyPlaceholderHelper;

import java.util.function.Function;

/**
 * EnvironmentSubstitutor - 替换运行手册文本中的 ${VAR} 占位符
 */
public class EnvironmentSubstitutor {

    private static final PropertyPlaceholderHelper PLACEHOLDERS =
            new PropertyPlaceholderHelper("${", "}", null, false);

    private final Function<String, String> environment;

    public EnvironmentSubstitutor(Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * @throws RunbookParseException 引用了未定义的环境变量
     */
    public String substitute(String content) {
        return PLACEHOLDERS.replacePlaceholders(content, name -> {
            String value = environment.apply(name);
            if (value == null) {
                throw new RunbookParseException("Environment variable '" + name + "' is not defined");
            }
            return value;
        });
    }
}
