package com.tencent.scanflow.domain.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * Schema - 消息格式标识
 * <p>
 * 由名称与语义化版本组成，扇入兼容性按 (name, version) 相等判断，不比较内容结构。
 * 字符串形式为 "name" 或 "name/version"，省略版本时取 {@link #DEFAULT_VERSION}。
 * </p>
 */
@Value
public class Schema {

    public static final String DEFAULT_VERSION = "1.0.0";

    /**
     * Schema 名称
     */
    String name;

    /**
     * 版本号 (major.minor.patch)
     */
    String version;

    public static Schema of(String name) {
        return of(name, DEFAULT_VERSION);
    }

    public static Schema of(String name, String version) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Schema name cannot be empty");
        }
        validateSemanticVersion(version);
        return new Schema(name.trim(), version);
    }

    /**
     * 解析 "name" 或 "name/version" 形式的字符串
     */
    @JsonCreator
    public static Schema parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Schema string cannot be empty");
        }
        String[] parts = value.trim().split("/", -1);
        if (parts.length == 1) {
            return of(parts[0]);
        }
        if (parts.length == 2) {
            return of(parts[0], parts[1]);
        }
        throw new IllegalArgumentException("Invalid schema format: " + value + ". Expected: name or name/version");
    }

    private static void validateSemanticVersion(String version) {
        if (version == null || !version.matches("\\d+\\.\\d+\\.\\d+")) {
            throw new IllegalArgumentException(
                    "Invalid schema version format: " + version + ". Expected: major.minor.patch");
        }
    }

    @JsonValue
    @Override
    public String toString() {
        return name + "/" + version;
    }
}
