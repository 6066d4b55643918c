package com.tencent.scanflow.domain.exception;

import java.util.List;

public class SchemaCompatibilityException extends PlanningException {

    private final String artifactId;
    private final List<String> schemas;

    public SchemaCompatibilityException(String artifactId, List<String> schemas, String message) {
        super(ErrorCode.SCHEMA_COMPATIBILITY, message);
        this.artifactId = artifactId;
        this.schemas = List.copyOf(schemas);
    }

    public String getArtifactId() {
        return artifactId;
    }

    /**
     * 冲突的 Schema，格式为 name/version
     */
    public List<String> getSchemas() {
        return schemas;
    }
}
