package com.tencent.scanflow.domain.exception;

public class InvalidOutputMappingException extends PlanningException {

    private final String artifactId;
    private final String outputName;

    public InvalidOutputMappingException(String artifactId, String outputName, String message) {
        super(ErrorCode.INVALID_OUTPUT_MAPPING, message);
        this.artifactId = artifactId;
        this.outputName = outputName;
    }

    public String getArtifactId() {
        return artifactId;
    }

    public String getOutputName() {
        return outputName;
    }
}
