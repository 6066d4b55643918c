package com.tencent.scanflow.domain.exception;

public class MissingInputMappingException extends PlanningException {

    private final String artifactId;
    private final String inputName;

    public MissingInputMappingException(String artifactId, String inputName, String message) {
        super(ErrorCode.MISSING_INPUT_MAPPING, message);
        this.artifactId = artifactId;
        this.inputName = inputName;
    }

    public String getArtifactId() {
        return artifactId;
    }

    public String getInputName() {
        return inputName;
    }
}
