package com.tencent.scanflow.domain.exception;

public class MissingArtifactException extends PlanningException {

    private final String artifactId;
    private final String missingReference;

    public MissingArtifactException(String artifactId, String missingReference) {
        super(ErrorCode.MISSING_ARTIFACT,
                String.format("Artifact '%s' references unknown artifact '%s'", artifactId, missingReference));
        this.artifactId = artifactId;
        this.missingReference = missingReference;
    }

    public String getArtifactId() {
        return artifactId;
    }

    public String getMissingReference() {
        return missingReference;
    }
}
