package com.tencent.scanflow.domain.exception;

public class ArtifactNotFoundException extends OrchestrationException {

    public ArtifactNotFoundException(String runId, String artifactId) {
        super(ErrorCode.ARTIFACT_NOT_FOUND,
                String.format("Artifact '%s' not found in run '%s'", artifactId, runId));
    }
}
