package com.tencent.scanflow.infrastructure.persistence.artifact.converter;

import com.tencent.scanflow.domain.schema.Message;
import com.tencent.scanflow.domain.schema.Schema;
import com.tencent.scanflow.infrastructure.persistence.artifact.entity.ArtifactDO;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;

/**
 * ArtifactConverter - 制品消息与数据对象转换
 *
 * @author scanflow
 */
public final class ArtifactConverter {

    private ArtifactConverter() {
    }

    public static void copy(String runId, String artifactId, Message message, ArtifactDO target) {
        target.setRunId(runId);
        target.setArtifactId(artifactId);
        target.setMessageId(message.getId());
        target.setSchemaRef(message.getSchema() == null ? null : message.getSchema().toString());
        target.setContent(new LinkedHashMap<>(message.getContent()));
        target.setSource(message.getSource());
        target.setStoredAt(Instant.now());
    }

    public static Message toDomain(ArtifactDO dataObject) {
        return Message.builder()
                .id(dataObject.getMessageId())
                .schema(dataObject.getSchemaRef() == null ? null : Schema.parse(dataObject.getSchemaRef()))
                .content(dataObject.getContent() == null ? Collections.emptyMap() : dataObject.getContent())
                .source(dataObject.getSource())
                .build();
    }
}
