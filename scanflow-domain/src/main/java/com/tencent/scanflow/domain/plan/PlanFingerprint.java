package com.tencent.scanflow.domain.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tencent.scanflow.domain.runbook.ArtifactDefinition;
import com.tencent.scanflow.domain.schema.Schema;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PlanFingerprint - 执行计划指纹
 * <p>
 * 对扁平制品定义与解析后的 Schema 做规范化 JSON 序列化 (键排序) 后取 SHA-256，
 * 格式为 "sha256:&lt;hex&gt;"。名称、描述等不影响执行的字段不参与计算。
 * </p>
 */
public final class PlanFingerprint {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private PlanFingerprint() {
    }

    public static String compute(Map<String, ArtifactDefinition> artifacts, Map<String, ArtifactSchemas> schemas) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        artifacts.forEach((id, artifact) -> canonical.put(id, describe(artifact, schemas.get(id))));
        try {
            byte[] json = CANONICAL.writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return "sha256:" + HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize plan for fingerprinting", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static Map<String, Object> describe(ArtifactDefinition artifact, ArtifactSchemas schemas) {
        Map<String, Object> node = new LinkedHashMap<>();
        if (artifact.isSource()) {
            node.put("source", Map.of("type", artifact.getSource().getType(),
                    "properties", artifact.getSource().getProperties()));
        }
        node.put("inputs", artifact.getInputs());
        if (artifact.hasTransform()) {
            node.put("transform", Map.of("type", artifact.getTransform().getType(),
                    "properties", artifact.getTransform().getProperties()));
        }
        if (artifact.hasReuse()) {
            node.put("reuse", artifact.getReuse().describe());
        }
        node.put("merge", artifact.getMerge());
        node.put("optional", artifact.isOptional());
        if (schemas != null) {
            node.put("input_schema", text(schemas.getInputSchema()));
            node.put("output_schema", text(schemas.getOutputSchema()));
        }
        return node;
    }

    private static String text(Schema schema) {
        return schema == null ? null : schema.toString();
    }
}
