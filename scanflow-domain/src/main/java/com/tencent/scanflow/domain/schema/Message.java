package com.tencent.scanflow.domain.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Message - 制品载荷
 * <p>
 * 一次运行中某个制品的产出，携带 Schema 标签和不透明的内容。写入制品存储后不可变。
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    /**
     * 消息 ID
     */
    String id;

    /**
     * 内容格式
     */
    Schema schema;

    /**
     * 内容 (对编排引擎不透明)
     */
    @Singular("entry")
    Map<String, Object> content;

    /**
     * 来源标识，例如连接器名称或 "reuse:{runId}/{artifactId}"
     */
    String source;
}
