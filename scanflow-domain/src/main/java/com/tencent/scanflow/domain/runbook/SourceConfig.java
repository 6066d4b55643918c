package com.tencent.scanflow.domain.runbook;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * SourceConfig - 源制品的连接器配置
 */
@Value
@Builder(toBuilder = true)
public class SourceConfig {

    /**
     * 连接器类型名称
     */
    String type;

    /**
     * 连接器属性
     */
    @Builder.Default
    Map<String, Object> properties = Collections.emptyMap();
}
