package com.tencent.scanflow.domain.runbook;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * TransformConfig - 派生制品的分析器配置
 */
@Value
@Builder(toBuilder = true)
public class TransformConfig {

    /**
     * 分析器类型名称
     */
    String type;

    /**
     * 分析器属性
     */
    @Builder.Default
    Map<String, Object> properties = Collections.emptyMap();
}
