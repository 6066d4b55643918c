package com.tencent.scanflow.domain.executor;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * DagExecutorConfig - 执行器默认配置
 * <p>
 * 运行手册 config 中的 max_concurrency / timeout 优先于这里的默认值。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class DagExecutorConfig {

    /**
     * 最大并发数
     */
    @Builder.Default
    int maxConcurrency = 10;

    /**
     * 单个制品超时时间，为空表示不限制
     */
    Duration stepTimeout;

    public static DagExecutorConfig defaults() {
        return DagExecutorConfig.builder().build();
    }
}
