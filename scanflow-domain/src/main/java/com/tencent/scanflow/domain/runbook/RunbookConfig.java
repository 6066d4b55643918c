package com.tencent.scanflow.domain.runbook;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * RunbookConfig - 运行手册执行配置
 */
@Value
@Builder(toBuilder = true)
public class RunbookConfig {

    public static final int DEFAULT_MAX_CONCURRENCY = 10;
    public static final int DEFAULT_MAX_CHILD_DEPTH = 3;

    /**
     * 单个制品的超时时间 (秒)，为空表示沿用执行器默认值
     */
    Integer timeout;

    /**
     * 最大并发数，为空表示沿用执行器默认值
     */
    Integer maxConcurrency;

    /**
     * 子运行手册最大嵌套深度
     */
    @Builder.Default
    int maxChildDepth = DEFAULT_MAX_CHILD_DEPTH;

    /**
     * 子运行手册的额外搜索目录
     */
    @Builder.Default
    List<String> templatePaths = Collections.emptyList();

    public static RunbookConfig defaults() {
        return RunbookConfig.builder().build();
    }
}
