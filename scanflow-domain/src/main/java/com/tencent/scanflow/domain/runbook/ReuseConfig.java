package com.tencent.scanflow.domain.runbook;

import lombok.Builder;
import lombok.Value;

/**
 * ReuseConfig - 复用历史运行的制品
 * <p>
 * 执行时直接从 fromRun 的存储中拷贝制品，不调用任何组件。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ReuseConfig {

    /**
     * 历史运行 ID
     */
    String fromRun;

    /**
     * 历史运行中的制品 ID
     */
    String artifact;

    public String describe() {
        return "reuse:" + fromRun + "/" + artifact;
    }
}
