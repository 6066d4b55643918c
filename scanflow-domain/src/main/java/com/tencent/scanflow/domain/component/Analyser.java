package com.tencent.scanflow.domain.component;

import com.tencent.scanflow.domain.schema.Message;
import com.tencent.scanflow.domain.schema.Schema;

import java.util.List;

/**
 * Analyser - 分析器
 * <p>
 * 对上游制品做转换或分类，作为派生制品的 transform。
 * </p>
 */
public interface Analyser {

    /**
     * @param inputs       上游制品，顺序与 inputs 声明一致
     * @param outputSchema 规划期解析出的输出 Schema
     */
    ComponentResult process(List<Message> inputs, Schema outputSchema);
}
