package com.tencent.scanflow.domain.component;

import com.tencent.scanflow.domain.schema.Schema;

import java.util.List;
import java.util.Map;

/**
 * ComponentFactory - 组件工厂
 * <p>
 * 由连接器/分析器实现包提供，规划器读取其 Schema 声明，执行器通过它创建组件实例。
 * </p>
 *
 * @param <T> 组件类型
 */
public interface ComponentFactory<T> {

    /**
     * 根据制品声明中的 properties 创建组件实例
     */
    T create(Map<String, Object> config);

    /**
     * 判断给定配置能否创建组件 (例如依赖的服务不可用时返回 false)
     */
    boolean canCreate(Map<String, Object> config);

    /**
     * 组件类型名称，即运行手册中 source.type / transform.type 的取值
     */
    String getComponentName();

    /**
     * 支持的输入 Schema，为空表示不限制
     */
    List<Schema> getInputSchemas();

    /**
     * 产出的 Schema，第一个为默认输出
     */
    List<Schema> getOutputSchemas();

    /**
     * 依赖的外部服务: 名称 -> 类型
     */
    Map<String, Class<?>> getServiceDependencies();
}
