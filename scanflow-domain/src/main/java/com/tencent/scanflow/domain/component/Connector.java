package com.tencent.scanflow.domain.component;

import com.tencent.scanflow.domain.schema.Schema;

/**
 * Connector - 数据连接器
 * <p>
 * 从外部系统 (文件系统、数据库、源码仓库等) 抽取数据，作为源制品的生产者。
 * </p>
 */
public interface Connector {

    /**
     * 按指定输出 Schema 抽取数据
     */
    ComponentResult extract(Schema outputSchema);
}
