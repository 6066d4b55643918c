package com.tencent.scanflow.domain.plan;

import com.tencent.scanflow.domain.schema.Schema;
import lombok.Value;

/**
 * ArtifactSchemas - 制品的输入/输出 Schema
 * <p>
 * 源制品与独立复用制品的 inputSchema 为空。
 * </p>
 */
@Value
public class ArtifactSchemas {

    Schema inputSchema;

    Schema outputSchema;
}
