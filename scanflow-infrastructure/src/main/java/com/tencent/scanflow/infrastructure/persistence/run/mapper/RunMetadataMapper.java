package com.tencent.scanflow.infrastructure.persistence.run.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.scanflow.infrastructure.persistence.run.entity.RunMetadataDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * RunMetadataMapper - 运行元数据Mapper
 *
 * @author scanflow
 */
@Mapper
public interface RunMetadataMapper extends BaseMapper<RunMetadataDO> {
}
