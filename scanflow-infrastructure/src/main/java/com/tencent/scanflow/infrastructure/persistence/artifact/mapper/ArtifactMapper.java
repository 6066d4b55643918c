package com.tencent.scanflow.infrastructure.persistence.artifact.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.scanflow.infrastructure.persistence.artifact.entity.ArtifactDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * ArtifactMapper - 制品Mapper
 *
 * @author scanflow
 */
@Mapper
public interface ArtifactMapper extends BaseMapper<ArtifactDO> {
}
