package com.tencent.scanflow.infrastructure.persistence.run.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.scanflow.infrastructure.persistence.run.entity.ExecutionStateDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * ExecutionStateMapper - 执行状态Mapper
 *
 * @author scanflow
 */
@Mapper
public interface ExecutionStateMapper extends BaseMapper<ExecutionStateDO> {
}
