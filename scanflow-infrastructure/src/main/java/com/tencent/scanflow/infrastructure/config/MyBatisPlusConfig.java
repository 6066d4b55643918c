package com.tencent.scanflow.infrastructure.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatisPlusConfig - MyBatis-Plus 配置
 *
 * @author scanflow
 */
@Configuration
@MapperScan("com.tencent.scanflow.infrastructure.persistence.**.mapper")
public class MyBatisPlusConfig {
    // MyBatis-Plus 的配置由 starter 自动完成
}
