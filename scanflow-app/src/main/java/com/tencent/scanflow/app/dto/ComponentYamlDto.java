package com.tencent.scanflow.app.dto;

import lombok.Data;

import java.util.Map;

/**
 * source / transform 共用的组件声明
 */
@Data
public class ComponentYamlDto {
    private String type;
    private Map<String, Object> properties;
}
