package com.tencent.scanflow.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class InputDeclarationYamlDto {
    private String inputSchema;
    private Boolean optional;
    @JsonProperty("default")
    private Object defaultValue;
    private Boolean sensitive;
    private String description;
}
