package com.tencent.scanflow.app.dto;

import lombok.Data;

@Data
public class OutputDeclarationYamlDto {
    private String artifact;
    private String description;
}
