package com.tencent.scanflow.app.dto;

import lombok.Data;

import java.util.LinkedHashMap;

@Data
public class RunbookYamlDto {
    private String name;
    private String description;
    private String contact;
    private String framework;
    private RunbookConfigYamlDto config;
    private LinkedHashMap<String, InputDeclarationYamlDto> inputs;
    private LinkedHashMap<String, OutputDeclarationYamlDto> outputs;
    private LinkedHashMap<String, ArtifactYamlDto> artifacts;
}
