package com.tencent.scanflow.app.dto;

import lombok.Data;

import java.util.List;

@Data
public class RunbookConfigYamlDto {
    private Integer timeout;
    private Integer maxConcurrency;
    private Integer maxChildDepth;
    private List<String> templatePaths;
}
