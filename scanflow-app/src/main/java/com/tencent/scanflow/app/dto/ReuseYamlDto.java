package com.tencent.scanflow.app.dto;

import lombok.Data;

@Data
public class ReuseYamlDto {
    private String fromRun;
    private String artifact;
}
