package com.tencent.scanflow.app.dto;

import lombok.Data;

import java.util.LinkedHashMap;

@Data
public class ChildRunbookYamlDto {
    private String path;
    private LinkedHashMap<String, String> inputMapping;
    private String output;
    private LinkedHashMap<String, String> outputMapping;
}
