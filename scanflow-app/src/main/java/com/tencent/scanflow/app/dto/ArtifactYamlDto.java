package com.tencent.scanflow.app.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;

import java.util.List;

@Data
public class ArtifactYamlDto {
    private String name;
    private String description;
    private String contact;
    private ComponentYamlDto source;
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> inputs;
    @JsonAlias("process")
    private ComponentYamlDto transform;
    private ReuseYamlDto reuse;
    private String merge;
    private String outputSchema; // "name" 或 "name/version"
    private Boolean output;
    private Boolean optional;
    private ChildRunbookYamlDto childRunbook;
}
