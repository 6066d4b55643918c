package com.tencent.scanflow.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * HealthDTO - 服务状态与已注册组件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private String status;

    private List<String> connectors;

    private List<String> analysers;
}
