package com.tencent.scanflow.client.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * StartRunCmd - 启动运行
 */
@Data
public class StartRunCmd {

    /**
     * 运行手册文件路径
     */
    @NotBlank
    private String runbookPath;

    /**
     * 运行 ID，为空时自动生成
     */
    private String runId;
}
