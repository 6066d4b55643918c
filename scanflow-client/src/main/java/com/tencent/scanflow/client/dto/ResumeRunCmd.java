package com.tencent.scanflow.client.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * ResumeRunCmd - 恢复运行
 */
@Data
public class ResumeRunCmd {

    /**
     * 运行手册文件路径，必须与首次运行时结构一致
     */
    @NotBlank
    private String runbookPath;
}
