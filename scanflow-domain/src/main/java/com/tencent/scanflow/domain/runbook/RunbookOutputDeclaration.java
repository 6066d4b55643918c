package com.tencent.scanflow.domain.runbook;

import lombok.Builder;
import lombok.Value;

/**
 * RunbookOutputDeclaration - 作为子运行手册时对外暴露的输出
 */
@Value
@Builder(toBuilder = true)
public class RunbookOutputDeclaration {

    /**
     * 对应的内部制品 ID
     */
    String artifact;

    String description;
}
