package com.tencent.scanflow.domain.plan;

import com.tencent.scanflow.domain.runbook.Runbook;
import lombok.Value;

import java.util.List;

/**
 * RunbookLoader - 子运行手册加载器
 * <p>
 * 规划器展开 child_runbook 时通过它加载嵌套运行手册。
 * </p>
 */
public interface RunbookLoader {

    /**
     * 加载子运行手册
     *
     * @param path          child_runbook.path
     * @param parentLocation 引用方运行手册的位置，可能为空 (直接由映射构建的运行手册)
     * @param templatePaths 额外的搜索目录
     * @return 加载结果，location 用于循环引用检测，同一运行手册须返回相同的 location
     */
    LoadedRunbook load(String path, String parentLocation, List<String> templatePaths);

    @Value
    class LoadedRunbook {
        String location;
        Runbook runbook;
    }
}
