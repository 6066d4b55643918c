package com.tencent.scanflow.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * ScanflowProperties - scanflow.* 配置项
 * <p>
 * 运行手册自身的 config 段优先于这里的执行器配置。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "scanflow")
public class ScanflowProperties {

    private Executor executor = new Executor();

    private Store store = new Store();

    private RunbookSettings runbook = new RunbookSettings();

    @Data
    public static class Executor {

        /**
         * 同时执行的最大制品数
         */
        private int maxConcurrency = 10;

        /**
         * 单个制品的默认超时时间，为空表示不限制
         */
        private Duration stepTimeout;
    }

    @Data
    public static class Store {

        /**
         * memory | memory-async | filesystem | database
         */
        private String type = "memory";

        /**
         * filesystem 存储的根目录
         */
        private String basePath = ".scanflow";
    }

    @Data
    public static class RunbookSettings {

        /**
         * 全局子运行手册模板目录
         */
        private List<String> templatePaths = new ArrayList<>();
    }
}
