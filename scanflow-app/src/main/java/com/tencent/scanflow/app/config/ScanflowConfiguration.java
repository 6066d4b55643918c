package com.tencent.scanflow.app.config;

import com.tencent.scanflow.domain.component.AnalyserFactory;
import com.tencent.scanflow.domain.component.ComponentRegistry;
import com.tencent.scanflow.domain.component.ConnectorFactory;
import com.tencent.scanflow.domain.executor.DagExecutor;
import com.tencent.scanflow.domain.executor.DagExecutorConfig;
import com.tencent.scanflow.domain.plan.Planner;
import com.tencent.scanflow.domain.plan.RunbookLoader;
import com.tencent.scanflow.domain.state.InMemoryRunStateRepository;
import com.tencent.scanflow.domain.state.RunStateRepository;
import com.tencent.scanflow.domain.store.ArtifactStore;
import com.tencent.scanflow.domain.store.AsyncArtifactStore;
import com.tencent.scanflow.domain.store.BlockingArtifactStore;
import com.tencent.scanflow.domain.store.InMemoryArtifactStore;
import com.tencent.scanflow.domain.store.InMemoryAsyncArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 编排引擎装配
 * <p>
 * 领域层不依赖 Spring，这里负责把组件工厂、存储和执行器组装起来。
 * filesystem / database 存储由基础设施层按 scanflow.store.type 提供。
 * </p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ScanflowProperties.class)
public class ScanflowConfiguration {

    @Bean
    public ComponentRegistry componentRegistry(ObjectProvider<ConnectorFactory> connectors,
                                               ObjectProvider<AnalyserFactory> analysers) {
        ComponentRegistry.Builder builder = ComponentRegistry.builder();
        connectors.orderedStream().forEach(builder::connector);
        analysers.orderedStream().forEach(builder::analyser);
        ComponentRegistry registry = builder.build();
        log.info("Registered connectors {} and analysers {}",
                registry.getConnectorFactories().keySet(), registry.getAnalyserFactories().keySet());
        return registry;
    }

    @Bean
    public Planner planner(ComponentRegistry componentRegistry, RunbookLoader runbookLoader) {
        return new Planner(componentRegistry, runbookLoader);
    }

    @Bean
    public DagExecutorConfig dagExecutorConfig(ScanflowProperties properties) {
        return DagExecutorConfig.builder()
                .maxConcurrency(properties.getExecutor().getMaxConcurrency())
                .stepTimeout(properties.getExecutor().getStepTimeout())
                .build();
    }

    @Bean
    public DagExecutor dagExecutor(ComponentRegistry componentRegistry, ArtifactStore artifactStore,
                                   RunStateRepository runStateRepository, DagExecutorConfig dagExecutorConfig) {
        return new DagExecutor(componentRegistry, artifactStore, runStateRepository, dagExecutorConfig);
    }

    @Bean
    @ConditionalOnProperty(prefix = "scanflow.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public ArtifactStore inMemoryArtifactStore() {
        return new InMemoryArtifactStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "scanflow.store", name = "type", havingValue = "memory-async")
    public AsyncArtifactStore inMemoryAsyncArtifactStore() {
        return new InMemoryAsyncArtifactStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "scanflow.store", name = "type", havingValue = "memory-async")
    public ArtifactStore blockingArtifactStore(AsyncArtifactStore inMemoryAsyncArtifactStore) {
        return new BlockingArtifactStore(inMemoryAsyncArtifactStore);
    }

    @Bean
    @ConditionalOnExpression("'${scanflow.store.type:memory}'.startsWith('memory')")
    public RunStateRepository inMemoryRunStateRepository() {
        return new InMemoryRunStateRepository();
    }
}
