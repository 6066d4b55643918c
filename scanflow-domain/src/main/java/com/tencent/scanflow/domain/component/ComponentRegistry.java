package com.tencent.scanflow.domain.component;

import com.tencent.scanflow.domain.exception.ComponentNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * ComponentRegistry - 组件注册表
 * <p>
 * 按类型名称查找连接器/分析器工厂。构建完成后只读，可在并发调度间共享。
 * 注册是累加的，同名后注册者覆盖先注册者。
 * </p>
 */
@Slf4j
public final class ComponentRegistry {

    private final Map<String, ConnectorFactory> connectorFactories;
    private final Map<String, AnalyserFactory> analyserFactories;

    private ComponentRegistry(Map<String, ConnectorFactory> connectorFactories,
                              Map<String, AnalyserFactory> analyserFactories) {
        this.connectorFactories = Collections.unmodifiableMap(new LinkedHashMap<>(connectorFactories));
        this.analyserFactories = Collections.unmodifiableMap(new LinkedHashMap<>(analyserFactories));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ConnectorFactory> getConnectorFactories() {
        return connectorFactories;
    }

    public Map<String, AnalyserFactory> getAnalyserFactories() {
        return analyserFactories;
    }

    public Optional<ConnectorFactory> findConnector(String type) {
        return Optional.ofNullable(connectorFactories.get(type));
    }

    public Optional<AnalyserFactory> findAnalyser(String type) {
        return Optional.ofNullable(analyserFactories.get(type));
    }

    public ConnectorFactory getConnector(String type) {
        return findConnector(type).orElseThrow(() ->
                new ComponentNotFoundException(type, "Connector type '" + type + "' is not registered"));
    }

    public AnalyserFactory getAnalyser(String type) {
        return findAnalyser(type).orElseThrow(() ->
                new ComponentNotFoundException(type, "Analyser type '" + type + "' is not registered"));
    }

    public static final class Builder {

        private final Map<String, ConnectorFactory> connectors = new LinkedHashMap<>();
        private final Map<String, AnalyserFactory> analysers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder connector(ConnectorFactory factory) {
            ConnectorFactory previous = connectors.put(factory.getComponentName(), factory);
            if (previous != null && previous != factory) {
                log.warn("Connector factory [{}] overridden by {}", factory.getComponentName(),
                        factory.getClass().getName());
            }
            return this;
        }

        public Builder analyser(AnalyserFactory factory) {
            AnalyserFactory previous = analysers.put(factory.getComponentName(), factory);
            if (previous != null && previous != factory) {
                log.warn("Analyser factory [{}] overridden by {}", factory.getComponentName(),
                        factory.getClass().getName());
            }
            return this;
        }

        public ComponentRegistry build() {
            return new ComponentRegistry(connectors, analysers);
        }
    }
}
