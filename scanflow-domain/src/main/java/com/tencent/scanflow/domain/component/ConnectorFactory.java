package com.tencent.scanflow.domain.component;

public interface ConnectorFactory extends ComponentFactory<Connector> {
}
