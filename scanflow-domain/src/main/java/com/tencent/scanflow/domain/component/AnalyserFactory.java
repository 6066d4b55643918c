package com.tencent.scanflow.domain.component;

public interface AnalyserFactory extends ComponentFactory<Analyser> {
}
