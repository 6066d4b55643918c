package com.tencent.scanflow.domain.component;

import com.tencent.scanflow.domain.schema.Message;
import com.tencent.scanflow.domain.schema.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * StubAnalyserFactory - 测试用分析器工厂
 * <p>
 * 记录每次调用的 properties 与输入；按 properties.label 可为不同制品指定不同行为。
 * </p>
 */
public class StubAnalyserFactory implements AnalyserFactory {

    @FunctionalInterface
    public interface Behaviour {
        ComponentResult apply(Map<String, Object> properties, List<Message> inputs, Schema outputSchema)
                throws Exception;
    }

    /**
     * 一次调用记录
     */
    public static final class Invocation {
        private final Map<String, Object> properties;
        private final List<Message> inputs;

        Invocation(Map<String, Object> properties, List<Message> inputs) {
            this.properties = properties;
            this.inputs = inputs;
        }

        public Object label() {
            return properties.get("label");
        }

        public List<Message> getInputs() {
            return inputs;
        }
    }

    private final String name;
    private final List<Schema> outputSchemas;
    private final List<Schema> inputSchemas = new ArrayList<>();
    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private volatile Behaviour behaviour;

    public StubAnalyserFactory(String name, Schema... outputSchemas) {
        this.name = name;
        this.outputSchemas = List.of(outputSchemas);
        this.behaviour = (properties, inputs, schema) -> ComponentResult.success(Message.builder()
                .id(name)
                .schema(schema)
                .entry("data", List.of(name + ":" + inputs.size()))
                .source(name)
                .build());
    }

    public StubAnalyserFactory accepting(Schema... schemas) {
        inputSchemas.addAll(List.of(schemas));
        return this;
    }

    public StubAnalyserFactory behaving(Behaviour behaviour) {
        this.behaviour = behaviour;
        return this;
    }

    public List<Invocation> getInvocations() {
        return invocations;
    }

    public int getInvocationCount() {
        return invocations.size();
    }

    @Override
    public Analyser create(Map<String, Object> config) {
        return (inputs, outputSchema) -> {
            invocations.add(new Invocation(config, List.copyOf(inputs)));
            try {
                return behaviour.apply(config, inputs, outputSchema);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        };
    }

    @Override
    public boolean canCreate(Map<String, Object> config) {
        return true;
    }

    @Override
    public String getComponentName() {
        return name;
    }

    @Override
    public List<Schema> getInputSchemas() {
        return Collections.unmodifiableList(inputSchemas);
    }

    @Override
    public List<Schema> getOutputSchemas() {
        return outputSchemas;
    }

    @Override
    public Map<String, Class<?>> getServiceDependencies() {
        return Collections.emptyMap();
    }
}
