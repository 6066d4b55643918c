package com.tencent.scanflow;

import com.tencent.scanflow.domain.component.ComponentRegistry;
import com.tencent.scanflow.domain.component.ComponentResult;
import com.tencent.scanflow.domain.component.Connector;
import com.tencent.scanflow.domain.component.ConnectorFactory;
import com.tencent.scanflow.domain.schema.Message;
import com.tencent.scanflow.domain.schema.Schema;
import com.tencent.scanflow.domain.store.ArtifactStore;
import com.tencent.scanflow.domain.store.InMemoryArtifactStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 应用装配冒烟测试
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ScanflowApplicationTest {

    @TempDir
    static Path runbooks;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ComponentRegistry componentRegistry;

    @Autowired
    private ArtifactStore artifactStore;

    @TestConfiguration
    static class ComponentConfig {

        @Bean
        ConnectorFactory staticConnectorFactory() {
            return new ConnectorFactory() {
                @Override
                public Connector create(Map<String, Object> config) {
                    return outputSchema -> ComponentResult.success(Message.builder()
                            .id("static")
                            .schema(outputSchema)
                            .entry("data", List.of(String.valueOf(config.get("value"))))
                            .source("static")
                            .build());
                }

                @Override
                public boolean canCreate(Map<String, Object> config) {
                    return true;
                }

                @Override
                public String getComponentName() {
                    return "static";
                }

                @Override
                public List<Schema> getInputSchemas() {
                    return Collections.emptyList();
                }

                @Override
                public List<Schema> getOutputSchemas() {
                    return List.of(Schema.of("standard_input"));
                }

                @Override
                public Map<String, Class<?>> getServiceDependencies() {
                    return Collections.emptyMap();
                }
            };
        }
    }

    @Test
    void wiresComponentsAndDefaultStore() {
        assertThat(componentRegistry.findConnector("static")).isPresent();
        assertThat(artifactStore).isInstanceOf(InMemoryArtifactStore.class);
    }

    @Test
    void runsRunbookOverHttp() throws Exception {
        Path runbook = Files.writeString(runbooks.resolve("static.yaml"), """
                name: static-scan
                artifacts:
                  source_a:
                    source:
                      type: static
                      properties:
                        value: hello
                  copy:
                    inputs: source_a
                    output: true
                """);

        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runbookPath\":\"" + runbook.toString().replace("\\", "\\\\")
                                + "\",\"runId\":\"smoke-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.outputs[0]").value("copy"));

        mockMvc.perform(get("/api/runs/smoke-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.artifacts.copy").value("completed"));
        assertThat(artifactStore.get("smoke-1", "copy").orElseThrow().getContent().get("data"))
                .isEqualTo(List.of("hello"));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/runs/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errCode").value("RUN_NOT_FOUND"));
    }
}
