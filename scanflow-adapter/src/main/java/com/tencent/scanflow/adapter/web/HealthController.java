package com.tencent.scanflow.adapter.web;

import com.tencent.scanflow.client.dto.HealthDTO;
import com.tencent.scanflow.client.dto.SingleResponse;
import com.tencent.scanflow.domain.component.ComponentRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Health Check Controller, 同时列出可用的连接器与分析器
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final ComponentRegistry componentRegistry;

    @GetMapping("/health")
    public SingleResponse<HealthDTO> health() {
        return SingleResponse.of(HealthDTO.builder()
                .status("UP")
                .connectors(sorted(componentRegistry.getConnectorFactories().keySet()))
                .analysers(sorted(componentRegistry.getAnalyserFactories().keySet()))
                .build());
    }

    private static List<String> sorted(Iterable<String> names) {
        List<String> result = new ArrayList<>();
        names.forEach(result::add);
        Collections.sort(result);
        return result;
    }
}
