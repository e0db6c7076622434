package com.riskcast.backend.controller;

import com.riskcast.backend.dto.ModelInfo;
import com.riskcast.backend.service.MetricsService;
import com.riskcast.backend.service.model.ModelAdapter;
import com.riskcast.backend.service.model.ModelRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Loaded model artifacts with their call counts and latency since startup.
 */
@RestController
@RequestMapping("/api/v1/risk/models")
@RequiredArgsConstructor
public class ModelInfoController {

    private final ModelRegistry modelRegistry;
    private final MetricsService metricsService;

    @GetMapping
    public List<ModelInfo> models() {
        return List.of(describe("short", modelRegistry.shortModel()), describe("long", modelRegistry.longModel()));
    }

    private ModelInfo describe(String slot, ModelAdapter adapter) {
        MetricsService.ModelLatency latency = metricsService.modelLatency(adapter.modelId());
        return new ModelInfo(slot, adapter.modelId(), adapter.version(), adapter.isLoaded(), latency.calls(),
                latency.failures(), latency.meanMs(), latency.maxMs());
    }
}
