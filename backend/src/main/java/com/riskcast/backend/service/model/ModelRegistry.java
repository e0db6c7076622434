package com.riskcast.backend.service.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskcast.backend.config.RouterProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Owns the short- and long-horizon adapters. A missing or unreadable artifact leaves its adapter
 * unloaded so the service still starts; predictions from that adapter then fail.
 */
@Slf4j
@Component
public class ModelRegistry {

    private final ModelAdapter shortModel;
    private final ModelAdapter longModel;
    private final ResourceLoader resourceLoader;
    private final RouterProperties routerProperties;

    @Autowired
    public ModelRegistry(ObjectMapper objectMapper, ResourceLoader resourceLoader, RouterProperties routerProperties) {
        this(new TreeEnsembleModelAdapter(objectMapper), new SequenceModelAdapter(objectMapper),
                resourceLoader, routerProperties);
    }

    public ModelRegistry(ModelAdapter shortModel, ModelAdapter longModel, ResourceLoader resourceLoader,
                         RouterProperties routerProperties) {
        this.shortModel = shortModel;
        this.longModel = longModel;
        this.resourceLoader = resourceLoader;
        this.routerProperties = routerProperties;
    }

    @PostConstruct
    public void loadAll() {
        load(shortModel, routerProperties.getModels().getShortModelLocation());
        load(longModel, routerProperties.getModels().getLongModelLocation());
    }

    private void load(ModelAdapter adapter, String location) {
        if (location == null || location.isBlank()) {
            log.warn("No artifact location configured for model {}; running without it", adapter.modelId());
            return;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Model artifact {} not found; {} stays unloaded", location, adapter.modelId());
            return;
        }
        try (InputStream input = resource.getInputStream()) {
            adapter.loadModel(input);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to load model artifact {} for {}", location, adapter.modelId(), e);
        }
    }

    public ModelAdapter shortModel() {
        return shortModel;
    }

    public ModelAdapter longModel() {
        return longModel;
    }

    /**
     * Identifies the loaded artifact pair; part of every cache key.
     */
    public String versionTag() {
        return shortModel.modelId() + "@" + shortModel.version() + "+" + longModel.modelId() + "@" + longModel.version();
    }
}
