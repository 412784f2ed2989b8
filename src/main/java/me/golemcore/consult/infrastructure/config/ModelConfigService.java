package me.golemcore.consult.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.consult.domain.exception.PromptValidationException;
import me.golemcore.consult.domain.model.ModelPricing;
import me.golemcore.consult.port.outbound.StoragePort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service for loading per-model configuration from workspace storage.
 *
 * <p>
 * On first run, copies bundled {@code classpath:models.json} to workspace
 * ({@code models/models.json} via StoragePort). Subsequent loads read from
 * workspace, so local edits to the catalogue persist.
 *
 * <p>
 * Models are looked up by their exact key only.
 */
@Service
@Slf4j
public class ModelConfigService {

    private static final String MODELS_DIR = "models";
    private static final String CONFIG_FILE = "models.json";
    private static final String PROVIDER_OPENAI = "openai";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private volatile ModelsConfig config = new ModelsConfig();

    public ModelConfigService(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        loadConfig();
    }

    private void loadConfig() {
        try {
            Boolean exists = storagePort.exists(MODELS_DIR, CONFIG_FILE).join();
            if (Boolean.TRUE.equals(exists)) {
                String json = storagePort.getText(MODELS_DIR, CONFIG_FILE).join();
                if (json != null && !json.isBlank()) {
                    config = objectMapper.readValue(json, ModelsConfig.class);
                    log.info("[ModelConfig] Loaded from workspace: {} models", config.getModels().size());
                    return;
                }
            }
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[ModelConfig] Failed to load from workspace: {}", e.getMessage());
        }

        loadFromClasspathAndCopy();
    }

    private void loadFromClasspathAndCopy() {
        try {
            ClassPathResource resource = new ClassPathResource(CONFIG_FILE);
            if (resource.exists()) {
                try (InputStream is = resource.getInputStream()) {
                    String json = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                    config = objectMapper.readValue(json, ModelsConfig.class);
                    log.info("[ModelConfig] Loaded from classpath: {} models", config.getModels().size());
                    saveConfig();
                    return;
                }
            }
        } catch (IOException e) {
            log.warn("[ModelConfig] Failed to load from classpath: {}", e.getMessage());
        }

        log.warn("[ModelConfig] No models.json found, using empty config");
        config = new ModelsConfig();
    }

    /**
     * Reload config from workspace.
     */
    public void reload() {
        loadConfig();
    }

    private void saveConfig() {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
            storagePort.putText(MODELS_DIR, CONFIG_FILE, json).join();
            log.info("[ModelConfig] Saved to workspace: {} models", config.getModels().size());
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.error("[ModelConfig] Failed to save: {}", e.getMessage());
        }
    }

    /**
     * Exact-key lookup.
     */
    public Optional<ModelSettings> findModelSettings(String model) {
        if (model == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(config.getModels().get(model));
    }

    /**
     * Exact-key lookup that rejects unknown models.
     *
     * @throws PromptValidationException
     *             when the model is not configured
     */
    public ModelSettings getModelSettings(String model) {
        return findModelSettings(model).orElseThrow(() -> new PromptValidationException(
                "Unsupported model \"" + model + "\". Known models: " + String.join(", ", getModelIds()),
                Map.of("model", String.valueOf(model))));
    }

    public List<String> getModelIds() {
        return List.copyOf(config.getModels().keySet());
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsConfig {
        private Map<String, ModelSettings> models = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelSettings {
        private String provider = PROVIDER_OPENAI;
        /** Model id sent to the backend; defaults to the catalogue key. */
        private String apiModel;
        private String displayName;
        private int inputLimit = 196000;
        private PricingConfig pricing;
        /** Reasoning effort sent with every request, e.g. {@code high}. */
        private String reasoningEffort;
        private boolean longRunning;
        private boolean supportsBackground = true;
        private boolean supportsSearch = true;

        @JsonIgnore
        public ModelPricing modelPricing() {
            if (pricing == null) {
                return null;
            }
            return new ModelPricing(pricing.getInputPerMillion(), pricing.getOutputPerMillion());
        }

        @JsonIgnore
        public String apiModelOr(String key) {
            return apiModel != null && !apiModel.isBlank() ? apiModel : key;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PricingConfig {
        private Double inputPerMillion;
        private Double outputPerMillion;
    }
}
