package me.golemcore.consult.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.consult.domain.exception.PromptValidationException;
import me.golemcore.consult.domain.model.ResolvedCredential;
import me.golemcore.consult.infrastructure.config.ConsultProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Resolves the API key and endpoint of a provider from configuration.
 */
@Component
@RequiredArgsConstructor
public class CredentialResolver {

    private final ConsultProperties properties;

    /**
     * @throws PromptValidationException
     *             when no API key is configured for the provider
     */
    public ResolvedCredential resolve(String provider) {
        ConsultProperties.ProviderProperties config = properties.getProviders().get(provider);
        String envVar = envVarFor(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new PromptValidationException("Missing " + envVar
                    + ". Set it via the environment or consult.providers." + provider + ".api-key.",
                    Map.of("env", envVar));
        }
        String baseUrl = config.getBaseUrl() != null && !config.getBaseUrl().isBlank()
                ? config.getBaseUrl().trim()
                : null;
        return new ResolvedCredential(provider, config.getApiKey().trim(), baseUrl);
    }

    public String envVarFor(String provider) {
        ConsultProperties.ProviderProperties config = properties.getProviders().get(provider);
        return config != null && config.getApiKeyEnv() != null
                ? config.getApiKeyEnv()
                : provider.toUpperCase(Locale.ROOT) + "_API_KEY";
    }

    /**
     * Key reduced to its first and last four characters for logging.
     */
    public static String maskApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }
        if (apiKey.length() <= 8) {
            return "****";
        }
        return apiKey.substring(0, 4) + "****" + apiKey.substring(apiKey.length() - 4);
    }
}
