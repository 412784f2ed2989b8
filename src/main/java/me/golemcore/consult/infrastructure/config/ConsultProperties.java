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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Application configuration bound from {@code consult.*} properties.
 */
@Component
@ConfigurationProperties(prefix = "consult")
@Data
public class ConsultProperties {

    private Map<String, ProviderProperties> providers = new HashMap<>();
    private ExecutionProperties execution = new ExecutionProperties();
    private BackgroundProperties background = new BackgroundProperties();
    private GracePollProperties gracePoll = new GracePollProperties();
    private ValidationProperties validation = new ValidationProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private PromptProperties prompt = new PromptProperties();

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        /** Environment variable named in the error when the key is missing. */
        private String apiKeyEnv;
    }

    @Data
    public static class ExecutionProperties {
        private Duration defaultTimeout = Duration.ofSeconds(120);
        private Duration longRunningTimeout = Duration.ofMinutes(60);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private int maxConcurrentModels = 8;
    }

    @Data
    public static class BackgroundProperties {
        private Duration pollInterval = Duration.ofMillis(5000);
        private Duration retryBaseDelay = Duration.ofMillis(3000);
        private Duration retryMaxDelay = Duration.ofMillis(15000);
    }

    @Data
    public static class GracePollProperties {
        private Duration interval = Duration.ofMillis(2000);
        private Duration maxWait = Duration.ofMillis(60000);
    }

    @Data
    public static class ValidationProperties {
        private int minPromptChars = 20;
        private int shortPromptTipChars = 80;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/consult";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 300000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class PromptProperties {
        private String defaultSystemPrompt = "You are a careful senior engineer consulted for a single, self-contained "
                + "question. Work through the problem in depth, state your assumptions, and give a direct, "
                + "actionable answer. Point out risks or gaps in the provided context instead of guessing.";
    }
}
