package me.golemcore.consult;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Consult.
 *
 * <p>
 * Sends one prompt to one or more LLM backends and collects the results,
 * tolerating long-running backends, transient network failures and partial
 * multi-model failure.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ConsultationsController
 * Domain Layer       → SessionRunService, MultiModelOrchestrator,
 *                      ConsultRunService, ModelCallExecutor, BackgroundResponsePoller
 * Infrastructure     → Responses/langchain4j clients, local session store
 * </pre>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ConsultApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConsultApplication.class, args);
    }
}
