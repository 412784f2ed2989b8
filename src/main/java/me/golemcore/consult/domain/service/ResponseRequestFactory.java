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
import me.golemcore.consult.domain.model.BackendRequest;
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.infrastructure.config.ConsultProperties;
import me.golemcore.consult.infrastructure.config.ModelConfigService.ModelSettings;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the backend request body for one model.
 */
@Component
@RequiredArgsConstructor
public class ResponseRequestFactory {

    private static final String ROLE_USER = "user";
    private static final String INPUT_TEXT = "input_text";
    private static final String WEB_SEARCH_TOOL = "web_search_preview";

    private final ConsultProperties properties;

    public BackendRequest build(ModelRequest request, String modelKey, ModelSettings settings,
            boolean background) {
        String systemPrompt = request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()
                ? request.getSystemPrompt().trim()
                : properties.getPrompt().getDefaultSystemPrompt();

        BackendRequest.BackendRequestBuilder builder = BackendRequest.builder()
                .model(settings.apiModelOr(modelKey))
                .instructions(systemPrompt)
                .input(List.of(new BackendRequest.InputMessage(ROLE_USER,
                        List.of(new BackendRequest.InputContent(INPUT_TEXT, request.getPrompt())))))
                .maxOutputTokens(request.getMaxOutputTokens());

        if (request.isSearchEnabled() && settings.isSupportsSearch()) {
            builder.tools(List.of(new BackendRequest.Tool(WEB_SEARCH_TOOL)));
        }
        if (settings.getReasoningEffort() != null && !settings.getReasoningEffort().isBlank()) {
            builder.reasoning(new BackendRequest.Reasoning(settings.getReasoningEffort()));
        }
        if (background) {
            builder.background(true).store(true);
        }
        return builder.build();
    }
}
