package me.golemcore.consult.adapter.outbound.llm;

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

import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import lombok.RequiredArgsConstructor;
import me.golemcore.consult.domain.model.BackendRequest;
import me.golemcore.consult.domain.model.ResolvedCredential;
import me.golemcore.consult.infrastructure.config.ConsultProperties;
import org.springframework.stereotype.Component;

/**
 * Anthropic Messages API through langchain4j.
 *
 * <p>
 * Provider ID: {@code "anthropic"}
 */
@Component
@RequiredArgsConstructor
public class AnthropicChatClient extends Langchain4jChatClient {

    private final ConsultProperties properties;

    @Override
    public String getProviderId() {
        return "anthropic";
    }

    @Override
    protected StreamingChatModel createModel(BackendRequest request, ResolvedCredential credential) {
        var builder = AnthropicStreamingChatModel.builder()
                .apiKey(credential.apiKey())
                .modelName(request.getModel())
                .maxTokens(maxOutputTokens(request))
                .timeout(properties.getExecution().getLongRunningTimeout());

        if (credential.baseUrl() != null) {
            builder.baseUrl(credential.baseUrl());
        }

        return builder.build();
    }
}
