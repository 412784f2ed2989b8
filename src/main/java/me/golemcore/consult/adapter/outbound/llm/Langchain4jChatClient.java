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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.consult.domain.model.BackendRequest;
import me.golemcore.consult.domain.model.BackendResponse;
import me.golemcore.consult.domain.model.BackendUsage;
import me.golemcore.consult.domain.model.ResolvedCredential;
import me.golemcore.consult.domain.model.ResponseStreamEvent;
import me.golemcore.consult.port.outbound.ResponsesClient;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Base for chat-style backends driven through langchain4j streaming models.
 *
 * <p>
 * The Responses-shaped request is flattened into a system message and a user
 * message. Partial responses become text deltas; the final
 * {@link ChatResponse} becomes a completed {@link BackendResponse}. These
 * backends have no asynchronous job API.
 */
@Slf4j
public abstract class Langchain4jChatClient implements ResponsesClient {

    static final int DEFAULT_MAX_OUTPUT_TOKENS = 8192;

    /**
     * Build a streaming model for one call.
     */
    protected abstract StreamingChatModel createModel(BackendRequest request, ResolvedCredential credential);

    @Override
    public Flux<ResponseStreamEvent> stream(BackendRequest request, ResolvedCredential credential) {
        return Flux.create(sink -> {
            StreamingChatModel model = createModel(request, credential);
            model.chat(toMessages(request), new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    if (partialResponse != null && !partialResponse.isEmpty()) {
                        sink.next(ResponseStreamEvent.textDelta(partialResponse));
                    }
                }

                @Override
                public void onCompleteResponse(ChatResponse response) {
                    sink.next(ResponseStreamEvent.completed(toBackendResponse(response)));
                    sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                    log.debug("[{}] Stream failed: {}", getProviderId(), error.getMessage());
                    sink.error(error);
                }
            });
        });
    }

    @Override
    public BackendResponse create(BackendRequest request, ResolvedCredential credential) {
        throw new UnsupportedOperationException(getProviderId() + " does not support background responses");
    }

    @Override
    public BackendResponse retrieve(String responseId, ResolvedCredential credential) {
        throw new UnsupportedOperationException(getProviderId() + " does not support background responses");
    }

    @Override
    public boolean supportsBackground() {
        return false;
    }

    static int maxOutputTokens(BackendRequest request) {
        return request.getMaxOutputTokens() != null ? request.getMaxOutputTokens() : DEFAULT_MAX_OUTPUT_TOKENS;
    }

    static List<ChatMessage> toMessages(BackendRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getInstructions() != null && !request.getInstructions().isBlank()) {
            messages.add(SystemMessage.from(request.getInstructions()));
        }
        messages.add(UserMessage.from(request.userText()));
        return messages;
    }

    static BackendResponse toBackendResponse(ChatResponse response) {
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        BackendUsage usage = null;
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = BackendUsage.of(tokenUsage.inputTokenCount(), tokenUsage.outputTokenCount(), null,
                    tokenUsage.totalTokenCount());
        }
        String id = response.id() != null ? response.id() : UUID.randomUUID().toString();
        return BackendResponse.completedText(id, text != null ? text : "", usage);
    }
}
