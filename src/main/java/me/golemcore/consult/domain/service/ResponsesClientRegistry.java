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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.consult.domain.exception.PromptValidationException;
import me.golemcore.consult.port.outbound.ResponsesClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Indexes the available {@link ResponsesClient} implementations by provider id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponsesClientRegistry {

    private final List<ResponsesClient> clients;

    private final Map<String, ResponsesClient> clientsByProvider = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (ResponsesClient client : clients) {
            clientsByProvider.put(client.getProviderId(), client);
            log.debug("Registered responses client: {}", client.getProviderId());
        }
    }

    /**
     * @throws PromptValidationException
     *             when no client serves the provider
     */
    public ResponsesClient getClient(String provider) {
        ResponsesClient client = clientsByProvider.get(provider);
        if (client == null) {
            throw new PromptValidationException("No backend client for provider \"" + provider + "\"",
                    Map.of("provider", String.valueOf(provider)));
        }
        return client;
    }
}
