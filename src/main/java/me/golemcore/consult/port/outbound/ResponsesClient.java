package me.golemcore.consult.port.outbound;

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

import me.golemcore.consult.domain.model.BackendRequest;
import me.golemcore.consult.domain.model.BackendResponse;
import me.golemcore.consult.domain.model.ResolvedCredential;
import me.golemcore.consult.domain.model.ResponseStreamEvent;
import reactor.core.publisher.Flux;

/**
 * Port for one LLM backend family. Adding a backend means adding an
 * implementation; the executor does not change.
 */
public interface ResponsesClient {

    /**
     * Provider id this client serves, as used in {@code models.json}.
     */
    String getProviderId();

    /**
     * Open a streaming request. The flux emits text deltas followed by exactly
     * one {@link ResponseStreamEvent.Type#COMPLETED} event carrying the final
     * response. Cancelling the subscription closes the connection.
     */
    Flux<ResponseStreamEvent> stream(BackendRequest request, ResolvedCredential credential);

    /**
     * Submit an asynchronous job. Returns immediately with the job id and its
     * initial status.
     */
    BackendResponse create(BackendRequest request, ResolvedCredential credential);

    /**
     * Fetch the current state of an asynchronous job.
     */
    BackendResponse retrieve(String responseId, ResolvedCredential credential);

    boolean supportsBackground();
}
