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

import lombok.Builder;
import lombok.Value;
import me.golemcore.consult.domain.model.BackendRequest;
import me.golemcore.consult.domain.model.ModelPricing;
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.domain.model.ResolvedCredential;
import me.golemcore.consult.port.outbound.ResponsesClient;

import java.time.Duration;

/**
 * Everything {@link ModelCallExecutor} needs for one dispatch, resolved up
 * front by the caller.
 */
@Value
@Builder(toBuilder = true)
public class ModelCall {

    ModelRequest request;
    BackendRequest backendRequest;
    ResponsesClient client;
    ResolvedCredential credential;
    Duration timeout;
    boolean useBackground;
    /** {@code null} or zero disables heartbeat lines. */
    Duration heartbeatInterval;
    int estimatedInputTokens;
    ModelPricing pricing;
}
