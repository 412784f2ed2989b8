package me.golemcore.consult.domain.model;

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

/**
 * Partial update of a session. {@code null} fields are left untouched;
 * {@code clearError} wipes any recorded error before the rest is applied.
 */
@Value
@Builder
public class SessionUpdate {

    RunStatus status;
    UsageSummary usage;
    Long elapsedMs;
    String errorMessage;
    ErrorCategory errorCategory;
    TransportFailureReason transportReason;
    ResponseMetadata response;
    boolean clearError;

    public static SessionUpdate status(RunStatus status) {
        return SessionUpdate.builder().status(status).build();
    }
}
