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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of transport-level failure kinds.
 */
public enum TransportFailureReason {

    CLIENT_TIMEOUT("client-timeout"),
    CONNECTION_LOST("connection-lost"),
    CLIENT_ABORT("client-abort"),
    UNKNOWN("unknown");

    private final String code;

    TransportFailureReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Only timeouts and dropped connections are worth another attempt.
     */
    public boolean isRetryable() {
        return this == CLIENT_TIMEOUT || this == CONNECTION_LOST;
    }

    @JsonCreator
    public static TransportFailureReason fromCode(String code) {
        for (TransportFailureReason reason : values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        return UNKNOWN;
    }
}
