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

/**
 * One event read from a streaming backend connection.
 */
public record ResponseStreamEvent(Type type, String rawType, String delta, BackendResponse response) {

    public enum Type {
        TEXT_DELTA, COMPLETED, OTHER
    }

    public static ResponseStreamEvent textDelta(String delta) {
        return new ResponseStreamEvent(Type.TEXT_DELTA, "response.output_text.delta", delta, null);
    }

    /**
     * Terminal event carrying the final response, whatever its status.
     */
    public static ResponseStreamEvent completed(BackendResponse response) {
        return new ResponseStreamEvent(Type.COMPLETED, "response.completed", null, response);
    }

    public static ResponseStreamEvent other(String rawType) {
        return new ResponseStreamEvent(Type.OTHER, rawType, null, null);
    }
}
