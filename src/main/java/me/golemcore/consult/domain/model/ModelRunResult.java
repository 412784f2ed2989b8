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
 * Normalized outcome of one successful model call.
 */
public sealed interface ModelRunResult permits ModelRunResult.Streamed, ModelRunResult.Backgrounded {

    UsageSummary usage();

    long elapsedMs();

    BackendResponse response();

    /**
     * Answer text extracted from the final backend response.
     */
    default String answerText() {
        BackendResponse response = response();
        return response != null ? response.extractText() : "";
    }

    /**
     * Answer was forwarded to the output sink while it was generated.
     */
    record Streamed(UsageSummary usage, long elapsedMs, BackendResponse response) implements ModelRunResult {
    }

    /**
     * Answer was produced by an asynchronous job and retrieved by polling.
     */
    record Backgrounded(UsageSummary usage, long elapsedMs, BackendResponse response) implements ModelRunResult {
    }
}
