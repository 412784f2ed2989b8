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

import java.time.Duration;

/**
 * Immutable request for a single model call. Built once per model before
 * dispatch and never mutated afterwards.
 */
@Value
@Builder(toBuilder = true)
public class ModelRequest {

    String model;
    String prompt;
    String systemPrompt;
    Integer maxOutputTokens;
    /** Web search tool; enabled unless explicitly {@code false}. */
    Boolean search;
    Duration timeout;
    /** Explicit background override; {@code null} means the model default. */
    Boolean background;
    Integer maxInputTokens;
    boolean silent;
    boolean suppressHeader;
    boolean suppressAnswerHeader;
    boolean suppressTips;

    public boolean isSearchEnabled() {
        return !Boolean.FALSE.equals(search);
    }

    public ModelRequest withModel(String targetModel) {
        return toBuilder().model(targetModel).build();
    }

    /**
     * Copy used for each model of a multi-model run: the shared banner and tips
     * are printed once by the caller, so per-model output omits them.
     */
    public ModelRequest forMultiModelDispatch(String targetModel) {
        return toBuilder()
                .model(targetModel)
                .suppressHeader(true)
                .suppressAnswerHeader(true)
                .suppressTips(true)
                .build();
    }
}
