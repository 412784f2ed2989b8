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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted state of one consultation: the request options, the aggregate
 * status and one {@link ModelRunState} per requested model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionMetadata {

    private String id;
    private Instant createdAt;
    private Instant updatedAt;
    private RunStatus status;
    private String prompt;
    private String systemPrompt;
    private Integer maxOutputTokens;
    private boolean search;
    private Boolean background;
    private Long timeoutSeconds;

    @Builder.Default
    private List<String> models = new ArrayList<>();

    @Builder.Default
    private Map<String, ModelRunState> modelRuns = new LinkedHashMap<>();

    private UsageSummary usage;
    private Long elapsedMs;
    private String errorMessage;
    private ErrorCategory errorCategory;
    private TransportFailureReason transportReason;
    private ResponseMetadata response;

    @JsonIgnore
    public boolean isMultiModel() {
        return models != null && models.size() > 1;
    }
}
