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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Backend response in the shape of the OpenAI Responses API. Other backends
 * convert their results into this shape.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackendResponse {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_IN_PROGRESS = "in_progress";
    public static final String STATUS_QUEUED = "queued";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_INCOMPLETE = "incomplete";
    public static final String STATUS_CANCELLED = "cancelled";

    private static final String CONTENT_OUTPUT_TEXT = "output_text";
    private static final String CONTENT_TEXT = "text";

    private String id;
    private String model;
    private String status;

    @JsonProperty("output_text")
    private List<String> outputText;

    private List<OutputItem> output;

    private BackendUsage usage;

    private ErrorInfo error;

    @JsonProperty("incomplete_details")
    private IncompleteDetails incompleteDetails;

    /** Taken from the {@code x-request-id} response header, never from the body. */
    @JsonIgnore
    private String requestId;

    @JsonIgnore
    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }

    @JsonIgnore
    public boolean isPending() {
        return STATUS_IN_PROGRESS.equals(status) || STATUS_QUEUED.equals(status);
    }

    /**
     * Extracts the answer text: the flattened {@code output_text} list when
     * present, otherwise text content parts of each output item.
     */
    public String extractText() {
        if (outputText != null && !outputText.isEmpty()) {
            return String.join("\n", outputText);
        }
        if (output == null) {
            return "";
        }
        List<String> segments = new ArrayList<>();
        for (OutputItem item : output) {
            if (item == null) {
                continue;
            }
            if (item.getContent() != null) {
                for (ContentPart part : item.getContent()) {
                    if (part != null && isTextPart(part.getType()) && part.getText() != null
                            && !part.getText().isEmpty()) {
                        segments.add(part.getText());
                    }
                }
            } else if (item.getText() != null) {
                segments.add(item.getText());
            }
        }
        return String.join("\n", segments);
    }

    public ResponseMetadata metadata() {
        String incompleteReason = incompleteDetails != null ? incompleteDetails.getReason() : null;
        return new ResponseMetadata(id, requestId, status, incompleteReason);
    }

    private static boolean isTextPart(String type) {
        return CONTENT_OUTPUT_TEXT.equals(type) || CONTENT_TEXT.equals(type);
    }

    /**
     * Convenience factory for a completed response carrying a single message.
     */
    public static BackendResponse completedText(String id, String text, BackendUsage usage) {
        return BackendResponse.builder()
                .id(id)
                .status(STATUS_COMPLETED)
                .output(List.of(OutputItem.builder()
                        .type("message")
                        .content(List.of(new ContentPart(CONTENT_OUTPUT_TEXT, text)))
                        .build()))
                .usage(usage)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OutputItem {
        private String type;
        private String role;
        private String text;
        private List<ContentPart> content;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentPart {
        private String type;
        private String text;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorInfo {
        private String code;
        private String message;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IncompleteDetails {
        private String reason;
    }
}
