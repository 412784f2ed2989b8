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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body in the shape of the OpenAI Responses API.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackendRequest {

    private String model;
    private String instructions;
    private List<InputMessage> input;
    private List<Tool> tools;
    private Reasoning reasoning;

    @JsonProperty("max_output_tokens")
    private Integer maxOutputTokens;

    private Boolean background;
    private Boolean store;
    private Boolean stream;

    /**
     * Concatenated user text, used by chat-style backends.
     */
    public String userText() {
        if (input == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (InputMessage message : input) {
            if (message.getContent() == null) {
                continue;
            }
            for (InputContent part : message.getContent()) {
                if (part.getText() != null) {
                    if (sb.length() > 0) {
                        sb.append('\n');
                    }
                    sb.append(part.getText());
                }
            }
        }
        return sb.toString();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InputMessage {
        private String role;
        private List<InputContent> content;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InputContent {
        private String type;
        private String text;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tool {
        private String type;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Reasoning {
        private String effort;
    }
}
