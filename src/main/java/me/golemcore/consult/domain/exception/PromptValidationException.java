package me.golemcore.consult.domain.exception;

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

import me.golemcore.consult.domain.model.ErrorCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request rejected before any backend was contacted. Never retried.
 */
public class PromptValidationException extends ConsultException {

    private static final long serialVersionUID = 1L;

    private final transient Map<String, Object> details;

    public PromptValidationException(String message) {
        this(message, Map.of());
    }

    public PromptValidationException(String message, Map<String, Object> details) {
        super(message);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
