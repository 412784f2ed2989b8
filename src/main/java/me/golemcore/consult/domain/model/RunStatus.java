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

import java.util.Collection;
import java.util.Locale;

/**
 * Lifecycle of a session or of one model run within it.
 */
public enum RunStatus {

    PENDING, RUNNING, COMPLETED, ERROR, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == CANCELLED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunStatus fromWireValue(String value) {
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Session status derived from its model runs: running while any child runs,
     * error once a child errored and nothing is still running, completed only
     * when every child completed.
     */
    public static RunStatus aggregate(Collection<RunStatus> children) {
        if (children == null || children.isEmpty()) {
            return PENDING;
        }
        boolean anyPending = false;
        boolean anyError = false;
        boolean anyCancelled = false;
        for (RunStatus child : children) {
            switch (child) {
            case RUNNING -> {
                return RUNNING;
            }
            case PENDING -> anyPending = true;
            case ERROR -> anyError = true;
            case CANCELLED -> anyCancelled = true;
            case COMPLETED -> {
                // counted implicitly
            }
            }
        }
        if (anyPending) {
            return children.stream().allMatch(status -> status == PENDING) ? PENDING : RUNNING;
        }
        if (anyError) {
            return ERROR;
        }
        return anyCancelled ? CANCELLED : COMPLETED;
    }
}
