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

import java.util.List;

/**
 * Aggregate of a multi-model run. Every requested model appears exactly once,
 * either as fulfilled or as rejected.
 */
public record MultiModelRunSummary(
        List<ModelExecutionOutcome.Fulfilled> fulfilled,
        List<ModelExecutionOutcome.Rejected> rejected,
        long elapsedMs) {

    public MultiModelRunSummary {
        fulfilled = List.copyOf(fulfilled);
        rejected = List.copyOf(rejected);
    }

    public boolean hasFailures() {
        return !rejected.isEmpty();
    }

    public UsageSummary aggregateUsage() {
        return fulfilled.stream()
                .map(ModelExecutionOutcome.Fulfilled::usage)
                .reduce(UsageSummary::plus)
                .orElseGet(UsageSummary::empty);
    }
}
