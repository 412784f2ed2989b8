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
 * Token counts and optional cost for one model call or an aggregate of calls.
 * All four counts are always present; {@code cost} is {@code null} when pricing
 * is unknown.
 */
public record UsageSummary(int inputTokens, int outputTokens, int reasoningTokens, int totalTokens, Double cost) {

    private static final double TOKENS_PER_MILLION = 1_000_000d;

    public UsageSummary {
        if (cost != null && (!Double.isFinite(cost) || cost < 0)) {
            throw new IllegalArgumentException("cost must be finite and non-negative: " + cost);
        }
    }

    public static UsageSummary empty() {
        return new UsageSummary(0, 0, 0, 0, null);
    }

    /**
     * Builds a summary from backend-reported usage, falling back to the local
     * input estimate and zeroes for missing counts.
     */
    public static UsageSummary from(BackendUsage usage, int estimatedInputTokens, ModelPricing pricing) {
        Integer reportedInput = usage != null ? usage.getInputTokens() : null;
        Integer reportedOutput = usage != null ? usage.getOutputTokens() : null;
        Integer reportedReasoning = usage != null ? usage.getReasoningTokens() : null;
        Integer reportedTotal = usage != null ? usage.getTotalTokens() : null;

        int input = reportedInput != null ? reportedInput : estimatedInputTokens;
        int output = reportedOutput != null ? reportedOutput : 0;
        int reasoning = reportedReasoning != null ? reportedReasoning : 0;
        int total = reportedTotal != null ? reportedTotal : input + output + reasoning;

        Double cost = null;
        if (pricing != null && pricing.isKnown()) {
            cost = input * pricing.inputPerMillion() / TOKENS_PER_MILLION
                    + output * pricing.outputPerMillion() / TOKENS_PER_MILLION;
        }
        return new UsageSummary(input, output, reasoning, total, cost);
    }

    public boolean hasCost() {
        return cost != null;
    }

    /**
     * Adds two summaries. The cost stays known only while every part is known.
     */
    public UsageSummary plus(UsageSummary other) {
        Double combinedCost = cost != null && other.cost() != null ? cost + other.cost() : null;
        return new UsageSummary(
                inputTokens + other.inputTokens(),
                outputTokens + other.outputTokens(),
                reasoningTokens + other.reasoningTokens(),
                totalTokens + other.totalTokens(),
                combinedCost);
    }
}
