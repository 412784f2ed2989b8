package me.golemcore.consult.domain.system;

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

import me.golemcore.consult.domain.model.BackendUsage;
import me.golemcore.consult.domain.model.UsageSummary;

import java.util.Locale;

/**
 * Formatting helpers for run output: elapsed time, USD cost and token counts.
 */
public final class RunStatsFormatter {

    private static final long MS_PER_SECOND = 1000L;
    private static final long MS_PER_MINUTE = 60 * MS_PER_SECOND;
    private static final long MS_PER_HOUR = 60 * MS_PER_MINUTE;

    private RunStatsFormatter() {
    }

    public static String formatElapsed(long ms) {
        if (ms >= MS_PER_HOUR) {
            long hours = ms / MS_PER_HOUR;
            long minutes = (ms % MS_PER_HOUR) / MS_PER_MINUTE;
            return hours + "h " + minutes + "m";
        }
        if (ms >= MS_PER_MINUTE) {
            long minutes = ms / MS_PER_MINUTE;
            long seconds = (ms % MS_PER_MINUTE) / MS_PER_SECOND;
            return minutes + "m " + seconds + "s";
        }
        if (ms >= MS_PER_SECOND) {
            return (ms / MS_PER_SECOND) + "s";
        }
        return Math.max(ms, 0) + "ms";
    }

    public static String formatUsd(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return "n/a";
        }
        return String.format(Locale.ROOT, "$%.4f", value);
    }

    /**
     * Compact token count: {@code 950}, {@code 4.2k}, {@code 1.3m}.
     */
    public static String formatTokenCount(long value) {
        if (value >= 1_000_000) {
            return trimDecimal(value / 1_000_000d) + "m";
        }
        if (value >= 1_000) {
            return trimDecimal(value / 1_000d) + "k";
        }
        return Long.toString(value);
    }

    /**
     * Stats line printed once a model finishes, for example
     * {@code Finished in 4s (gpt-5.1[high] | $0.0123 | tok(i/o/r/t)=1.2k/300/0/1.5k)}.
     * Counts the backend did not report are marked with {@code *}.
     */
    public static String formatFinishedLine(long elapsedMs, String modelLabel, UsageSummary usage,
            BackendUsage reported, boolean searchEnabled) {
        StringBuilder sb = new StringBuilder();
        sb.append("Finished in ").append(formatElapsed(elapsedMs)).append(" (");
        sb.append(modelLabel);
        sb.append(" | ").append(usage.hasCost() ? formatUsd(usage.cost()) : "cost=N/A");
        sb.append(" | tok(i/o/r/t)=")
                .append(tokenValue(usage.inputTokens(), reported == null || reported.getInputTokens() == null))
                .append('/')
                .append(tokenValue(usage.outputTokens(), reported == null || reported.getOutputTokens() == null))
                .append('/')
                .append(tokenValue(usage.reasoningTokens(),
                        reported == null || reported.getReasoningTokens() == null))
                .append('/')
                .append(tokenValue(usage.totalTokens(), reported == null || reported.getTotalTokens() == null));
        if (!searchEnabled) {
            sb.append(" | search=off");
        }
        sb.append(')');
        return sb.toString();
    }

    private static String tokenValue(long value, boolean estimated) {
        return formatTokenCount(value) + (estimated ? "*" : "");
    }

    private static String trimDecimal(double value) {
        String formatted = String.format(Locale.ROOT, "%.1f", value);
        return formatted.endsWith(".0") ? formatted.substring(0, formatted.length() - 2) : formatted;
    }
}
