package me.golemcore.consult.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsageSummaryTest {

    private static final ModelPricing PRO_PRICING = new ModelPricing(15.0, 120.0);

    @Test
    void shouldComputeCostFromReportedUsage() {
        UsageSummary usage = UsageSummary.from(BackendUsage.of(1_000, 500, 100, 1_600), 900, PRO_PRICING);

        assertEquals(1_000, usage.inputTokens());
        assertEquals(500, usage.outputTokens());
        assertEquals(100, usage.reasoningTokens());
        assertEquals(1_600, usage.totalTokens());
        assertEquals(0.075, usage.cost(), 1e-9);
    }

    @Test
    void shouldFallBackToEstimateWhenUsageMissing() {
        UsageSummary usage = UsageSummary.from(null, 900, PRO_PRICING);

        assertEquals(900, usage.inputTokens());
        assertEquals(0, usage.outputTokens());
        assertEquals(900, usage.totalTokens());
        assertEquals(0.0135, usage.cost(), 1e-9);
    }

    @Test
    void shouldLeaveCostUnknownWithoutPricing() {
        UsageSummary usage = UsageSummary.from(BackendUsage.of(10, 20, null, null), 5, null);

        assertFalse(usage.hasCost());
        assertEquals(30, usage.totalTokens());
    }

    @Test
    void shouldRejectNegativeOrNonFiniteCost() {
        assertThrows(IllegalArgumentException.class, () -> new UsageSummary(0, 0, 0, 0, -1.0));
        assertThrows(IllegalArgumentException.class, () -> new UsageSummary(0, 0, 0, 0, Double.POSITIVE_INFINITY));
    }

    @Test
    void shouldKeepCostOnlyWhenEveryPartIsKnown() {
        UsageSummary priced = new UsageSummary(10, 20, 0, 30, 0.5);
        UsageSummary unpriced = new UsageSummary(1, 2, 3, 6, null);

        UsageSummary both = priced.plus(priced);
        UsageSummary mixed = priced.plus(unpriced);

        assertEquals(1.0, both.cost(), 1e-9);
        assertEquals(60, both.totalTokens());
        assertNull(mixed.cost());
        assertEquals(36, mixed.totalTokens());
    }

    @Test
    void shouldAggregateFulfilledUsageInMultiModelSummary() {
        MultiModelRunSummary summary = new MultiModelRunSummary(
                List.of(new ModelExecutionOutcome.Fulfilled("a", new UsageSummary(10, 5, 0, 15, 0.25), "x", null),
                        new ModelExecutionOutcome.Fulfilled("b", new UsageSummary(20, 5, 1, 26, 0.5), "y", null)),
                List.of(new ModelExecutionOutcome.Rejected("c", new IllegalStateException("boom"))),
                1_000);

        UsageSummary total = summary.aggregateUsage();

        assertTrue(summary.hasFailures());
        assertEquals(30, total.inputTokens());
        assertEquals(41, total.totalTokens());
        assertEquals(0.75, total.cost(), 1e-9);
    }

    @Test
    void shouldReturnEmptyUsageWhenNothingFulfilled() {
        MultiModelRunSummary summary = new MultiModelRunSummary(List.of(), List.of(), 0);

        assertEquals(UsageSummary.empty(), summary.aggregateUsage());
        assertFalse(summary.hasFailures());
    }
}
