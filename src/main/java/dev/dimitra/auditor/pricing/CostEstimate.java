package dev.dimitra.auditor.pricing;

import java.util.List;

/** Projected cost of one repository audit and the cheaper ways of running it. */
public record CostEstimate(
        String repo,
        String focusLabel,
        int fileCount,
        long inputTokens,
        long outputTokens,
        String provider,
        String modelKey,
        double cost,
        boolean tiered,
        boolean batchDiscounted,
        List<Alternative> alternatives,
        PrepassReduction prepass
) {
    public CostEstimate {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public record Alternative(String modelKey, String provider, double cost, int savingsPercent) {}

    /**
     * Expected effect of a pre-pass triage, without running it.
     *
     * @param totalCost triage cost plus the reduced main audit cost
     */
    public record PrepassReduction(long reducedTokens, double triageCost, int high, int medium,
                                   int lowOrSkip, double totalCost, int savingsPercent) {}
}
