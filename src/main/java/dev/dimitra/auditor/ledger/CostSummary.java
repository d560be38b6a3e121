package dev.dimitra.auditor.ledger;

import java.util.List;

/** Aggregate over a window of ledger entries. */
public record CostSummary(
        int days,
        int audits,
        long inputTokens,
        long outputTokens,
        long cacheReadTokens,
        long cacheWriteTokens,
        double totalCost,
        double averageCost,
        double projectedMonthly,
        List<LedgerEntry> recent
) {
    public CostSummary {
        recent = recent == null ? List.of() : List.copyOf(recent);
    }

    /** Share of processed input served from cache, in percent. */
    public double cacheSharePercent() {
        long processed = inputTokens + cacheReadTokens;
        return processed == 0 ? 0.0 : cacheReadTokens * 100.0 / processed;
    }

    public boolean empty() {
        return audits == 0;
    }
}
