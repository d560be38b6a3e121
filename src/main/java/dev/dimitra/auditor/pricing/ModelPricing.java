package dev.dimitra.auditor.pricing;

/**
 * Per-model pricing, USD per million tokens.
 *
 * @param tierThreshold input token count above which the high rates apply, or null if untiered
 * @param batchDiscount fraction taken off the total for batch submissions (0.5 = 50%)
 */
public record ModelPricing(
        String provider,
        double inputPerMillion,
        double outputPerMillion,
        Integer tierThreshold,
        Double inputPerMillionHigh,
        Double outputPerMillionHigh,
        double batchDiscount,
        int contextWindow
) {
    static final double CACHE_READ_FACTOR = 0.10;
    static final double CACHE_WRITE_FACTOR = 1.25;

    public static ModelPricing flat(String provider, double input, double output, int contextWindow) {
        return new ModelPricing(provider, input, output, null, null, null, 0.0, contextWindow);
    }

    public boolean tiered() {
        return tierThreshold != null && tierThreshold > 0;
    }

    public boolean crossesTier(long inputTokens) {
        return tiered() && inputTokens > tierThreshold;
    }

    public boolean supportsBatchDiscount() {
        return batchDiscount > 0;
    }

    public double cost(long inputTokens, long outputTokens, boolean useBatch) {
        return cost(inputTokens, outputTokens, 0, 0, useBatch);
    }

    /**
     * Input above the tier threshold is billed at the high input rate; once the threshold is
     * crossed, all output is billed at the high output rate. Cache reads and writes are
     * priced off the standard input rate. The batch discount is applied last.
     */
    public double cost(long inputTokens, long outputTokens,
                       long cacheReadTokens, long cacheWriteTokens, boolean useBatch) {
        if (inputTokens == 0 && outputTokens == 0 && cacheReadTokens == 0 && cacheWriteTokens == 0) {
            return 0.0;
        }

        double inputCost;
        double outputCost;
        if (crossesTier(inputTokens)) {
            long standard = tierThreshold;
            long high = inputTokens - tierThreshold;
            inputCost = perMillion(standard, inputPerMillion) + perMillion(high, orZero(inputPerMillionHigh));
            outputCost = perMillion(outputTokens, orZero(outputPerMillionHigh));
        } else {
            inputCost = perMillion(inputTokens, inputPerMillion);
            outputCost = perMillion(outputTokens, outputPerMillion);
        }

        double cacheCost = perMillion(cacheReadTokens, inputPerMillion * CACHE_READ_FACTOR)
                + perMillion(cacheWriteTokens, inputPerMillion * CACHE_WRITE_FACTOR);

        double total = inputCost + outputCost + cacheCost;
        if (useBatch && supportsBatchDiscount()) {
            total *= 1.0 - batchDiscount;
        }
        return total;
    }

    private static double perMillion(long tokens, double rate) {
        return tokens / 1_000_000.0 * rate;
    }

    private static double orZero(Double d) {
        return d == null ? 0.0 : d;
    }
}
