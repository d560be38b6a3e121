package dev.dimitra.auditor.pricing;

import dev.dimitra.auditor.model.FileContent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Estimates what an audit would cost before submitting it.
 */
public final class CostEstimator {

    private static final double HIGH_SHARE = 0.15;
    private static final double MEDIUM_SHARE = 0.30;
    private static final int TRIAGE_OUTPUT_PER_FILE = 60;

    private CostEstimator() {}

    public static long estimateTokens(List<FileContent> files) {
        long chars = 0;
        for (FileContent f : files) chars += f.content() == null ? 0 : f.content().length();
        return chars / 4;
    }

    public static CostEstimate estimate(String repo, String focusLabel, int focusCount,
                                        List<FileContent> files, String provider, String model) {
        String modelKey = PricingTable.resolveModelKey(provider, model);
        ModelPricing pricing = PricingTable.get(modelKey).orElseThrow();

        long input = estimateTokens(files);
        long output = PricingTable.estimateOutputTokens(input, focusCount);
        boolean useBatch = pricing.supportsBatchDiscount();
        double cost = pricing.cost(input, output, useBatch);
        boolean tiered = pricing.crossesTier(input);

        List<CostEstimate.Alternative> alternatives = new ArrayList<>();
        for (Map.Entry<String, ModelPricing> e : PricingTable.all().entrySet()) {
            if (e.getKey().equals(modelKey)) continue;
            ModelPricing alt = e.getValue();
            double altCost = alt.cost(input, output, alt.supportsBatchDiscount());
            if (cost > 0 && altCost < cost) {
                alternatives.add(new CostEstimate.Alternative(e.getKey(), alt.provider(), altCost,
                        (int) ((1.0 - altCost / cost) * 100)));
            }
        }
        alternatives.sort(Comparator.comparingDouble(CostEstimate.Alternative::cost));

        CostEstimate.PrepassReduction prepass = null;
        if (tiered) {
            prepass = estimatePrepass(files, input, focusCount, pricing, cost);
        }

        return new CostEstimate(repo, focusLabel, files.size(), input, output, provider, modelKey,
                cost, tiered, useBatch, alternatives, prepass);
    }

    /**
     * Assumes 15% of files classified high, 30% medium and the rest low or skipped; the
     * smallest high+medium files are kept. Triage is priced on gemini-2.5-flash.
     * Returns null when the pre-pass would not be cheaper.
     */
    static CostEstimate.PrepassReduction estimatePrepass(List<FileContent> files, long totalTokens,
                                                         int focusCount, ModelPricing pricing,
                                                         double fullCost) {
        if (files.isEmpty()) return null;
        int n = files.size();
        List<FileContent> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparingInt(f -> f.content() == null ? 0 : f.content().length()));

        int high = Math.max(1, (int) Math.round(n * HIGH_SHARE));
        int medium = Math.max(1, (int) Math.round(n * MEDIUM_SHARE));
        int kept = Math.min(n, high + medium);
        int lowOrSkip = Math.max(0, n - high - medium);

        long reduced = estimateTokens(sorted.subList(0, kept));
        ModelPricing flash = PricingTable.get(PricingTable.GEMINI_25_FLASH).orElseThrow();
        double triageCost = flash.cost(totalTokens, (long) n * TRIAGE_OUTPUT_PER_FILE, false);

        long reducedOutput = PricingTable.estimateOutputTokens(reduced, focusCount);
        double total = pricing.cost(reduced, reducedOutput, pricing.supportsBatchDiscount()) + triageCost;
        if (fullCost <= 0 || total >= fullCost) return null;
        return new CostEstimate.PrepassReduction(reduced, triageCost, high, medium, lowOrSkip, total,
                (int) ((1.0 - total / fullCost) * 100));
    }
}
