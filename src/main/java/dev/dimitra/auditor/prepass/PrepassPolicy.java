package dev.dimitra.auditor.prepass;

import dev.dimitra.auditor.config.PrepassSettings;
import dev.dimitra.auditor.model.FileContent;
import dev.dimitra.auditor.pricing.CostEstimator;
import dev.dimitra.auditor.pricing.ModelPricing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decides whether a repository's file set goes through the pre-pass before the main audit.
 */
public final class PrepassPolicy {

    private static final Logger log = LoggerFactory.getLogger(PrepassPolicy.class);

    // rough expected reduction when auto-enabling
    private static final double EXPECTED_REDUCTION = 0.5;

    private PrepassPolicy() {}

    /**
     * @param pricing pricing of the primary model, or null if unknown
     */
    public static boolean shouldRun(String repo, List<FileContent> files, PrepassSettings settings,
                                    ModelPricing pricing) {
        long tokens = CostEstimator.estimateTokens(files);

        if (settings.enabled() && tokens > settings.thresholdTokens()) {
            log.info("[{}] Pre-pass enabled: ~{}K tokens exceed threshold of {}K",
                    repo, tokens / 1000, settings.thresholdTokens() / 1000);
            return true;
        }
        if (settings.autoDisable()) return false;

        if (pricing != null && pricing.crossesTier(tokens)) {
            long after = (long) (tokens * EXPECTED_REDUCTION);
            double before = tokens / 1_000_000.0 * pricing.inputPerMillion();
            double reduced = pricing.inputPerMillionHigh() == null
                    ? before
                    : after / 1_000_000.0 * pricing.inputPerMillionHigh();
            log.info("[{}] Auto-enabling pre-pass: ~{}K tokens would hit tiered pricing; "
                            + "pre-pass reduces to ~{}K tokens, saving ~${} per audit",
                    repo, tokens / 1000, after / 1000, String.format("%.2f", before - reduced));
            return true;
        }
        return false;
    }
}
