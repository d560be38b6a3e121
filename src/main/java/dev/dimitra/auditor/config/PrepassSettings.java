package dev.dimitra.auditor.config;

/**
 * Pre-pass triage settings.
 *
 * @param enabled        run the pre-pass when the estimate exceeds {@code thresholdTokens}
 * @param autoDisable    when true, never auto-enable on tiered pricing
 * @param provider       cheap provider used for classification
 */
public record PrepassSettings(boolean enabled, long thresholdTokens, boolean autoDisable,
                              String provider, String model) {

    public static final long DEFAULT_THRESHOLD_TOKENS = 600_000;

    public PrepassSettings {
        if (thresholdTokens <= 0) thresholdTokens = DEFAULT_THRESHOLD_TOKENS;
        provider = (provider == null || provider.isBlank()) ? "gemini" : provider;
        model = (model == null || model.isBlank()) ? "gemini-2.5-flash" : model;
    }

    public static PrepassSettings defaults() {
        return new PrepassSettings(false, DEFAULT_THRESHOLD_TOKENS, false, null, null);
    }
}
