package dev.dimitra.auditor.pricing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Known model prices. Lookups go through {@link #resolveModelKey(String, String)} so dated or
 * aliased model names (e.g. "claude-sonnet-4-5-20250929") still price correctly.
 */
public final class PricingTable {

    public static final String CLAUDE_OPUS = "claude-opus-4-6";
    public static final String CLAUDE_SONNET = "claude-sonnet-4-5";
    public static final String GEMINI_25_FLASH = "gemini-2.5-flash";
    public static final String GEMINI_20_FLASH = "gemini-2.0-flash";
    public static final String GPT_41 = "gpt-4.1";
    public static final String DEEPSEEK_CHAT = "deepseek-chat";

    private static final Map<String, ModelPricing> MODELS;

    static {
        Map<String, ModelPricing> m = new LinkedHashMap<>();
        m.put(CLAUDE_OPUS, new ModelPricing("anthropic", 5.00, 25.00, 200_000, 10.00, 37.50, 0.50, 200_000));
        m.put(CLAUDE_SONNET, new ModelPricing("anthropic", 3.00, 15.00, 200_000, 6.00, 22.50, 0.50, 200_000));
        m.put(GEMINI_25_FLASH, ModelPricing.flat("gemini", 0.30, 2.50, 1_000_000));
        m.put(GEMINI_20_FLASH, ModelPricing.flat("gemini", 0.10, 0.40, 1_000_000));
        m.put(GPT_41, new ModelPricing("openai", 2.00, 8.00, null, null, null, 0.50, 1_000_000));
        m.put(DEEPSEEK_CHAT, ModelPricing.flat("deepseek", 0.27, 1.10, 64_000));
        MODELS = Collections.unmodifiableMap(m);
    }

    private PricingTable() {}

    public static Map<String, ModelPricing> all() {
        return MODELS;
    }

    public static Optional<ModelPricing> get(String modelKey) {
        return Optional.ofNullable(MODELS.get(modelKey));
    }

    public static ModelPricing forModel(String provider, String model) {
        return MODELS.get(resolveModelKey(provider, model));
    }

    /** Exact key first, then provider-specific heuristics. */
    public static String resolveModelKey(String provider, String model) {
        if (model != null && MODELS.containsKey(model)) return model;
        String p = provider == null ? "" : provider.toLowerCase(Locale.ROOT);
        String lower = model == null ? "" : model.toLowerCase(Locale.ROOT);
        switch (p) {
            case "anthropic":
                return lower.contains("opus") ? CLAUDE_OPUS : CLAUDE_SONNET;
            case "gemini":
                return lower.contains("2.5") || lower.contains("2-5") ? GEMINI_25_FLASH : GEMINI_20_FLASH;
            case "openai":
                return GPT_41;
            case "deepseek":
                return DEEPSEEK_CHAT;
            default:
                return GEMINI_20_FLASH;
        }
    }

    /** min(16384, input / 10) per focus area. */
    public static long estimateOutputTokens(long inputTokens, int focusCount) {
        long perFocus = Math.min(16_384, inputTokens / 10);
        return perFocus * Math.max(1, focusCount);
    }
}
