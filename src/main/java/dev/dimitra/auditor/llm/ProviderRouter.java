package dev.dimitra.auditor.llm;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Builds providers from environment variables. API keys are required for the provider being
 * built only; base URLs can be overridden for proxies and tests.
 */
public class ProviderRouter implements ProviderFactory {

    public static final List<String> KNOWN = List.of(
            ClaudeBatchProvider.NAME, OpenAiBatchProvider.NAME, GeminiProvider.NAME, DeepSeekProvider.NAME);

    private final Function<String, String> env;

    public ProviderRouter() {
        this(System::getenv);
    }

    public ProviderRouter(Function<String, String> env) {
        this.env = env;
    }

    public static String normalize(String provider) {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }

    public static void requireKnown(String provider) {
        if (!KNOWN.contains(normalize(provider))) {
            throw new IllegalArgumentException("Unknown provider: " + provider + ". Available: " + String.join(", ", KNOWN));
        }
    }

    @Override
    public AuditProvider create(String provider, String model) {
        switch (normalize(provider)) {
            case ClaudeBatchProvider.NAME:
                return new ClaudeBatchProvider(
                        env("ANTHROPIC_API_KEY", null),  // required
                        model,
                        env("ANTHROPIC_BASE_URL", ""),
                        env("ANTHROPIC_VERSION", ""));
            case OpenAiBatchProvider.NAME:
                return new OpenAiBatchProvider(env("OPENAI_API_KEY", null), model, env("OPENAI_BASE_URL", ""));
            case GeminiProvider.NAME:
                return new GeminiProvider(env("GOOGLE_API_KEY", null), model, env("GEMINI_BASE_URL", ""));
            case DeepSeekProvider.NAME:
                return new DeepSeekProvider(env("DEEPSEEK_API_KEY", null), model, env("DEEPSEEK_BASE_URL", ""));
            default:
                requireKnown(provider);
                throw new IllegalStateException("unreachable");
        }
    }

    /**
     * Read environment variable k, with default def.
     * If def == null and the variable is missing/blank, throw an error.
     */
    private String env(String k, String def) {
        String v = env.apply(k);
        if (v == null || v.isBlank()) {
            if (def == null) {
                throw new IllegalArgumentException("Missing env: " + k);
            }
            return def;
        }
        return v;
    }
}
