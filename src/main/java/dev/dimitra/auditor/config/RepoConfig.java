package dev.dimitra.auditor.config;

import java.util.List;
import java.util.Locale;

/**
 * One repository to audit.
 *
 * @param provider provider name, e.g. "anthropic"
 */
public record RepoConfig(String name, String path, String provider, List<String> exclude) {

    public RepoConfig {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Repository name is required");
        if (path == null || path.isBlank()) throw new IllegalArgumentException("Repository path is required for " + name);
        provider = (provider == null || provider.isBlank()) ? "anthropic" : provider.trim().toLowerCase(Locale.ROOT);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }
}
