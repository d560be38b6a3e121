package dev.dimitra.auditor.model;

/**
 * A repository file as sent to a provider.
 * {@code path} is relative to the repository root and always uses '/' separators.
 */
public record FileContent(String path, String content) {

    /** Rough heuristic used everywhere: ~4 characters per token. */
    public int estimateTokens() {
        return content == null ? 0 : content.length() / 4;
    }

    public FileContent withContent(String newContent) {
        return new FileContent(path, newContent);
    }
}
