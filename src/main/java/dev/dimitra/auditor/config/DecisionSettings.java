package dev.dimitra.auditor.config;

public record DecisionSettings(int expiryDays, String path) {

    public static final int DEFAULT_EXPIRY_DAYS = 90;

    public DecisionSettings {
        if (expiryDays <= 0) expiryDays = DEFAULT_EXPIRY_DAYS;
        path = (path == null || path.isBlank()) ? "decisions.jsonl" : path;
    }

    public static DecisionSettings defaults() {
        return new DecisionSettings(DEFAULT_EXPIRY_DAYS, null);
    }
}
