package dev.dimitra.auditor.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How much of a file the main audit receives after the pre-pass. */
public enum ContentTier {
    FULL, SNIPPET, MAP, SKIP;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean retained() {
        return this != SKIP;
    }

    /** high -> full, medium -> snippet, anything else -> map. */
    public static ContentTier fromSeverity(Severity severity) {
        return switch (severity) {
            case HIGH -> FULL;
            case MEDIUM -> SNIPPET;
            case LOW -> MAP;
        };
    }
}
