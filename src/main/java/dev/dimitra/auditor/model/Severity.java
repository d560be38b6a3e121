package dev.dimitra.auditor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    HIGH, MEDIUM, LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Strict parse: only "high", "medium" or "low" (any case). */
    @JsonCreator
    public static Severity from(String raw) {
        if (raw != null) {
            for (Severity s : values()) {
                if (s.value().equalsIgnoreCase(raw.trim())) return s;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + raw);
    }
}
