package dev.dimitra.auditor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Disposition of a finding. All three kinds suppress the finding while the decision is valid.
 */
public enum DecisionType {
    ACCEPTED,     // fix applied
    DISMISSED,    // won't fix / not relevant
    INTENTIONAL;  // code is correct as written

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DecisionType from(String raw) {
        if (raw != null) {
            for (DecisionType t : values()) {
                if (t.value().equalsIgnoreCase(raw.trim())) return t;
            }
        }
        throw new IllegalArgumentException("Unknown decision: " + raw);
    }
}
