package dev.dimitra.auditor.decisions;

import dev.dimitra.auditor.model.Decision;

/**
 * Selects baseline records for removal. A null field matches anything.
 */
public record BaselineFilter(String focus, String severity, String repo) {

    public static final BaselineFilter ALL = new BaselineFilter(null, null, null);

    public boolean matches(Decision d) {
        return d.isBaseline()
                && (focus == null || focus.equals(d.focus()))
                && (severity == null || severity.equalsIgnoreCase(d.severity()))
                && (repo == null || repo.equals(d.repo()));
    }
}
