package dev.dimitra.auditor.decisions;

import dev.dimitra.auditor.model.Finding;

import java.util.List;

/**
 * @param resolvedCount findings suppressed by a still-valid decision
 */
public record FilterResult(List<Finding> newFindings, int resolvedCount) {

    public FilterResult {
        newFindings = List.copyOf(newFindings);
    }
}
