package dev.dimitra.auditor.model;

import java.util.List;

/** Outcome of one repository audit run, after decision filtering. */
public record AuditResult(
        String repo,
        String focus,
        String provider,
        List<Finding> findings,
        List<Finding> newFindings,
        int resolvedCount,
        String timestamp
) {
    public AuditResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
        newFindings = newFindings == null ? List.of() : List.copyOf(newFindings);
    }

    public static AuditResult empty(String repo, String focus, String provider, String timestamp) {
        return new AuditResult(repo, focus, provider, List.of(), List.of(), 0, timestamp);
    }

    public long countNew(Severity severity) {
        return newFindings.stream().filter(f -> f.severity() == severity).count();
    }
}
