package dev.dimitra.auditor.runner;

import dev.dimitra.auditor.model.AuditResult;

import java.io.IOException;
import java.util.List;

/**
 * One or more batches could not be polled, parsed or recorded. Those batches stay pending;
 * results of the batches that did complete are carried along.
 */
public class BatchRetrievalException extends IOException {

    private final List<String> failures;
    private final List<AuditResult> completed;

    public BatchRetrievalException(List<String> failures, List<AuditResult> completed) {
        super("Failed to retrieve " + failures.size() + " batch(es): " + String.join("; ", failures));
        this.failures = List.copyOf(failures);
        this.completed = List.copyOf(completed);
    }

    public List<String> failures() {
        return failures;
    }

    public List<AuditResult> completed() {
        return completed;
    }
}
