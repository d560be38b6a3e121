package dev.dimitra.auditor.llm;

import dev.dimitra.auditor.model.Finding;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * A remote LLM judge reached through an asynchronous batch-style contract.
 *
 * <p>{@link #poll} never blocks waiting for the job; callers retry non-terminal results.
 * {@link #runToCompletion} is the blocking convenience on top of the two.
 */
public interface AuditProvider {

    record Usage(long inputTokens, long outputTokens, long cacheReadTokens, long cacheWriteTokens) {
        public static final Usage NONE = new Usage(0, 0, 0, 0);

        public Usage plus(Usage other) {
            return new Usage(inputTokens + other.inputTokens, outputTokens + other.outputTokens,
                    cacheReadTokens + other.cacheReadTokens, cacheWriteTokens + other.cacheWriteTokens);
        }
    }

    enum BatchStatus {
        SUBMITTED, PROCESSING, SUCCEEDED, ERRORED;

        public boolean isEnded() {
            return this == SUCCEEDED || this == ERRORED;
        }
    }

    record PollResult(String jobId, BatchStatus status, int processing, List<Finding> findings, Usage usage) {
        public PollResult {
            findings = findings == null ? List.of() : List.copyOf(findings);
            usage = usage == null ? Usage.NONE : usage;
        }

        public static PollResult processing(String jobId, int processing) {
            return new PollResult(jobId, BatchStatus.PROCESSING, processing, List.of(), Usage.NONE);
        }

        public static PollResult succeeded(String jobId, List<Finding> findings, Usage usage) {
            return new PollResult(jobId, BatchStatus.SUCCEEDED, 0, findings, usage);
        }

        public static PollResult errored(String jobId, Usage usage) {
            return new PollResult(jobId, BatchStatus.ERRORED, 0, List.of(), usage);
        }

        public boolean isEnded() {
            return status.isEnded();
        }
    }

    String name();

    String model();

    /** Submits one job and returns the provider's job id. */
    String submit(AuditRequest request) throws IOException, InterruptedException;

    /**
     * Checks a job once. Findings are present only for ended jobs; a missing focus is
     * backfilled with {@code defaultFocus}.
     *
     * @throws MalformedResponseException if the job ended but its output breaks the findings contract
     */
    PollResult poll(String jobId, String defaultFocus) throws IOException, InterruptedException;

    /** Submits, then polls every {@link #pollInterval()} until the job ends. */
    PollResult runToCompletion(AuditRequest request, String defaultFocus) throws IOException, InterruptedException;

    default Duration pollInterval() {
        return Duration.ofSeconds(60);
    }
}
