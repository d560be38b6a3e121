package dev.dimitra.auditor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Handoff between {@code submit} and a later {@code retrieve}, possibly in another process.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingBatch(
        @JsonProperty("submitted_at") String submittedAt,
        @JsonProperty("focus") String focus,
        @JsonProperty("focus_names") List<String> focusNames,
        @JsonProperty("batches") List<BatchRef> batches
) {
    public PendingBatch {
        focusNames = focusNames == null ? List.of() : List.copyOf(focusNames);
        batches = batches == null ? List.of() : List.copyOf(batches);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BatchRef(
            @JsonProperty("repo") String repo,
            @JsonProperty("batch_id") String batchId,
            @JsonProperty("provider") String provider,
            @JsonProperty("file_count") int fileCount
    ) {}

    /** Older records only carry the label; fall back to it. */
    public List<String> effectiveFocusNames() {
        if (!focusNames.isEmpty()) return focusNames;
        return focus == null ? List.of() : List.of(focus.split("\\+"));
    }

    /** The default focus for backfilling findings, only defined for single-focus runs. */
    public String defaultFocus() {
        List<String> names = effectiveFocusNames();
        return names.size() == 1 ? names.get(0) : null;
    }

    public List<String> sortedBatchIds() {
        List<String> ids = new ArrayList<>();
        for (BatchRef b : batches) ids.add(b.batchId());
        ids.sort(null);
        return ids;
    }

    public PendingBatch withBatches(List<BatchRef> remaining) {
        return new PendingBatch(submittedAt, focus, focusNames, remaining);
    }
}
