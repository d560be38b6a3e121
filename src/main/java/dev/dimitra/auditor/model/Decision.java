package dev.dimitra.auditor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A persisted judgment about a finding. Never mutated; a later-dated record with the same
 * {@code findingId} supersedes it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decision(
        @JsonProperty("finding_id") String findingId,
        @JsonProperty("decision") DecisionType decision,
        @JsonProperty("reason") String reason,
        @JsonProperty("date") String date,
        @JsonProperty("by") String by,
        @JsonProperty("file") String file,
        @JsonProperty("file_hash") String fileHash,
        @JsonProperty("focus") String focus,
        @JsonProperty("severity") String severity,
        @JsonProperty("repo") String repo
) {
    public static final String BASELINE_REASON = "baseline";

    @JsonIgnore
    public boolean isBaseline() {
        return BASELINE_REASON.equals(reason);
    }
}
