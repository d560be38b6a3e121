package dev.dimitra.auditor.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerEntry(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("repo") String repo,
        @JsonProperty("focus") String focus,
        @JsonProperty("provider") String provider,
        @JsonProperty("model") String model,
        @JsonProperty("input_tokens") long inputTokens,
        @JsonProperty("output_tokens") long outputTokens,
        @JsonProperty("cache_read_tokens") long cacheReadTokens,
        @JsonProperty("cache_write_tokens") long cacheWriteTokens,
        @JsonProperty("file_count") int fileCount,
        @JsonProperty("cost_estimate_usd") double costEstimateUsd
) {
    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
