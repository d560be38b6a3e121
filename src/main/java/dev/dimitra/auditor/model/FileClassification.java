package dev.dimitra.auditor.model;

public record FileClassification(String path, ContentTier tier, String reason) {

    public boolean relevant() {
        return tier.retained();
    }
}
