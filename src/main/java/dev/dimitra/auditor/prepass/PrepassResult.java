package dev.dimitra.auditor.prepass;

import dev.dimitra.auditor.model.ContentTier;
import dev.dimitra.auditor.model.FileClassification;
import dev.dimitra.auditor.model.FileContent;

import java.util.List;

/**
 * @param files the enriched files for the main audit, in input order, skipped files removed
 */
public record PrepassResult(List<FileClassification> classifications, int originalCount,
                            int retainedCount, List<FileContent> files) {

    public PrepassResult {
        classifications = List.copyOf(classifications);
        files = List.copyOf(files);
    }

    public static PrepassResult empty() {
        return new PrepassResult(List.of(), 0, 0, List.of());
    }

    public long count(ContentTier tier) {
        return classifications.stream().filter(c -> c.tier() == tier).count();
    }
}
