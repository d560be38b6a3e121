package dev.dimitra.auditor.prepass;

import dev.dimitra.auditor.llm.AuditProvider;
import dev.dimitra.auditor.llm.AuditRequest;
import dev.dimitra.auditor.model.ContentTier;
import dev.dimitra.auditor.model.FileClassification;
import dev.dimitra.auditor.model.FileContent;
import dev.dimitra.auditor.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cheap triage before an expensive audit. The classifier answers through the normal findings
 * channel: severity high, medium and low select the full, snippet and map tiers, and a file
 * without a finding is skipped.
 */
public class PrepassClassifier {

    private static final Logger log = LoggerFactory.getLogger(PrepassClassifier.class);

    private static final String CLASSIFICATION_PROMPT = """
            You are a file relevance classifier for a code audit tool.

            Audit focus areas: %1$s

            Review the provided files and classify each one by how much content the main auditor
            will need to assess it for the specified focus areas.

            Output a finding for EACH file that should be included in the main audit:
              - severity: "high"   -> file is highly relevant; send full content
              - severity: "medium" -> file is moderately relevant; a snippet is enough
              - severity: "low"    -> file is marginally relevant; a structural map is enough
              - title: one of "full-content", "snippet", or "file-map" (matching the severity above)
              - file: <exact file path as provided, do not change the path>
              - description: one-sentence reason for this classification

            For files that are clearly NOT relevant (auto-generated files, lock files, build artifacts,
            or configs completely unrelated to %1$s), omit them and output no finding.

            When in doubt, INCLUDE the file (at least as "low"/file-map). The goal is to filter
            only obviously irrelevant files to reduce token costs, not to perform a full audit.""";

    // classification answers are short, roughly 60 tokens per file
    private static final int OUTPUT_TOKENS_PER_FILE = 60;
    private static final int TOKENS_PER_FOCUS_SLOT = 4096;

    private final AuditProvider provider;

    public PrepassClassifier(AuditProvider provider) {
        this.provider = provider;
    }

    public static String buildClassificationPrompt(List<String> focusNames) {
        return String.format(CLASSIFICATION_PROMPT, String.join(", ", focusNames));
    }

    public PrepassResult classify(List<FileContent> files, List<String> focusNames, String label)
            throws IOException, InterruptedException {
        if (files.isEmpty()) return PrepassResult.empty();

        log.info("Pre-pass: classifying {} files with {}/{}", files.size(), provider.name(), provider.model());
        int slots = Math.max(1, (files.size() * OUTPUT_TOKENS_PER_FILE + TOKENS_PER_FOCUS_SLOT - 1) / TOKENS_PER_FOCUS_SLOT);
        AuditRequest request = new AuditRequest(files, buildClassificationPrompt(focusNames), "",
                label + "-prepass", slots);
        AuditProvider.PollResult result = provider.runToCompletion(request, null);
        if (result.status() != AuditProvider.BatchStatus.SUCCEEDED) {
            throw new IOException("Pre-pass classification " + result.jobId() + " ended as " + result.status());
        }

        PrepassResult prepass = fromFindings(files, result.findings());
        log.info("Pre-pass: {}/{} files retained ({} full, {} snippet, {} map)",
                prepass.retainedCount(), prepass.originalCount(),
                prepass.count(ContentTier.FULL), prepass.count(ContentTier.SNIPPET), prepass.count(ContentTier.MAP));
        return prepass;
    }

    /** Builds classifications and the enriched file list from the classifier's findings. */
    public static PrepassResult fromFindings(List<FileContent> files, List<Finding> findings) {
        Map<String, Finding> byPath = new HashMap<>();
        for (Finding f : findings) byPath.put(f.file(), f);

        List<FileClassification> classifications = new ArrayList<>();
        for (FileContent file : files) {
            Finding f = byPath.get(file.path());
            classifications.add(f == null
                    ? new FileClassification(file.path(), ContentTier.SKIP, null)
                    : new FileClassification(file.path(), ContentTier.fromSeverity(f.severity()), f.description()));
        }
        List<FileContent> enriched = enrich(files, classifications);
        return new PrepassResult(classifications, files.size(), enriched.size(), enriched);
    }

    /** FULL unchanged, SNIPPET and MAP reduced, SKIP dropped; input order preserved. */
    public static List<FileContent> enrich(List<FileContent> files, List<FileClassification> classifications) {
        Map<String, ContentTier> tiers = new HashMap<>();
        for (FileClassification c : classifications) tiers.put(c.path(), c.tier());

        List<FileContent> out = new ArrayList<>();
        for (FileContent file : files) {
            switch (tiers.getOrDefault(file.path(), ContentTier.SKIP)) {
                case FULL -> out.add(file);
                case SNIPPET -> out.add(FileExcerpts.snippet(file));
                case MAP -> out.add(FileExcerpts.structuralMap(file));
                case SKIP -> { }
            }
        }
        return out;
    }
}
