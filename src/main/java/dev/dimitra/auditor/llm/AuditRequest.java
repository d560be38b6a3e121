package dev.dimitra.auditor.llm;

import dev.dimitra.auditor.model.FileContent;

import java.util.List;

/**
 * One audit job: the files, the focus system prompt and the decision context.
 *
 * @param jobLabel caller label, e.g. "api-security"; providers may sanitize it
 */
public record AuditRequest(List<FileContent> files, String systemPrompt, String decisionContext,
                           String jobLabel, int focusCount) {

    private static final int TOKENS_PER_FOCUS = 4096;

    public AuditRequest {
        files = List.copyOf(files);
        decisionContext = decisionContext == null ? "" : decisionContext;
        focusCount = Math.max(1, focusCount);
    }

    public int maxOutputTokens() {
        return TOKENS_PER_FOCUS * focusCount;
    }
}
