package dev.dimitra.auditor.llm;

import dev.dimitra.auditor.model.FileContent;

import java.util.List;

/**
 * The user message shared by every provider: decision context, files, expected JSON shape.
 */
public final class AuditPrompts {

    public static final String FINDING_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "findings": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "severity": {"type": "string", "enum": ["high", "medium", "low"]},
                      "file": {"type": "string"},
                      "line": {"type": ["integer", "null"]},
                      "title": {"type": "string"},
                      "description": {"type": "string"},
                      "suggestion": {"type": ["string", "null"]},
                      "focus": {"type": ["string", "null"]}
                    },
                    "required": ["severity", "file", "title", "description"]
                  }
                }
              },
              "required": ["findings"]
            }""";

    private AuditPrompts() {}

    public static String userMessage(List<FileContent> files, String decisionContext) {
        StringBuilder sb = new StringBuilder();
        sb.append("Review the following codebase files and report any findings.\n\n");
        if (decisionContext != null && !decisionContext.isBlank()) {
            sb.append(decisionContext.strip()).append("\n\n");
        }
        sb.append("## Files\n\n");
        sb.append(formatFiles(files)).append("\n\n");
        sb.append("Respond with a JSON object matching this schema:\n```json\n")
          .append(FINDING_SCHEMA).append("\n```\n\n");
        sb.append("Return ONLY the JSON object, no other text.");
        return sb.toString();
    }

    static String formatFiles(List<FileContent> files) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < files.size(); i++) {
            FileContent f = files.get(i);
            if (i > 0) sb.append("\n\n");
            sb.append("### `").append(f.path()).append("`\n```\n").append(f.content()).append("\n```");
        }
        return sb.toString();
    }
}
