package dev.dimitra.auditor.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.dimitra.auditor.model.Finding;
import dev.dimitra.auditor.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the judge's answer: one JSON object with a {@code findings} array, possibly inside
 * a markdown code fence. Anything else is rejected instead of being read as "no findings".
 */
public final class FindingParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FindingParser() {}

    public static List<Finding> parse(String text, String defaultFocus) throws MalformedResponseException {
        if (text == null || text.isBlank()) {
            throw new MalformedResponseException("Empty model response");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || !root.path("findings").isArray()) {
            throw new MalformedResponseException("Model response has no \"findings\" array");
        }

        List<Finding> findings = new ArrayList<>();
        int index = 0;
        for (JsonNode f : root.get("findings")) {
            findings.add(toFinding(f, index++, defaultFocus));
        }
        return findings;
    }

    private static Finding toFinding(JsonNode f, int index, String defaultFocus) throws MalformedResponseException {
        if (!f.isObject()) {
            throw new MalformedResponseException("findings[" + index + "] is not an object");
        }
        Severity severity;
        try {
            severity = Severity.from(required(f, "severity", index));
        } catch (IllegalArgumentException e) {
            throw new MalformedResponseException("findings[" + index + "]: " + e.getMessage(), e);
        }
        String file = required(f, "file", index);
        String title = required(f, "title", index);
        String description = required(f, "description", index);
        String focus = optionalText(f, "focus");
        if (focus == null) focus = defaultFocus;

        return Finding.of(severity, file, line(f.get("line")), title, description,
                optionalText(f, "suggestion"), focus);
    }

    private static String required(JsonNode f, String field, int index) throws MalformedResponseException {
        JsonNode v = f.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            throw new MalformedResponseException("findings[" + index + "] missing required field \"" + field + "\"");
        }
        return v.asText();
    }

    private static String optionalText(JsonNode f, String field) {
        JsonNode v = f.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private static Integer line(JsonNode v) {
        if (v == null || v.isNull()) return null;
        if (v.canConvertToInt() && v.isIntegralNumber()) return v.asInt();
        if (v.isTextual()) {
            try {
                return Integer.parseInt(v.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** Removes a surrounding ```json ... ``` (or bare ```) fence, if any. */
    static String stripCodeFence(String s) {
        String t = s.trim();
        int open = t.indexOf("```");
        if (open < 0) return t;
        int bodyStart = t.indexOf('\n', open);
        if (bodyStart < 0) {
            // single line: ```json {...}```
            String inline = t.substring(open).replaceFirst("^```(?:json)?\\s*", "");
            return inline.endsWith("```") ? inline.substring(0, inline.length() - 3).trim() : inline.trim();
        }
        int close = t.indexOf("```", bodyStart);
        String body = close < 0 ? t.substring(bodyStart + 1) : t.substring(bodyStart + 1, close);
        return body.trim();
    }
}
