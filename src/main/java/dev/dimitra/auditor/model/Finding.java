package dev.dimitra.auditor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One reported issue. The id is derived from (focus, file, title, line) only, so the same
 * issue reported by any provider on any run maps to the same decision records.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(
        String id,
        Severity severity,
        String file,
        Integer line,          // 1-based, null if unknown
        String title,
        String description,
        String suggestion,     // optional
        String focus           // optional for single-focus runs
) {

    public static Finding of(Severity severity, String file, Integer line, String title,
                             String description, String suggestion, String focus) {
        return new Finding(stableId(focus, file, title, line),
                severity, file, line, title, description, suggestion, focus);
    }

    /**
     * First 12 hex chars of SHA-256 over {@code focus:file:title:line}. Callers pass the
     * backfilled focus, so single-focus findings carry the prefix too.
     */
    public static String stableId(String focus, String file, String title, Integer line) {
        String key = file + ":" + title + ":" + (line == null ? "" : line);
        if (focus != null && !focus.isBlank()) {
            key = focus + ":" + key;
        }
        return sha256Hex(key.getBytes(StandardCharsets.UTF_8)).substring(0, 12);
    }

    public static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String location() {
        return line == null || line <= 0 ? file : file + ":" + line;
    }
}
