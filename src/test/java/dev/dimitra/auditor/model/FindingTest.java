package dev.dimitra.auditor.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindingTest {

    @Test
    @DisplayName("id is the first 12 hex chars of sha256(focus:file:title:line)")
    void idMatchesDigestOfKey() {
        String expected = Finding.sha256Hex("security:src/app.py:SQL injection:42".getBytes(StandardCharsets.UTF_8))
                .substring(0, 12);

        Finding f = Finding.of(Severity.HIGH, "src/app.py", 42, "SQL injection", "desc", null, "security");

        assertThat(f.id()).isEqualTo(expected).hasSize(12);
    }

    @Test
    @DisplayName("same focus, file, title and line give the same id regardless of other fields")
    void idIsStableAcrossProviders() {
        Finding a = Finding.of(Severity.HIGH, "a.py", 3, "Hardcoded key", "from claude", "rotate", "security");
        Finding b = Finding.of(Severity.LOW, "a.py", 3, "Hardcoded key", "from gemini", null, "security");

        assertThat(a.id()).isEqualTo(b.id());
    }

    @Test
    @DisplayName("focus and line take part in the id")
    void focusAndLineChangeId() {
        Finding base = Finding.of(Severity.HIGH, "a.py", 3, "t", "d", null, "security");

        assertThat(Finding.of(Severity.HIGH, "a.py", 3, "t", "d", null, "hygiene").id()).isNotEqualTo(base.id());
        assertThat(Finding.of(Severity.HIGH, "a.py", 4, "t", "d", null, "security").id()).isNotEqualTo(base.id());
    }

    @Test
    @DisplayName("missing focus and line leave the prefix out and render line as empty")
    void missingFocusAndLine() {
        String expected = Finding.sha256Hex("a.py:t:".getBytes(StandardCharsets.UTF_8)).substring(0, 12);

        assertThat(Finding.stableId(null, "a.py", "t", null)).isEqualTo(expected);
        assertThat(Finding.stableId("", "a.py", "t", null)).isEqualTo(expected);
    }

    @Test
    void locationIncludesLineWhenKnown() {
        assertThat(Finding.of(Severity.LOW, "a.py", 7, "t", "d", null, null).location()).isEqualTo("a.py:7");
        assertThat(Finding.of(Severity.LOW, "a.py", null, "t", "d", null, null).location()).isEqualTo("a.py");
    }

    @Test
    void severityParsingIsStrict() {
        assertThat(Severity.from("HIGH")).isEqualTo(Severity.HIGH);
        assertThatThrownBy(() -> Severity.from("critical")).isInstanceOf(IllegalArgumentException.class);
    }
}
