package dev.dimitra.auditor.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditConfigTest {

    @Test
    void defaultsFromEmptyEnvironment() {
        AuditConfig config = AuditConfig.fromEnv(k -> null);

        assertThat(config.repos()).singleElement().satisfies(r -> {
            assertThat(r.path()).isEqualTo(".");
            assertThat(r.provider()).isEqualTo("anthropic");
            assertThat(r.exclude()).isEmpty();
        });
        assertThat(config.focusFor(DayOfWeek.MONDAY)).containsExactly("security");
        assertThat(config.focusFor(DayOfWeek.SUNDAY)).isEmpty();
        assertThat(config.decisions().expiryDays()).isEqualTo(90);
        assertThat(config.decisionsPath()).isEqualTo(Path.of(".auditor", "decisions.jsonl"));
        assertThat(config.prepass().enabled()).isFalse();
        assertThat(config.prepass().provider()).isEqualTo("gemini");
        assertThat(config.modelFor("anthropic")).isNull();
    }

    @Test
    void readsOverrides() {
        Map<String, String> env = Map.of(
                "AUDIT_REPO_PATH", "/srv/api",
                "AUDIT_PROVIDER", "OpenAI",
                "AUDIT_EXCLUDE", "vendor, generated ,",
                "AUDIT_SCHEDULE_SUN", "does_it_work",
                "AUDIT_DECISION_EXPIRY_DAYS", "30",
                "AUDIT_PREPASS_ENABLED", "true",
                "AUDIT_MODEL", "gpt-4.1-mini",
                "AUDIT_STATE_DIR", "/var/lib/auditor");

        AuditConfig config = AuditConfig.fromEnv(env::get);

        RepoConfig repo = config.repos().get(0);
        assertThat(repo.name()).isEqualTo("api");
        assertThat(repo.provider()).isEqualTo("openai");
        assertThat(repo.exclude()).containsExactly("vendor", "generated");
        assertThat(config.focusFor(DayOfWeek.SUNDAY)).isNotEmpty();
        assertThat(config.decisions().expiryDays()).isEqualTo(30);
        assertThat(config.prepass().enabled()).isTrue();
        assertThat(config.modelFor("openai")).isEqualTo("gpt-4.1-mini");
        assertThat(config.decisionsPath()).isEqualTo(Path.of("/var/lib/auditor", "decisions.jsonl"));
        assertThat(config.repo("api")).isPresent();
        assertThat(config.repo("web")).isEmpty();
    }

    @Test
    void frameOverridesDropFocusAreas() {
        AuditConfig config = new AuditConfig(
                List.of(new RepoConfig("api", ".", null, null)),
                Map.of(DayOfWeek.MONDAY, "does_it_work"),
                Map.of("does_it_work", Map.of("testing", false)),
                null, null, null, null, null);

        assertThat(config.focusFor(DayOfWeek.MONDAY)).doesNotContain("testing").isNotEmpty();
        assertThat(config.focusFor(DayOfWeek.TUESDAY)).isEmpty();
    }

    @Test
    void repositoryNeedsNameAndPath() {
        assertThatThrownBy(() -> new RepoConfig(" ", ".", null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RepoConfig("api", null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("api");
    }
}
