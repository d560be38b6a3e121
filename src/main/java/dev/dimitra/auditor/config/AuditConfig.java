package dev.dimitra.auditor.config;

import dev.dimitra.auditor.files.FocusSchedule;

import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Everything a run needs, built once and passed down.
 *
 * @param schedule       raw schedule entries per weekday ("security", "does_it_work", "off", ...)
 * @param frameOverrides per-frame focus toggles, e.g. does_it_work -> {testing: false}
 * @param models         model per provider name; providers fall back to their own default
 */
public record AuditConfig(
        List<RepoConfig> repos,
        Map<DayOfWeek, String> schedule,
        Map<String, Map<String, Boolean>> frameOverrides,
        DecisionSettings decisions,
        PrepassSettings prepass,
        Map<String, String> models,
        Path stateDir,
        Path reportsDir
) {
    public AuditConfig {
        repos = repos == null ? List.of() : List.copyOf(repos);
        schedule = schedule == null || schedule.isEmpty() ? FocusSchedule.defaultWeek() : Collections.unmodifiableMap(new EnumMap<>(schedule));
        frameOverrides = frameOverrides == null ? Map.of() : Map.copyOf(frameOverrides);
        decisions = decisions == null ? DecisionSettings.defaults() : decisions;
        prepass = prepass == null ? PrepassSettings.defaults() : prepass;
        models = models == null ? Map.of() : Map.copyOf(models);
        stateDir = stateDir == null ? Path.of(".auditor") : stateDir;
        reportsDir = reportsDir == null ? Path.of("reports") : reportsDir;
    }

    public Optional<RepoConfig> repo(String name) {
        return repos.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    /** Model configured for a provider, or null to use the provider's default. */
    public String modelFor(String provider) {
        return models.get(provider);
    }

    public Path decisionsPath() {
        return stateDir.resolve(decisions.path());
    }

    /** Focus names scheduled for the given day, frames and overrides applied. */
    public List<String> focusFor(DayOfWeek day) {
        return FocusSchedule.resolve(schedule.getOrDefault(day, FocusSchedule.OFF), frameOverrides);
    }

    public static AuditConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Single-repository config from environment variables.
     * AUDIT_SCHEDULE_MON .. AUDIT_SCHEDULE_SUN override the default week entry by entry.
     */
    public static AuditConfig fromEnv(Function<String, String> env) {
        String repoPath = env(env, "AUDIT_REPO_PATH", ".");
        String repoName = env(env, "AUDIT_REPO_NAME", directoryName(repoPath));
        String provider = env(env, "AUDIT_PROVIDER", "anthropic");
        List<String> exclude = csv(env(env, "AUDIT_EXCLUDE", ""));

        Map<DayOfWeek, String> schedule = FocusSchedule.defaultWeek();
        for (DayOfWeek day : DayOfWeek.values()) {
            String key = "AUDIT_SCHEDULE_" + day.name().substring(0, 3);
            String entry = env(env, key, "");
            if (!entry.isBlank()) schedule.put(day, entry.trim());
        }

        DecisionSettings decisions = new DecisionSettings(
                Integer.parseInt(env(env, "AUDIT_DECISION_EXPIRY_DAYS", String.valueOf(DecisionSettings.DEFAULT_EXPIRY_DAYS))),
                env(env, "AUDIT_DECISIONS_FILE", ""));

        PrepassSettings prepass = new PrepassSettings(
                Boolean.parseBoolean(env(env, "AUDIT_PREPASS_ENABLED", "false")),
                Long.parseLong(env(env, "AUDIT_PREPASS_THRESHOLD", String.valueOf(PrepassSettings.DEFAULT_THRESHOLD_TOKENS))),
                Boolean.parseBoolean(env(env, "AUDIT_PREPASS_AUTO_DISABLE", "false")),
                env(env, "AUDIT_PREPASS_PROVIDER", ""),
                env(env, "AUDIT_PREPASS_MODEL", ""));

        Map<String, String> models = new HashMap<>();
        String model = env(env, "AUDIT_MODEL", "");
        if (!model.isBlank()) models.put(provider.toLowerCase(Locale.ROOT), model);

        return new AuditConfig(
                List.of(new RepoConfig(repoName, repoPath, provider, exclude)),
                schedule,
                Map.of(),
                decisions,
                prepass,
                models,
                Path.of(env(env, "AUDIT_STATE_DIR", ".auditor")),
                Path.of(env(env, "AUDIT_REPORTS_DIR", "reports")));
    }

    private static String directoryName(String path) {
        Path name = Path.of(path).toAbsolutePath().normalize().getFileName();
        return name == null ? "repo" : name.toString();
    }

    private static List<String> csv(String raw) {
        return Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    /**
     * Read environment variable k, with default def.
     * If def == null and the variable is missing/blank, throw an error.
     */
    private static String env(Function<String, String> env, String k, String def) {
        String v = env.apply(k);
        if (v == null || v.isBlank()) {
            if (def == null) {
                throw new IllegalArgumentException("Missing env: " + k);
            }
            return def;
        }
        return v;
    }
}
