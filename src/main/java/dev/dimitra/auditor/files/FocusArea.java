package dev.dimitra.auditor.files;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Named audit lenses. Each one decides which files are gathered and which system prompt
 * the judge receives. Prompts live under {@code /prompts/<name>.md} on the classpath.
 */
public enum FocusArea {

    SECURITY("Security vulnerabilities, secrets, permissions, dependency issues", List.of(
            "**/*.yml", "**/*.yaml", "**/*.toml", "**/*.json", "**/*.env*", "**/.env*",
            "**/Dockerfile*", "**/docker-compose*", "**/.dockerignore",
            "**/*.sh", "**/*.bash",
            "**/*.py", "**/*.ts", "**/*.tsx", "**/*.js", "**/*.jsx", "**/*.go", "**/*.rs", "**/*.rb",
            "**/*.java", "**/*.kt", "**/*.properties",
            "**/.gitignore", "**/.github/**/*.yml",
            "**/package.json", "**/package-lock.json", "**/requirements*.txt", "**/Pipfile",
            "**/Cargo.toml", "**/go.mod", "**/Gemfile", "**/pom.xml", "**/build.gradle*")),

    DOCS("Documentation accuracy, staleness, drift from actual code", List.of(
            "**/README*", "**/CHANGELOG*", "**/CONTRIBUTING*", "**/*.md", "**/*.mdx", "**/*.rst",
            "**/*.yml", "**/*.yaml", "**/*.toml",
            "**/*.py", "**/*.ts", "**/*.tsx", "**/*.js", "**/*.jsx", "**/*.go", "**/*.rs", "**/*.java")),

    PATTERNS("Code patterns, architecture consistency, abstraction quality", List.of(
            "**/*.py", "**/*.ts", "**/*.tsx", "**/*.js", "**/*.jsx", "**/*.go", "**/*.rs", "**/*.rb",
            "**/*.java", "**/*.kt",
            "**/*.yml", "**/*.yaml", "**/*.toml", "**/*.json",
            "**/package.json", "**/tsconfig*.json", "**/pyproject.toml", "**/Cargo.toml")),

    TESTING("Test coverage gaps, untested critical paths, flaky patterns, missing edge cases", List.of(
            "**/*.test.*", "**/*.spec.*", "**/__tests__/**", "**/test_*.py", "**/tests/**",
            "**/src/test/**",
            "**/*.py", "**/*.ts", "**/*.tsx", "**/*.js", "**/*.jsx", "**/*.go", "**/*.rs", "**/*.java",
            "**/jest.config.*", "**/vitest.config.*", "**/pytest.ini", "**/pyproject.toml",
            "**/setup.cfg", "**/.nycrc*")),

    HYGIENE("Dead code, stale TODOs, leftover debug output, config drift", List.of(
            "**/*.py", "**/*.ts", "**/*.tsx", "**/*.js", "**/*.jsx", "**/*.go", "**/*.rs", "**/*.java",
            "**/*.yml", "**/*.yaml", "**/*.toml", "**/*.json", "**/*.sh", "**/*.md",
            "**/.gitignore", "**/.github/**", "**/Dockerfile*", "**/docker-compose*")),

    DEPENDENCIES("Outdated, risky, duplicated or unused dependencies", List.of(
            "**/package.json", "**/package-lock.json", "**/pnpm-lock.yaml", "**/yarn.lock",
            "**/requirements*.txt", "**/Pipfile", "**/Pipfile.lock", "**/pyproject.toml", "**/poetry.lock",
            "**/Cargo.toml", "**/Cargo.lock", "**/go.mod", "**/go.sum", "**/Gemfile", "**/Gemfile.lock",
            "**/pom.xml", "**/build.gradle*",
            "**/*.py", "**/*.ts", "**/*.tsx", "**/*.js", "**/*.jsx")),

    PERFORMANCE("Missing caching, expensive patterns, bundle size, query efficiency", List.of(
            "**/*.py", "**/*.ts", "**/*.tsx", "**/*.js", "**/*.jsx", "**/*.go", "**/*.rs", "**/*.java",
            "**/*.yml", "**/*.yaml", "**/*.toml", "**/*.json",
            "**/migrations/**", "**/*.sql", "**/Dockerfile*", "**/docker-compose*",
            "**/webpack.config.*", "**/vite.config.*", "**/next.config.*", "**/tsconfig*.json"));

    private final String description;
    private final List<String> filePatterns;

    FocusArea(String description, List<String> filePatterns) {
        this.description = description;
        this.filePatterns = filePatterns;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String description() {
        return description;
    }

    public List<String> filePatterns() {
        return filePatterns;
    }

    public String prompt() {
        String resource = "/prompts/" + id() + ".md";
        try (InputStream in = FocusArea.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing prompt resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read prompt " + resource, e);
        }
    }

    public static FocusArea fromName(String name) {
        for (FocusArea f : values()) {
            if (f.id().equals(name)) return f;
        }
        throw new IllegalArgumentException("Unknown focus area: " + name + ". Available: "
                + Arrays.stream(values()).map(FocusArea::id).sorted().collect(Collectors.joining(", ")));
    }

    public static List<FocusArea> fromNames(Collection<String> names) {
        List<FocusArea> out = new ArrayList<>();
        for (String n : names) out.add(fromName(n));
        return out;
    }

    public static List<String> allNames() {
        return Arrays.stream(values()).map(FocusArea::id).collect(Collectors.toList());
    }

    /** Union of the glob lists of all given areas, first-seen order. */
    public static Set<String> unionPatterns(Collection<FocusArea> areas) {
        Set<String> all = new LinkedHashSet<>();
        for (FocusArea f : areas) all.addAll(f.filePatterns());
        return all;
    }

    /**
     * One area: its prompt unchanged. Several: a header asking the judge to tag every finding
     * with its focus, then one section per area.
     */
    public static String combinedPrompt(List<FocusArea> areas) {
        if (areas.size() == 1) return areas.get(0).prompt();

        String names = areas.stream().map(FocusArea::id).collect(Collectors.joining(", "));
        StringBuilder sb = new StringBuilder();
        sb.append("You are performing a combined codebase audit covering multiple focus areas. ")
          .append("For each finding, include a `focus` field indicating which focus area (")
          .append(names).append(") the finding belongs to.\n\n");
        for (FocusArea f : areas) {
            sb.append("## Focus Area: ").append(f.id()).append("\n\n");
            sb.append(f.prompt().strip()).append("\n\n");
        }
        return sb.toString().stripTrailing();
    }

    public static String label(List<String> names) {
        return String.join("+", names);
    }
}
