package dev.dimitra.auditor.report;

import dev.dimitra.auditor.ledger.CostSummary;
import dev.dimitra.auditor.model.AuditResult;
import dev.dimitra.auditor.model.Finding;
import dev.dimitra.auditor.model.Severity;
import dev.dimitra.auditor.pricing.CostEstimate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Markdown output for audit results, cost estimates and the cost ledger summary.
 */
public class ReportWriter {

    private static final Map<Severity, String> ICONS = Map.of(
            Severity.HIGH, "🔴", Severity.MEDIUM, "🟡", Severity.LOW, "🔵");

    private final Path reportsDir;
    private final Clock clock;

    public ReportWriter(Path reportsDir) {
        this(reportsDir, Clock.systemDefaultZone());
    }

    public ReportWriter(Path reportsDir, Clock clock) {
        this.reportsDir = reportsDir;
        this.clock = clock;
    }

    /** "security+performance" -> "Security + Performance". */
    static String focusDisplay(String focus) {
        return Arrays.stream(nvl(focus, "").split("\\+"))
                .filter(s -> !s.isEmpty())
                .map(s -> s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1))
                .collect(Collectors.joining(" + "));
    }

    public String render(AuditResult result) {
        StringBuilder md = new StringBuilder();
        String focus = focusDisplay(result.focus());
        md.append("# Audit Report: ").append(focus).append("\n\n");
        md.append("- **Repo**: ").append(result.repo()).append("\n");
        md.append("- **Focus**: ").append(focus).append("\n");
        md.append("- **Provider**: ").append(result.provider()).append("\n");
        md.append("- **Date**: ").append(result.timestamp()).append("\n\n");

        md.append("## Summary\n\n");
        md.append("- **New findings**: ").append(result.newFindings().size()).append("\n");
        md.append("- **Total findings**: ").append(result.findings().size()).append("\n");
        md.append("- **Previously resolved**: ").append(result.resolvedCount()).append("\n\n");

        if (result.newFindings().isEmpty()) {
            md.append("No new findings. ✅\n");
            return md.toString();
        }

        for (Severity severity : Severity.values()) {
            List<Finding> group = result.newFindings().stream()
                    .filter(f -> f.severity() == severity)
                    .toList();
            if (group.isEmpty()) continue;

            md.append("## ").append(ICONS.get(severity)).append(" ")
              .append(severity.value().toUpperCase(Locale.ROOT))
              .append(" (").append(group.size()).append(")\n\n");
            for (Finding f : group) {
                md.append("### ").append(f.title()).append("\n\n");
                md.append("**Location**: `").append(f.location()).append("`  \n");
                md.append("**ID**: `").append(f.id()).append("`");
                if (f.focus() != null) md.append("  \n**Focus**: ").append(f.focus());
                md.append("\n\n").append(f.description()).append("\n");
                if (f.suggestion() != null && !f.suggestion().isBlank()) {
                    md.append("\n**Suggestion**: ").append(f.suggestion()).append("\n");
                }
                md.append("\n");
            }
        }
        return md.toString();
    }

    /** Writes {@code <reportsDir>/<repo>/<date>-<label>.md} and returns its path. */
    public Path save(AuditResult result) throws IOException {
        Path dir = reportsDir.resolve(result.repo());
        Files.createDirectories(dir);
        Path file = dir.resolve(LocalDate.now(clock) + "-" + result.focus() + ".md");
        Files.writeString(file, render(result), StandardCharsets.UTF_8);
        return file;
    }

    public static String renderEstimate(CostEstimate e) {
        StringBuilder md = new StringBuilder();
        md.append(String.format(Locale.ROOT, "**Cost estimate for `%s` (%s)**\n\n", e.repo(), focusDisplay(e.focusLabel())));
        md.append(String.format(Locale.ROOT, "- Files: **%d**  | input ~%,d tokens | output ~%,d tokens\n",
                e.fileCount(), e.inputTokens(), e.outputTokens()));
        md.append(String.format(Locale.ROOT, "- %s / %s: **$%.2f**%s\n", e.provider(), e.modelKey(), e.cost(),
                e.batchDiscounted() ? " (batch discount applied)" : ""));
        if (e.tiered()) {
            md.append("- ⚠️ Input exceeds the tier threshold; high-tier rates apply\n");
        }
        if (e.prepass() != null) {
            CostEstimate.PrepassReduction p = e.prepass();
            md.append(String.format(Locale.ROOT,
                    "- With pre-pass: ~%,d tokens (%d full, %d snippet, %d map/skip), triage $%.2f, total **$%.2f** (-%d%%)\n",
                    p.reducedTokens(), p.high(), p.medium(), p.lowOrSkip(), p.triageCost(), p.totalCost(), p.savingsPercent()));
        }
        if (!e.alternatives().isEmpty()) {
            md.append("\n**Cheaper alternatives:**\n");
            for (CostEstimate.Alternative a : e.alternatives()) {
                md.append(String.format(Locale.ROOT, "  - `%s` (%s): $%.2f (-%d%%)\n",
                        a.modelKey(), a.provider(), a.cost(), a.savingsPercent()));
            }
        }
        return md.toString();
    }

    public static String renderCostSummary(CostSummary s) {
        if (s.empty()) {
            return "No audits recorded in the last " + s.days() + " days.\n";
        }
        StringBuilder md = new StringBuilder();
        md.append("**Cost summary, last ").append(s.days()).append(" days**\n\n");
        md.append(String.format(Locale.ROOT, "- Audits: **%d**  | total **$%.4f** | avg $%.4f\n",
                s.audits(), s.totalCost(), s.averageCost()));
        md.append(String.format(Locale.ROOT, "- Tokens: %,d in / %,d out | cache share %.1f%%\n",
                s.inputTokens(), s.outputTokens(), s.cacheSharePercent()));
        md.append(String.format(Locale.ROOT, "- Projected monthly: **$%.2f**\n", s.projectedMonthly()));
        return md.toString();
    }

    private static String nvl(String s, String def) {
        return s == null ? def : s;
    }
}
