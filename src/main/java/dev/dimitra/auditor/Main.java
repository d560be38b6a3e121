package dev.dimitra.auditor;

import dev.dimitra.auditor.config.AuditConfig;
import dev.dimitra.auditor.decisions.BaselineFilter;
import dev.dimitra.auditor.ledger.CostSummary;
import dev.dimitra.auditor.model.AuditResult;
import dev.dimitra.auditor.model.Decision;
import dev.dimitra.auditor.model.DecisionType;
import dev.dimitra.auditor.model.PendingBatch;
import dev.dimitra.auditor.pricing.CostEstimate;
import dev.dimitra.auditor.report.ReportWriter;
import dev.dimitra.auditor.runner.AuditOrchestrator;
import dev.dimitra.auditor.runner.BatchRetrievalException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class Main {

    private static final String USAGE =
            "usage: Main <submit|retrieve|run|estimate|decide|baseline|baseline-list|baseline-undo|cost>";

    // ---- ENTRY POINT ----
    public static void main(String[] args) throws Exception {
        if (args.length != 1) fail(USAGE);

        AuditConfig config = AuditConfig.fromEnv();
        AuditOrchestrator orchestrator = new AuditOrchestrator(config);

        String focus = env("AUDIT_FOCUS");
        String repo = env("AUDIT_REPO");
        String provider = env("AUDIT_PROVIDER_OVERRIDE");

        switch (args[0]) {
            case "submit" -> {
                if (boolEnv("AUDIT_DRY_RUN", false)) {
                    orchestrator.dryRun(focus, repo, provider);
                    return;
                }
                Optional<PendingBatch> pending = orchestrator.submit(focus, repo, provider);
                if (pending.isPresent()) {
                    System.out.println("Submitted " + pending.get().batches().size() + " batch(es) for "
                            + pending.get().focus() + ". Run `retrieve` later to get results.");
                } else {
                    System.out.println("Nothing submitted.");
                }
            }
            case "retrieve" -> {
                try {
                    print(orchestrator.retrieve(), new ReportWriter(config.reportsDir()));
                } catch (BatchRetrievalException e) {
                    print(e.completed(), new ReportWriter(config.reportsDir()));
                    fail(e.getMessage());
                }
            }
            case "run" -> {
                if (boolEnv("AUDIT_DRY_RUN", false)) {
                    orchestrator.dryRun(focus, repo, provider);
                    return;
                }
                print(orchestrator.runToCompletion(focus, repo, provider), new ReportWriter(config.reportsDir()));
            }
            case "estimate" -> {
                List<CostEstimate> estimates = orchestrator.estimate(focus, repo, provider);
                if (estimates.isEmpty()) System.out.println("No files to estimate.");
                for (CostEstimate e : estimates) System.out.println(ReportWriter.renderEstimate(e));
            }
            case "decide" -> {
                String findingId = env("AUDIT_FINDING_ID");
                String action = env("AUDIT_DECISION");
                if (findingId == null || action == null) fail("decide needs AUDIT_FINDING_ID and AUDIT_DECISION");
                Decision d = orchestrator.decide(findingId, decisionType(action), env("AUDIT_REASON"), env("AUDIT_DECIDED_BY"));
                System.out.println("Decision recorded: " + d.decision().value() + " finding " + d.findingId());
            }
            case "baseline" -> {
                int created = orchestrator.baseline(repo, env("AUDIT_BASELINE_FOCUS"), env("AUDIT_BASELINE_SEVERITY"));
                if (created == 0) {
                    System.out.println("No findings to baseline. Run an audit first.");
                } else {
                    System.out.println("Baselined " + created + " finding(s) from the latest audit.");
                }
            }
            case "baseline-list" -> {
                List<Decision> baselines = orchestrator.decisions().listBaseline();
                if (baselines.isEmpty()) {
                    System.out.println("No baselined findings.");
                }
                for (Decision d : baselines) {
                    System.out.println("- " + d.findingId() + "  " + nvl(d.repo()) + "  " + nvl(d.focus())
                            + "  " + nvl(d.severity()) + "  " + nvl(d.file()));
                }
            }
            case "baseline-undo" -> {
                BaselineFilter filter = new BaselineFilter(
                        env("AUDIT_BASELINE_FOCUS"), env("AUDIT_BASELINE_SEVERITY"), repo);
                int removed = orchestrator.decisions().removeBaseline(filter);
                System.out.println("Removed " + removed + " baseline decision(s).");
            }
            case "cost" -> {
                CostSummary summary = orchestrator.ledger().summarize(intEnv("AUDIT_COST_DAYS", 30));
                System.out.println(ReportWriter.renderCostSummary(summary));
            }
            default -> fail("Unknown command: " + args[0] + "\n" + USAGE);
        }
    }

    private static void print(List<AuditResult> results, ReportWriter writer) {
        for (AuditResult r : results) {
            System.out.println(writer.render(r));
        }
    }

    /** Accepts the verbs "accept", "dismiss", "intentional" as well as the stored values. */
    private static DecisionType decisionType(String action) {
        switch (action.toLowerCase(Locale.ROOT)) {
            case "accept": return DecisionType.ACCEPTED;
            case "dismiss": return DecisionType.DISMISSED;
            default: return DecisionType.from(action);
        }
    }

    private static String nvl(String s) {
        return s == null ? "-" : s;
    }

    // ---- Simple helpers ----
    private static String env(String key) {
        String v = System.getenv(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static boolean boolEnv(String key, boolean def) {
        String v = System.getenv(key);
        if (v == null) return def;
        return v.equalsIgnoreCase("true") || v.equalsIgnoreCase("1") || v.equalsIgnoreCase("yes");
    }

    private static int intEnv(String key, int def) {
        String v = System.getenv(key);
        if (v == null || v.isBlank()) return def;
        try { return Integer.parseInt(v.trim()); }
        catch (NumberFormatException e) { fail("Invalid " + key + ": " + v); return def; }
    }

    private static void fail(String msg) {
        System.err.println("[ERROR] " + msg);
        System.exit(1);
    }
}
