package dev.dimitra.auditor.runner;

import dev.dimitra.auditor.config.AuditConfig;
import dev.dimitra.auditor.config.RepoConfig;
import dev.dimitra.auditor.decisions.DecisionMemory;
import dev.dimitra.auditor.decisions.FilterResult;
import dev.dimitra.auditor.files.FileSelector;
import dev.dimitra.auditor.files.FocusArea;
import dev.dimitra.auditor.files.FocusSchedule;
import dev.dimitra.auditor.ledger.CostLedger;
import dev.dimitra.auditor.llm.AuditProvider;
import dev.dimitra.auditor.llm.AuditRequest;
import dev.dimitra.auditor.llm.MalformedResponseException;
import dev.dimitra.auditor.llm.ProviderFactory;
import dev.dimitra.auditor.llm.ProviderRouter;
import dev.dimitra.auditor.llm.SynchronousAuditProvider;
import dev.dimitra.auditor.model.AuditResult;
import dev.dimitra.auditor.model.Decision;
import dev.dimitra.auditor.model.DecisionType;
import dev.dimitra.auditor.model.FileContent;
import dev.dimitra.auditor.model.Finding;
import dev.dimitra.auditor.model.PendingBatch;
import dev.dimitra.auditor.model.Severity;
import dev.dimitra.auditor.prepass.PrepassClassifier;
import dev.dimitra.auditor.prepass.PrepassPolicy;
import dev.dimitra.auditor.pricing.CostEstimate;
import dev.dimitra.auditor.pricing.CostEstimator;
import dev.dimitra.auditor.pricing.PricingTable;
import dev.dimitra.auditor.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives audits across the configured repositories: deferred submit/retrieve across process
 * restarts, a blocking run, a dry run and a cost estimate. Repositories are handled one after
 * another.
 */
public class AuditOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AuditOrchestrator.class);

    /** Everything that would be sent for one repository. */
    public record PreparedAudit(RepoConfig repo, String provider, List<FileContent> files,
                                String systemPrompt, String decisionContext, int decisionCount) {}

    private record Plan(List<String> focusNames, List<FocusArea> areas, String label,
                        List<RepoConfig> repos, String providerOverride) {

        String providerFor(RepoConfig repo) {
            return providerOverride != null ? providerOverride : repo.provider();
        }

        String defaultFocus() {
            return focusNames.size() == 1 ? focusNames.get(0) : null;
        }
    }

    private final AuditConfig config;
    private final ProviderFactory providers;
    private final Clock clock;
    private final FileSelector selector = new FileSelector();
    private final DecisionMemory memory;
    private final CostLedger ledger;
    private final AuditStateStore state;
    private final ReportWriter reports;

    public AuditOrchestrator(AuditConfig config) {
        this(config, new ProviderRouter(), Clock.systemDefaultZone());
    }

    public AuditOrchestrator(AuditConfig config, ProviderFactory providers, Clock clock) {
        this.config = config;
        this.providers = providers;
        this.clock = clock;
        this.memory = new DecisionMemory(config.decisionsPath(), clock);
        this.state = new AuditStateStore(config.stateDir(), clock);
        this.ledger = new CostLedger(state.ledgerPath(), clock);
        this.reports = new ReportWriter(config.reportsDir(), clock);
    }

    public DecisionMemory decisions() {
        return memory;
    }

    public CostLedger ledger() {
        return ledger;
    }

    public AuditStateStore state() {
        return state;
    }

    // ---- submit / retrieve ----

    /**
     * Submits one job per repository with files and records them as pending.
     *
     * @return the pending record, or empty when the day is off or nothing was submitted
     */
    public Optional<PendingBatch> submit(String focusOverride, String repoFilter, String providerOverride)
            throws IOException, InterruptedException {
        Optional<Plan> maybePlan = plan(focusOverride, repoFilter, providerOverride);
        if (maybePlan.isEmpty()) return Optional.empty();
        Plan plan = maybePlan.get();
        Map<String, AuditProvider> clients = createProviders(plan);

        List<PendingBatch.BatchRef> batches = new ArrayList<>();
        PendingBatch pending = new PendingBatch(LocalDateTime.now(clock).toString(), plan.label(),
                plan.focusNames(), batches);
        try {
            for (RepoConfig repo : plan.repos()) {
                PreparedAudit prepared = prepare(plan, repo, true);
                if (prepared == null) continue;

                AuditProvider provider = clients.get(prepared.provider());
                String jobLabel = repo.name() + "-" + plan.label();
                log.info("[{}] Submitting {} batch via {} ({})", repo.name(), plan.label(), provider.name(), provider.model());
                String jobId = provider.submit(request(plan, prepared, jobLabel));
                log.info("[{}] Batch submitted: {}", repo.name(), jobId);
                batches.add(new PendingBatch.BatchRef(repo.name(), jobId, prepared.provider(), prepared.files().size()));
            }
        } finally {
            // jobs already accepted remotely must stay retrievable even if a later repo fails
            if (!batches.isEmpty()) {
                state.writePending(pending.withBatches(batches));
                log.info("Batch info saved to {}", state.pendingPath());
            }
        }
        return batches.isEmpty() ? Optional.empty() : Optional.of(pending.withBatches(batches));
    }

    /**
     * Polls every pending job once. Ended jobs are filtered, recorded and reported; jobs still
     * running stay in the pending record for the next call.
     *
     * @throws BatchRetrievalException after all batches were handled, if any job could not be polled,
     *         parsed or recorded; those jobs stay pending
     */
    public List<AuditResult> retrieve() throws IOException, InterruptedException {
        Optional<PendingBatch> maybePending = state.readPending();
        if (maybePending.isEmpty()) {
            log.info("No pending batch found at {}", state.pendingPath());
            return List.of();
        }
        PendingBatch pending = maybePending.get();
        if (state.alreadyRetrieved(pending)) {
            log.info("Batch already retrieved, skipping");
            return List.of();
        }

        String label = pending.focus() != null ? pending.focus() : FocusArea.label(pending.effectiveFocusNames());
        String defaultFocus = pending.defaultFocus();
        List<Decision> decisions = memory.load();

        List<AuditResult> results = new ArrayList<>();
        List<PendingBatch.BatchRef> unresolved = new ArrayList<>();
        List<String> failures = new ArrayList<>();

        for (PendingBatch.BatchRef ref : pending.batches()) {
            Optional<RepoConfig> repo = config.repo(ref.repo());
            if (repo.isEmpty()) {
                log.warn("[{}] Repository no longer configured, dropping batch {}", ref.repo(), ref.batchId());
                continue;
            }

            AuditProvider provider = provider(ref.provider(), config.modelFor(ref.provider()));
            log.info("[{}] Checking batch {}...", ref.repo(), ref.batchId());
            try {
                AuditProvider.PollResult poll = provider.poll(ref.batchId(), defaultFocus);
                if (!poll.isEnded()) {
                    log.info("[{}] Still processing ({} remaining)", ref.repo(), poll.processing());
                    unresolved.add(ref);
                    continue;
                }
                results.add(complete(repo.get(), ref.provider(), provider.model(), label, poll, ref.fileCount(), decisions));
            } catch (MalformedResponseException e) {
                log.error("[{}] Batch {} returned unusable output: {}", ref.repo(), ref.batchId(), e.getMessage());
                unresolved.add(ref);
                failures.add(ref.repo() + "/" + ref.batchId() + ": " + e.getMessage());
            } catch (IOException e) {
                log.error("[{}] Batch {} could not be completed: {}", ref.repo(), ref.batchId(), e.toString());
                unresolved.add(ref);
                failures.add(ref.repo() + "/" + ref.batchId() + ": " + e);
            }
        }

        if (unresolved.isEmpty()) {
            state.markRetrieved(pending);
            state.deletePending();
        } else {
            state.writePending(pending.withBatches(unresolved));
            log.info("{} batch(es) still pending; run retrieve again later", unresolved.size());
        }

        if (!failures.isEmpty()) {
            throw new BatchRetrievalException(failures, results);
        }
        return results;
    }

    // ---- blocking run ----

    /** Submits and waits per repository. Nothing is written to the pending record. */
    public List<AuditResult> runToCompletion(String focusOverride, String repoFilter, String providerOverride)
            throws IOException, InterruptedException {
        Optional<Plan> maybePlan = plan(focusOverride, repoFilter, providerOverride);
        if (maybePlan.isEmpty()) return List.of();
        Plan plan = maybePlan.get();
        Map<String, AuditProvider> clients = createProviders(plan);

        List<AuditResult> results = new ArrayList<>();
        for (RepoConfig repo : plan.repos()) {
            PreparedAudit prepared = prepare(plan, repo, true);
            if (prepared == null) {
                results.add(AuditResult.empty(repo.name(), plan.label(), "none", LocalDateTime.now(clock).toString()));
                continue;
            }
            AuditProvider provider = clients.get(prepared.provider());
            log.info("[{}] Running {} audit via {} ({})", repo.name(), plan.label(), provider.name(), provider.model());
            AuditProvider.PollResult poll = provider.runToCompletion(
                    request(plan, prepared, repo.name() + "-" + plan.label()), plan.defaultFocus());
            results.add(complete(repo, prepared.provider(), provider.model(), plan.label(), poll,
                    prepared.files().size(), memory.load()));
        }
        return results;
    }

    // ---- dry run / estimate ----

    /** Gathers and prepares everything a submit would send, without contacting any provider. */
    public List<PreparedAudit> dryRun(String focusOverride, String repoFilter, String providerOverride)
            throws IOException, InterruptedException {
        Optional<Plan> maybePlan = plan(focusOverride, repoFilter, providerOverride);
        if (maybePlan.isEmpty()) return List.of();
        Plan plan = maybePlan.get();

        List<PreparedAudit> out = new ArrayList<>();
        for (RepoConfig repo : plan.repos()) {
            PreparedAudit prepared = prepare(plan, repo, false);
            if (prepared == null) continue;
            log.info("[{}] DRY RUN: would send {} files to {}", repo.name(), prepared.files().size(), prepared.provider());
            log.info("[{}] Focus areas: {}", repo.name(), String.join(", ", plan.focusNames()));
            log.info("[{}] Prompt length: {} chars", repo.name(), prepared.systemPrompt().length());
            log.info("[{}] Decision context: {} prior decisions", repo.name(), prepared.decisionCount());
            out.add(prepared);
        }
        return out;
    }

    public List<CostEstimate> estimate(String focusOverride, String repoFilter, String providerOverride)
            throws IOException {
        Optional<Plan> maybePlan = plan(focusOverride, repoFilter, providerOverride);
        if (maybePlan.isEmpty()) return List.of();
        Plan plan = maybePlan.get();

        List<CostEstimate> out = new ArrayList<>();
        for (RepoConfig repo : plan.repos()) {
            List<FileContent> files = gather(plan, repo);
            if (files.isEmpty()) continue;
            String provider = plan.providerFor(repo);
            out.add(CostEstimator.estimate(repo.name(), plan.label(), plan.focusNames().size(), files,
                    provider, config.modelFor(provider)));
        }
        return out;
    }

    // ---- decisions ----

    /**
     * Files the latest snapshot findings of each repository as baseline decisions.
     *
     * @param focusFilter    comma-separated focus names, or null for all
     * @param severityFilter comma-separated severities, or null for all
     * @return number of decisions created
     */
    public int baseline(String repoFilter, String focusFilter, String severityFilter) throws IOException {
        List<RepoConfig> repos = repos(repoFilter);
        Set<String> focuses = new HashSet<>(FocusSchedule.resolve(focusFilter));
        FocusArea.fromNames(focuses);
        Set<Severity> severities = EnumSet.noneOf(Severity.class);
        for (String s : csv(severityFilter)) severities.add(Severity.from(s));

        int created = 0;
        for (RepoConfig repo : repos) {
            List<Finding> findings = state.readFindings(repo.name()).stream()
                    .filter(f -> focuses.isEmpty() || focuses.contains(f.focus()))
                    .filter(f -> severities.isEmpty() || severities.contains(f.severity()))
                    .toList();
            if (findings.isEmpty()) {
                log.info("[{}] No findings to baseline; run an audit first", repo.name());
                continue;
            }
            List<Decision> baseline = memory.createBaseline(findings, Path.of(repo.path()), repo.name());
            memory.saveAll(baseline);
            log.info("[{}] Baselined {} finding(s)", repo.name(), baseline.size());
            created += baseline.size();
        }
        return created;
    }

    /**
     * Records a judgment on a finding. When the finding is in a repository snapshot, its file is
     * hashed so that a later change resurfaces it.
     */
    public Decision decide(String findingId, DecisionType kind, String reason, String by) throws IOException {
        for (RepoConfig repo : config.repos()) {
            for (Finding f : state.readFindings(repo.name())) {
                if (f.id().equals(findingId)) {
                    return memory.record(findingId, kind, reason, by, f, Path.of(repo.path()));
                }
            }
        }
        log.info("Finding {} is not in any snapshot; recording without a file hash", findingId);
        return memory.record(findingId, kind, reason, by, null, null);
    }

    // ---- internals ----

    /**
     * Resolves focus, repositories and provider names. Every name is checked here so that a
     * configuration error surfaces before anything is gathered, submitted or written.
     */
    private Optional<Plan> plan(String focusOverride, String repoFilter, String providerOverride) {
        List<String> names = focusOverride == null || focusOverride.isBlank()
                ? config.focusFor(LocalDate.now(clock).getDayOfWeek())
                : FocusSchedule.resolve(focusOverride, config.frameOverrides());
        names = new ArrayList<>(new LinkedHashSet<>(names));
        List<FocusArea> areas = FocusArea.fromNames(names);

        List<RepoConfig> repos = repos(repoFilter);

        String override = providerOverride == null || providerOverride.isBlank()
                ? null : ProviderRouter.normalize(providerOverride);
        if (override != null) ProviderRouter.requireKnown(override);
        for (RepoConfig repo : repos) ProviderRouter.requireKnown(repo.provider());
        ProviderRouter.requireKnown(config.prepass().provider());

        if (names.isEmpty()) {
            log.info("Today is scheduled as off. Set a focus to override.");
            return Optional.empty();
        }
        return Optional.of(new Plan(names, areas, FocusArea.label(names), repos, override));
    }

    /** One client per provider name in use; fails on missing credentials before any job is sent. */
    private Map<String, AuditProvider> createProviders(Plan plan) {
        Map<String, AuditProvider> clients = new LinkedHashMap<>();
        for (RepoConfig repo : plan.repos()) {
            String name = plan.providerFor(repo);
            clients.computeIfAbsent(name, n -> provider(n, config.modelFor(n)));
        }
        return clients;
    }

    private List<RepoConfig> repos(String repoFilter) {
        if (repoFilter == null || repoFilter.isBlank()) return config.repos();
        return config.repo(repoFilter).map(List::of)
                .orElseThrow(() -> new IllegalArgumentException("Unknown repo: " + repoFilter));
    }

    private static List<String> csv(String raw) {
        if (raw == null) return List.of();
        return Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    private AuditProvider provider(String name, String model) {
        AuditProvider provider = providers.create(name, model);
        if (provider instanceof SynchronousAuditProvider sync) {
            sync.persistTo(state.syncResultsDir());
        }
        return provider;
    }

    private List<FileContent> gather(Plan plan, RepoConfig repo) throws IOException {
        log.info("[{}] Gathering files for {} audit...", repo.name(), plan.label());
        List<FileContent> files = selector.select(Path.of(repo.path()), FocusArea.unionPatterns(plan.areas()), repo.exclude());
        log.info("[{}] Found {} files ({} focus area(s))", repo.name(), files.size(), plan.focusNames().size());
        return files;
    }

    /**
     * @param runPrepass when false, only report whether the pre-pass would run
     * @return null when the repository has nothing to audit
     */
    private PreparedAudit prepare(Plan plan, RepoConfig repo, boolean runPrepass)
            throws IOException, InterruptedException {
        List<FileContent> files = gather(plan, repo);
        if (files.isEmpty()) {
            log.info("[{}] No files to audit, skipping", repo.name());
            return null;
        }

        String provider = plan.providerFor(repo);
        boolean triage = PrepassPolicy.shouldRun(repo.name(), files, config.prepass(),
                PricingTable.forModel(provider, config.modelFor(provider)));
        if (triage && runPrepass) {
            AuditProvider cheap = provider(config.prepass().provider(), config.prepass().model());
            files = new PrepassClassifier(cheap).classify(files, plan.focusNames(), repo.name()).files();
            if (files.isEmpty()) {
                log.info("[{}] Pre-pass retained no files, skipping", repo.name());
                return null;
            }
        } else if (triage) {
            log.info("[{}] Pre-pass would classify {} files with {}", repo.name(), files.size(), config.prepass().provider());
        }

        List<Decision> decisions = memory.load();
        return new PreparedAudit(repo, provider, files, FocusArea.combinedPrompt(plan.areas()),
                DecisionMemory.formatContext(decisions), decisions.size());
    }

    private static AuditRequest request(Plan plan, PreparedAudit prepared, String jobLabel) {
        return new AuditRequest(prepared.files(), prepared.systemPrompt(), prepared.decisionContext(),
                jobLabel, plan.focusNames().size());
    }

    private AuditResult complete(RepoConfig repo, String providerName, String model, String label,
                                 AuditProvider.PollResult poll, int fileCount, List<Decision> decisions)
            throws IOException {
        if (poll.status() == AuditProvider.BatchStatus.ERRORED) {
            log.warn("[{}] Job {} ended with errors; no findings", repo.name(), poll.jobId());
        }
        List<Finding> findings = poll.findings();
        log.info("[{}] Got {} findings", repo.name(), findings.size());

        FilterResult filtered = memory.filter(findings, decisions, Path.of(repo.path()),
                config.decisions().expiryDays());
        AuditResult result = new AuditResult(repo.name(), label, providerName, findings,
                filtered.newFindings(), filtered.resolvedCount(), LocalDateTime.now(clock).toString());

        state.writeFindings(result);
        Path report = reports.save(result);
        log.info("[{}] Report saved to {}", repo.name(), report);

        // appended last: a job is counted once its snapshot and report exist
        if (fileCount > 0) {
            ledger.append(repo.name(), label, providerName, model, poll.usage(), fileCount);
        }
        return result;
    }
}
