package dev.dimitra.auditor.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.dimitra.auditor.llm.AuditProvider.Usage;
import dev.dimitra.auditor.pricing.ModelPricing;
import dev.dimitra.auditor.pricing.PricingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Append-only JSONL log of per-audit token usage. Advisory only: malformed lines are
 * skipped on read rather than failing the caller.
 */
public class CostLedger {

    private static final Logger log = LoggerFactory.getLogger(CostLedger.class);
    private static final Set<String> BATCH_PROVIDERS = Set.of("anthropic", "openai");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path path;
    private final Clock clock;

    public CostLedger(Path path) {
        this(path, Clock.systemDefaultZone());
    }

    public CostLedger(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    public LedgerEntry append(String repo, String focus, String provider, String model,
                              Usage usage, int fileCount) throws IOException {
        ModelPricing pricing = PricingTable.forModel(provider, model);
        double cost = 0.0;
        if (pricing != null) {
            boolean useBatch = BATCH_PROVIDERS.contains(provider.toLowerCase(Locale.ROOT));
            cost = pricing.cost(usage.inputTokens(), usage.outputTokens(),
                    usage.cacheReadTokens(), usage.cacheWriteTokens(), useBatch);
        }

        LedgerEntry entry = new LedgerEntry(
                LocalDateTime.now(clock).toString(),
                repo, focus, provider, model,
                usage.inputTokens(), usage.outputTokens(),
                usage.cacheReadTokens(), usage.cacheWriteTokens(),
                fileCount,
                Math.round(cost * 10_000.0) / 10_000.0);
        append(entry);
        return entry;
    }

    public void append(LedgerEntry entry) throws IOException {
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        Files.writeString(path, mapper.writeValueAsString(entry) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public List<LedgerEntry> readEntries() throws IOException {
        if (!Files.exists(path)) return List.of();
        List<LedgerEntry> entries = new ArrayList<>();
        int lineNo = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            lineNo++;
            if (line.isBlank()) continue;
            try {
                entries.add(mapper.readValue(line, LedgerEntry.class));
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed ledger line {} in {}: {}", lineNo, path, e.getOriginalMessage());
            }
        }
        return entries;
    }

    public List<LedgerEntry> lastN(int n) throws IOException {
        if (n <= 0) return List.of();
        List<LedgerEntry> all = readEntries();
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    public List<LedgerEntry> lastNDays(int days) throws IOException {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(days);
        List<LedgerEntry> result = new ArrayList<>();
        for (LedgerEntry e : readEntries()) {
            LocalDateTime ts = parse(e.timestamp());
            if (ts != null && !ts.isBefore(cutoff)) result.add(e);
        }
        return result;
    }

    /**
     * Projects monthly spend from the days the window actually covers, not the window size.
     */
    public CostSummary summarize(int days) throws IOException {
        List<LedgerEntry> entries = lastNDays(days);
        if (entries.isEmpty()) {
            return new CostSummary(days, 0, 0, 0, 0, 0, 0.0, 0.0, 0.0, List.of());
        }
        long in = 0, out = 0, cacheRead = 0, cacheWrite = 0;
        double total = 0.0;
        LocalDateTime first = null, last = null;
        for (LedgerEntry e : entries) {
            in += e.inputTokens();
            out += e.outputTokens();
            cacheRead += e.cacheReadTokens();
            cacheWrite += e.cacheWriteTokens();
            total += e.costEstimateUsd();
            LocalDateTime ts = parse(e.timestamp());
            if (first == null || ts.isBefore(first)) first = ts;
            if (last == null || ts.isAfter(last)) last = ts;
        }
        long span = Math.max(1, ChronoUnit.DAYS.between(first.toLocalDate(), last.toLocalDate()));
        double projected = total / span * 30;
        List<LedgerEntry> recent = entries.subList(Math.max(0, entries.size() - 5), entries.size());
        return new CostSummary(days, entries.size(), in, out, cacheRead, cacheWrite,
                total, total / entries.size(), projected, recent);
    }

    private static LocalDateTime parse(String timestamp) {
        if (timestamp == null) return null;
        try {
            return LocalDateTime.parse(timestamp);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring ledger entry with bad timestamp {}", timestamp);
            return null;
        }
    }
}
