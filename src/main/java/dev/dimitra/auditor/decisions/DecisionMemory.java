package dev.dimitra.auditor.decisions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.dimitra.auditor.model.Decision;
import dev.dimitra.auditor.model.DecisionType;
import dev.dimitra.auditor.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Append-only JSONL store of judgments on findings.
 *
 * <p>The effective decision for a finding id is the record with the greatest ISO date. A valid
 * effective decision suppresses the finding until it expires or the file's content hash no
 * longer matches the recorded one.
 */
public class DecisionMemory {

    private static final Logger log = LoggerFactory.getLogger(DecisionMemory.class);

    private static final String[] REQUIRED = {"finding_id", "decision", "reason", "date", "by"};

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public DecisionMemory(Path path) {
        this(path, Clock.systemDefaultZone());
    }

    public DecisionMemory(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    /**
     * @throws CorruptDecisionStoreException on the first line that is not a complete decision
     */
    public List<Decision> load() throws IOException {
        if (!Files.exists(path)) return List.of();
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        List<Decision> decisions = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;
            decisions.add(parseLine(line, i + 1));
        }
        return decisions;
    }

    private Decision parseLine(String line, int lineNumber) throws CorruptDecisionStoreException {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new CorruptDecisionStoreException(path, lineNumber, "not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new CorruptDecisionStoreException(path, lineNumber, "not a JSON object", null);
        }
        for (String field : REQUIRED) {
            if (!node.hasNonNull(field)) {
                throw new CorruptDecisionStoreException(path, lineNumber, "missing \"" + field + "\"", null);
            }
        }
        try {
            DecisionType.from(node.get("decision").asText());
            LocalDate.parse(node.get("date").asText());
            return mapper.treeToValue(node, Decision.class);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new CorruptDecisionStoreException(path, lineNumber, e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new CorruptDecisionStoreException(path, lineNumber, e.getOriginalMessage(), e);
        }
    }

    public void save(Decision decision) throws IOException {
        saveAll(List.of(decision));
    }

    public void saveAll(List<Decision> decisions) throws IOException {
        if (decisions.isEmpty()) return;
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (Decision d : decisions) {
                w.write(mapper.writeValueAsString(d));
                w.write("\n");
            }
        }
    }

    /** Latest decision per finding id; greater ISO date wins, earlier record wins a tie. */
    public static Map<String, Decision> latestById(List<Decision> decisions) {
        Map<String, Decision> latest = new HashMap<>();
        for (Decision d : decisions) {
            Decision current = latest.get(d.findingId());
            if (current == null || d.date().compareTo(current.date()) > 0) {
                latest.put(d.findingId(), d);
            }
        }
        return latest;
    }

    public FilterResult filter(List<Finding> findings, List<Decision> decisions, Path repoRoot, int expiryDays) {
        Map<String, Decision> latest = latestById(decisions);
        LocalDate today = LocalDate.now(clock);

        List<Finding> fresh = new ArrayList<>();
        int resolved = 0;
        for (Finding finding : findings) {
            Decision decision = latest.get(finding.id());
            if (decision == null) {
                fresh.add(finding);
                continue;
            }
            if (ChronoUnit.DAYS.between(LocalDate.parse(decision.date()), today) > expiryDays) {
                log.debug("Decision on {} expired ({}), resurfacing", finding.id(), decision.date());
                fresh.add(finding);
                continue;
            }
            if (decision.fileHash() != null && finding.file() != null) {
                String current = hashFile(repoRoot.resolve(finding.file()));
                if (!decision.fileHash().equals(current)) {
                    log.debug("{} changed since decision on {}, resurfacing", finding.file(), finding.id());
                    fresh.add(finding);
                    continue;
                }
            }
            resolved++;
        }
        return new FilterResult(fresh, resolved);
    }

    /** Prompt block listing reviewed findings; empty string for no decisions. */
    public static String formatContext(List<Decision> decisions) {
        if (decisions.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        sb.append("## Previously Reviewed Findings\n\n");
        sb.append("The following findings have already been reviewed. Do NOT report these again\n");
        sb.append("unless the code has materially changed in a way that invalidates the decision.\n\n");
        for (int i = 0; i < decisions.size(); i++) {
            Decision d = decisions.get(i);
            if (i > 0) sb.append("\n");
            sb.append("- [").append(d.decision().value().toUpperCase(Locale.ROOT)).append("] finding_id=")
              .append(d.findingId()).append(": ").append(d.reason());
        }
        return sb.toString();
    }

    /** One dismissed decision per finding, not yet persisted. */
    public List<Decision> createBaseline(List<Finding> findings, Path repoRoot, String repoName) {
        String today = LocalDate.now(clock).toString();
        List<Decision> out = new ArrayList<>();
        for (Finding f : findings) {
            out.add(new Decision(f.id(), DecisionType.DISMISSED, Decision.BASELINE_REASON, today,
                    Decision.BASELINE_REASON, f.file(), f.file() == null ? null : hashFile(repoRoot.resolve(f.file())),
                    f.focus(), f.severity() == null ? null : f.severity().value(), repoName));
        }
        return out;
    }

    /**
     * Rewrites the store without the baseline records the filter matches. Every other line is
     * kept exactly as it was.
     *
     * @return number of records removed
     */
    public int removeBaseline(BaselineFilter filter) throws IOException {
        if (!Files.exists(path)) return 0;
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        StringBuilder kept = new StringBuilder();
        int removed = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!line.isBlank() && filter.matches(parseLine(line, i + 1))) {
                removed++;
                continue;
            }
            kept.append(line).append("\n");
        }
        if (removed == 0) return 0;

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, kept, StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("Removed {} baseline decision(s) from {}", removed, path);
        return removed;
    }

    public List<Decision> listBaseline() throws IOException {
        return load().stream().filter(Decision::isBaseline).toList();
    }

    /**
     * Records an explicit judgment. When the finding is known its file is hashed so that a
     * later change resurfaces it.
     */
    public Decision record(String findingId, DecisionType kind, String reason, String by,
                           Finding finding, Path repoRoot) throws IOException {
        String file = finding == null ? null : finding.file();
        String hash = file != null && repoRoot != null ? hashFile(repoRoot.resolve(file)) : null;
        Decision d = new Decision(findingId, kind, reason == null ? "" : reason,
                LocalDate.now(clock).toString(), by == null || by.isBlank() ? "user" : by,
                file, hash,
                finding == null ? null : finding.focus(),
                finding == null || finding.severity() == null ? null : finding.severity().value(),
                null);
        save(d);
        return d;
    }

    /** First 16 hex chars of the SHA-256 of the file's bytes, or null if it cannot be read. */
    public static String hashFile(Path file) {
        if (!Files.isRegularFile(file)) return null;
        try {
            return Finding.sha256Hex(Files.readAllBytes(file)).substring(0, 16);
        } catch (IOException e) {
            log.warn("Cannot hash {}: {}", file, e.getMessage());
            return null;
        }
    }
}
