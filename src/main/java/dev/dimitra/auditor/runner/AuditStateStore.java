package dev.dimitra.auditor.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.dimitra.auditor.model.AuditResult;
import dev.dimitra.auditor.model.Finding;
import dev.dimitra.auditor.model.PendingBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Files under the state directory that carry work between processes: the pending batch
 * record, the last-retrieved marker and per-repository findings snapshots.
 */
public class AuditStateStore {

    private static final Logger log = LoggerFactory.getLogger(AuditStateStore.class);

    static final String PENDING_FILE = "pending-batch.json";
    static final String MARKER_FILE = "last-retrieved.json";
    static final String LEDGER_FILE = "cost-ledger.jsonl";

    private final Path stateDir;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ObjectWriter pretty = mapper.writerWithDefaultPrettyPrinter();

    public AuditStateStore(Path stateDir, Clock clock) {
        this.stateDir = stateDir;
        this.clock = clock;
    }

    public Path pendingPath() {
        return stateDir.resolve(PENDING_FILE);
    }

    public Path markerPath() {
        return stateDir.resolve(MARKER_FILE);
    }

    public Path ledgerPath() {
        return stateDir.resolve(LEDGER_FILE);
    }

    /** Where synchronous providers keep answers between submit and retrieve. */
    public Path syncResultsDir() {
        return stateDir.resolve("sync-results");
    }

    public Path findingsPath(String repo) {
        return stateDir.resolve("findings").resolve(repo + ".json");
    }

    public Optional<PendingBatch> readPending() throws IOException {
        Path path = pendingPath();
        if (!Files.exists(path)) return Optional.empty();
        return Optional.of(mapper.readValue(path.toFile(), PendingBatch.class));
    }

    public void writePending(PendingBatch pending) throws IOException {
        write(pendingPath(), pretty.writeValueAsString(pending));
    }

    public void deletePending() throws IOException {
        Files.deleteIfExists(pendingPath());
    }

    /** True when the marker holds exactly the pending record's (non-empty) set of job ids. */
    public boolean alreadyRetrieved(PendingBatch pending) throws IOException {
        Path path = markerPath();
        List<String> pendingIds = pending.sortedBatchIds();
        if (pendingIds.isEmpty() || !Files.exists(path)) return false;

        JsonNode marker;
        try {
            marker = mapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable retrieval marker {}: {}", path, e.getOriginalMessage());
            return false;
        }
        List<String> retrieved = new ArrayList<>();
        for (JsonNode id : marker.path("batch_ids")) retrieved.add(id.asText());
        retrieved.sort(null);
        return pendingIds.equals(retrieved);
    }

    public void markRetrieved(PendingBatch pending) throws IOException {
        ObjectNode marker = mapper.createObjectNode();
        ArrayNode ids = marker.putArray("batch_ids");
        pending.batches().forEach(b -> ids.add(b.batchId()));
        marker.put("retrieved_at", LocalDateTime.now(clock).toString());
        write(markerPath(), pretty.writeValueAsString(marker));
    }

    /** Latest new findings for a repository, replaced on every retrieval. */
    public Path writeFindings(AuditResult result) throws IOException {
        ObjectNode snapshot = mapper.createObjectNode();
        snapshot.put("repo", result.repo());
        snapshot.put("focus", result.focus());
        snapshot.put("provider", result.provider());
        snapshot.put("timestamp", result.timestamp());
        snapshot.put("resolved_count", result.resolvedCount());
        snapshot.put("total_count", result.findings().size());
        snapshot.set("findings", mapper.valueToTree(result.newFindings()));
        Path path = findingsPath(result.repo());
        write(path, pretty.writeValueAsString(snapshot));
        return path;
    }

    /** New findings of the repository's latest snapshot; empty when none was written yet. */
    public List<Finding> readFindings(String repo) throws IOException {
        Path path = findingsPath(repo);
        if (!Files.exists(path)) return List.of();
        JsonNode snapshot = mapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        return mapper.convertValue(snapshot.path("findings"), new TypeReference<List<Finding>>() {});
    }

    private static void write(Path path, String content) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }
}
