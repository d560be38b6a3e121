package dev.dimitra.auditor.decisions;

import dev.dimitra.auditor.model.Decision;
import dev.dimitra.auditor.model.DecisionType;
import dev.dimitra.auditor.model.Finding;
import dev.dimitra.auditor.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionMemoryTest {

    private static final Clock TODAY = Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tmp;

    private Path repo;
    private DecisionMemory memory;

    @BeforeEach
    void setUp() throws Exception {
        repo = Files.createDirectories(tmp.resolve("repo"));
        memory = new DecisionMemory(tmp.resolve("state/decisions.jsonl"), TODAY);
    }

    private static Finding finding(String file, String title) {
        return Finding.of(Severity.MEDIUM, file, 1, title, "d", null, "security");
    }

    private static Decision decision(String id, DecisionType type, String date, String hash) {
        return new Decision(id, type, "reviewed", date, "alice", null, hash, null, null, null);
    }

    @Test
    @DisplayName("five findings, three covered by valid decisions: two new, three resolved")
    void filterScenario() {
        List<Finding> findings = List.of(finding("a.py", "1"), finding("a.py", "2"), finding("a.py", "3"),
                finding("a.py", "4"), finding("a.py", "5"));
        List<Decision> decisions = List.of(
                decision(findings.get(0).id(), DecisionType.ACCEPTED, "2026-03-01", null),
                decision(findings.get(1).id(), DecisionType.DISMISSED, "2026-03-01", null),
                decision(findings.get(2).id(), DecisionType.INTENTIONAL, "2026-03-01", null));

        FilterResult result = memory.filter(findings, decisions, repo, 90);

        assertThat(result.resolvedCount()).isEqualTo(3);
        assertThat(result.newFindings()).containsExactly(findings.get(3), findings.get(4));
    }

    @Test
    @DisplayName("the latest-dated decision wins whatever the record order")
    void latestDateWins() {
        Finding f = finding("a.py", "x");
        Decision old = decision(f.id(), DecisionType.DISMISSED, "2025-01-01", null);
        Decision recent = decision(f.id(), DecisionType.ACCEPTED, "2026-03-10", null);

        assertThat(DecisionMemory.latestById(List.of(recent, old)).get(f.id())).isEqualTo(recent);
        assertThat(DecisionMemory.latestById(List.of(old, recent)).get(f.id())).isEqualTo(recent);
        // the old one alone is expired, the recent one keeps it resolved
        assertThat(memory.filter(List.of(f), List.of(recent, old), repo, 90).resolvedCount()).isEqualTo(1);
    }

    @Test
    void expiredDecisionResurfaces() {
        Finding f = finding("a.py", "x");

        assertThat(memory.filter(List.of(f), List.of(decision(f.id(), DecisionType.DISMISSED, "2025-12-14", null)), repo, 90)
                .newFindings()).containsExactly(f);
        assertThat(memory.filter(List.of(f), List.of(decision(f.id(), DecisionType.DISMISSED, "2025-12-15", null)), repo, 90)
                .resolvedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("changing a baselined file brings its finding back")
    void fileChangeResurfacesBaseline() throws Exception {
        Files.writeString(repo.resolve("a.py"), "password = 'hunter2'");
        Finding f = finding("a.py", "Hardcoded password");
        memory.saveAll(memory.createBaseline(List.of(f), repo, "api"));

        assertThat(memory.filter(List.of(f), memory.load(), repo, 90).resolvedCount()).isEqualTo(1);

        Files.writeString(repo.resolve("a.py"), "password = os.environ['PW']");
        FilterResult after = memory.filter(List.of(f), memory.load(), repo, 90);

        assertThat(after.resolvedCount()).isZero();
        assertThat(after.newFindings()).containsExactly(f);
    }

    @Test
    void deletedFileResurfacesHashedDecision() throws Exception {
        Files.writeString(repo.resolve("a.py"), "x");
        Finding f = finding("a.py", "t");
        memory.saveAll(memory.createBaseline(List.of(f), repo, "api"));
        Files.delete(repo.resolve("a.py"));

        assertThat(memory.filter(List.of(f), memory.load(), repo, 90).newFindings()).containsExactly(f);
    }

    @Test
    void decisionWithoutHashDoesNotForceResurfacing() {
        Finding f = finding("missing.py", "t");

        assertThat(memory.filter(List.of(f), List.of(decision(f.id(), DecisionType.ACCEPTED, "2026-03-01", null)), repo, 90)
                .resolvedCount()).isEqualTo(1);
    }

    @Test
    void baselineRecordsCaptureContext() throws Exception {
        Files.writeString(repo.resolve("a.py"), "x");
        Finding f = finding("a.py", "t");

        Decision d = memory.createBaseline(List.of(f), repo, "api").get(0);

        assertThat(d.decision()).isEqualTo(DecisionType.DISMISSED);
        assertThat(d.reason()).isEqualTo("baseline");
        assertThat(d.by()).isEqualTo("baseline");
        assertThat(d.date()).isEqualTo("2026-03-15");
        assertThat(d.fileHash()).isEqualTo(Finding.sha256Hex("x".getBytes(StandardCharsets.UTF_8)).substring(0, 16));
        assertThat(d.focus()).isEqualTo("security");
        assertThat(d.severity()).isEqualTo("medium");
        assertThat(d.repo()).isEqualTo("api");
    }

    @Test
    @DisplayName("removeBaseline drops only matching baseline records and keeps other lines verbatim")
    void removeBaselineWithFilter() throws Exception {
        Path store = memory.path();
        Files.createDirectories(store.getParent());
        String manual = "{\"finding_id\":\"m1\",\"decision\":\"accepted\",\"reason\":\"fixed\",\"date\":\"2026-03-01\",\"by\":\"bob\",  \"extra\":1}";
        String secApi = "{\"finding_id\":\"b1\",\"decision\":\"dismissed\",\"reason\":\"baseline\",\"date\":\"2026-03-01\",\"by\":\"baseline\",\"focus\":\"security\",\"severity\":\"high\",\"repo\":\"api\"}";
        String secWeb = "{\"finding_id\":\"b2\",\"decision\":\"dismissed\",\"reason\":\"baseline\",\"date\":\"2026-03-01\",\"by\":\"baseline\",\"focus\":\"security\",\"severity\":\"high\",\"repo\":\"web\"}";
        String docsApi = "{\"finding_id\":\"b3\",\"decision\":\"dismissed\",\"reason\":\"baseline\",\"date\":\"2026-03-01\",\"by\":\"baseline\",\"focus\":\"docs\",\"severity\":\"low\",\"repo\":\"api\"}";
        Files.writeString(store, String.join("\n", manual, secApi, secWeb, docsApi) + "\n");

        int removed = memory.removeBaseline(new BaselineFilter("security", null, "api"));

        assertThat(removed).isEqualTo(1);
        assertThat(Files.readAllLines(store)).containsExactly(manual, secWeb, docsApi);
        assertThat(memory.listBaseline()).extracting(Decision::findingId).containsExactly("b2", "b3");

        assertThat(memory.removeBaseline(BaselineFilter.ALL)).isEqualTo(2);
        assertThat(Files.readAllLines(store)).containsExactly(manual);
    }

    @Test
    void removeBaselineOnMissingStore() throws Exception {
        assertThat(memory.removeBaseline(BaselineFilter.ALL)).isZero();
    }

    @Test
    @DisplayName("a corrupt line makes the whole load fail")
    void corruptStoreIsFatal() throws Exception {
        Files.createDirectories(memory.path().getParent());
        Files.writeString(memory.path(),
                "{\"finding_id\":\"a\",\"decision\":\"accepted\",\"reason\":\"r\",\"date\":\"2026-03-01\",\"by\":\"x\"}\n"
                        + "{\"finding_id\":\"b\",\"decision\":\"ignored\",\"reason\":\"r\",\"date\":\"2026-03-01\",\"by\":\"x\"}\n");

        assertThatThrownBy(memory::load)
                .isInstanceOf(CorruptDecisionStoreException.class)
                .hasMessageContaining(":2:");
    }

    @Test
    void missingRequiredFieldIsCorrupt() throws Exception {
        Files.createDirectories(memory.path().getParent());
        Files.writeString(memory.path(), "{\"finding_id\":\"a\",\"decision\":\"accepted\",\"date\":\"2026-03-01\",\"by\":\"x\"}\n");

        assertThatThrownBy(memory::load)
                .isInstanceOf(CorruptDecisionStoreException.class)
                .hasMessageContaining("reason");
    }

    @Test
    void unparseableDateIsCorrupt() throws Exception {
        Files.createDirectories(memory.path().getParent());
        Files.writeString(memory.path(), "{\"finding_id\":\"a\",\"decision\":\"accepted\",\"reason\":\"r\",\"date\":\"yesterday\",\"by\":\"x\"}\n");

        assertThatThrownBy(memory::load).isInstanceOf(CorruptDecisionStoreException.class);
    }

    @Test
    void saveAndLoadRoundTripWithBlankLines() throws Exception {
        Decision d = decision("abc", DecisionType.INTENTIONAL, "2026-03-01", "0123456789abcdef");
        memory.save(d);
        Files.writeString(memory.path(), "\n", java.nio.file.StandardOpenOption.APPEND);

        assertThat(memory.load()).containsExactly(d);
        assertThat(Files.readString(memory.path())).doesNotContain("\"file\"").doesNotContain("baseline");
    }

    @Test
    void recordHashesKnownFile() throws Exception {
        Files.writeString(repo.resolve("a.py"), "x");
        Finding f = finding("a.py", "t");

        Decision d = memory.record(f.id(), DecisionType.ACCEPTED, "fixed in #12", "carol", f, repo);

        assertThat(d.fileHash()).isNotNull();
        assertThat(memory.load()).containsExactly(d);
        assertThat(memory.filter(List.of(f), memory.load(), repo, 90).resolvedCount()).isEqualTo(1);
    }

    @Test
    void contextBlock() {
        assertThat(DecisionMemory.formatContext(List.of())).isEmpty();

        String ctx = DecisionMemory.formatContext(List.of(decision("abc", DecisionType.DISMISSED, "2026-03-01", null)));

        assertThat(ctx).startsWith("## Previously Reviewed Findings")
                .contains("Do NOT report these again")
                .endsWith("- [DISMISSED] finding_id=abc: reviewed");
    }
}
