// file: engine/src/test/java/io/scoreledger/engine/ScoringRunTest.java
package io.scoreledger.engine;

import io.scoreledger.core.AbortReason;
import io.scoreledger.core.digest.IntegrityStamper;
import io.scoreledger.core.ledger.Entity;
import io.scoreledger.core.ledger.Ledger;
import io.scoreledger.core.resolve.AliasTable;
import io.scoreledger.core.resolve.EntityResolver;
import io.scoreledger.core.score.BoardSpec;
import io.scoreledger.core.score.CategorySpec;
import io.scoreledger.core.score.QualificationMode;
import io.scoreledger.core.score.SourceResult;
import io.scoreledger.storage.JsonLedgerStore;
import io.scoreledger.storage.LedgerStore;
import io.scoreledger.storage.StatusFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScoringRunTest {

    private static final LocalDate D1 = LocalDate.of(2025, 3, 1);
    private static final LocalDate D2 = LocalDate.of(2025, 3, 2);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T06:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tmp;

    private final List<RunSummary> sent = new ArrayList<>();
    private final List<Path> published = new ArrayList<>();

    private Path ledgerFile() {
        return tmp.resolve("main.json");
    }

    private JsonLedgerStore store() {
        return new JsonLedgerStore(ledgerFile());
    }

    private static BoardSpec speedAndCost(int qualificationMin) {
        return new BoardSpec("main", List.of(
                CategorySpec.single("speed", 0.5, "speed", false),
                CategorySpec.single("cost", 0.5, "cost", true)
        ), qualificationMin, QualificationMode.CATEGORIES, null);
    }

    private ScoringRun run(int qualificationMin, StatusFile status) {
        return run(store(), qualificationMin, status);
    }

    private ScoringRun run(LedgerStore store, int qualificationMin, StatusFile status) {
        var board = new EngineConfig.Board(speedAndCost(qualificationMin), ledgerFile(), 2);
        return new ScoringRun(
                board,
                store,
                new EntityResolver(AliasTable.empty()),
                Map.of("Gamma Pro", "Gammaco"),
                5,
                sent::add,
                (file, summary) -> published.add(file),
                status,
                CLOCK
        );
    }

    private ScoringRun run() {
        return run(1, null);
    }

    private void seed(String... names) {
        var l = Ledger.empty();
        for (String n : names) l.addEntity(Entity.discovered(n, null, 0));
        IntegrityStamper.stamp(l);
        store().write(l);
    }

    private static Map<String, Double> values(Object... kv) {
        var m = new LinkedHashMap<String, Double>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], ((Number) kv[i + 1]).doubleValue());
        return m;
    }

    private static Map<String, SourceResult> measurements(Map<String, Double> speed, Map<String, Double> cost) {
        var m = new LinkedHashMap<String, SourceResult>();
        m.put("speed", SourceResult.of(speed));
        m.put("cost", SourceResult.of(cost));
        return m;
    }

    private static Map<String, SourceResult> example() {
        return measurements(values("alpha-v2", 80, "Beta", 40), values("Alpha", 2.0, "Beta", 1.0));
    }

    private Ledger reload() {
        return store().load().orElseThrow();
    }

    @Test
    void tied_composites_rank_in_ledger_order() {
        seed("Alpha", "Beta");

        RunOutcome outcome = run().execute(example(), D1, false);

        assertEquals(RunState.PERSISTED, outcome.state());
        assertTrue(outcome.succeeded());
        Ledger l = reload();
        assertEquals(List.of("2025-03-01"), l.dateAxis());
        var alpha = l.find("Alpha").orElseThrow();
        var beta = l.find("Beta").orElseThrow();
        assertEquals(75.0, alpha.history().get(0).getAsDouble(), 0.0);
        assertEquals(75.0, beta.history().get(0).getAsDouble(), 0.0);
        assertEquals(1, alpha.rank());
        assertEquals(2, beta.rank());
        assertDoesNotThrow(() -> IntegrityStamper.verify(l));

        var summary = outcome.summary();
        assertEquals(List.of("Alpha", "Beta"), summary.top().stream().map(RunSummary.Standing::name).toList());
        assertEquals(2, summary.qualified());
        assertEquals(Map.of("speed", 2, "cost", 2), summary.coverage());
        assertEquals(List.of(summary), sent);
        assertEquals(List.of(ledgerFile()), published);
    }

    @Test
    void same_day_rerun_replaces_slot() {
        seed("Alpha", "Beta");
        run().execute(example(), D1, false);

        var second = measurements(values("Alpha", 80, "Beta", 40), values("Alpha", 2.0, "Beta", 4.0));
        RunOutcome outcome = run().execute(second, D1, false);

        assertEquals(RunState.PERSISTED, outcome.state());
        Ledger l = reload();
        assertEquals(1, l.slotCount());
        assertEquals(List.of(100.0), l.find("Alpha").orElseThrow().history().slots());
        assertEquals(List.of(50.0), l.find("Beta").orElseThrow().history().slots());
        assertEquals(1, l.find("Alpha").orElseThrow().rank());
    }

    @Test
    void next_day_appends_slot_to_every_history() {
        seed("Alpha", "Beta");
        run().execute(example(), D1, false);
        run().execute(measurements(values("Alpha", 80), values("Alpha", 2.0)), D2, false);

        Ledger l = reload();
        assertEquals(List.of("2025-03-01", "2025-03-02"), l.dateAxis());
        for (Entity e : l.entities()) assertEquals(2, e.history().size(), e.name());
        assertTrue(l.find("Beta").orElseThrow().history().get(1).isEmpty());
        assertEquals(Entity.UNRANKED, l.find("Beta").orElseThrow().rank());
    }

    @Test
    void new_name_in_two_sources_is_discovered_with_group() {
        seed("Alpha", "Beta");
        var m = measurements(
                values("Alpha", 80, "Beta", 40, "Gamma Pro", 60),
                values("Alpha", 2.0, "Beta", 1.0, "gamma-pro", 1.5));

        RunOutcome outcome = run().execute(m, D1, false);

        assertEquals(List.of("Gamma Pro"), outcome.summary().discovered());
        Ledger l = reload();
        assertEquals(List.of("Alpha", "Beta", "Gamma Pro"), l.roster());
        var gamma = l.find("Gamma Pro").orElseThrow();
        assertEquals("Gammaco", gamma.group().orElseThrow());
        // speed 60/80 = 75, cost 1.0/1.5 = 66.67, mean 70.83
        assertEquals(70.83, gamma.history().get(0).getAsDouble(), 0.0);
        assertEquals(3, gamma.rank());
    }

    @Test
    void no_qualified_entity_aborts_and_leaves_ledger_untouched() throws Exception {
        seed("Alpha", "Beta");
        byte[] before = Files.readAllBytes(ledgerFile());

        RunOutcome outcome = run(2, null).execute(
                measurements(values("Alpha", 80, "Beta", 40), Map.of()), D1, false);

        assertEquals(RunState.ABORTED, outcome.state());
        assertEquals(AbortReason.NO_QUALIFIED_ENTITIES, outcome.reason());
        assertArrayEquals(before, Files.readAllBytes(ledgerFile()));
        assertTrue(published.isEmpty());
        assertEquals(RunState.ABORTED, sent.get(0).state());
        assertTrue(sent.get(0).text().contains("NO_QUALIFIED_ENTITIES"));
    }

    @Test
    void dry_run_reports_without_writing() throws Exception {
        seed("Alpha", "Beta");
        byte[] before = Files.readAllBytes(ledgerFile());

        RunOutcome outcome = run().execute(example(), D1, true);

        assertEquals(RunState.REPORTED, outcome.state());
        assertEquals(2, outcome.summary().top().size());
        assertArrayEquals(before, Files.readAllBytes(ledgerFile()));
        assertTrue(published.isEmpty());
    }

    @Test
    void tampered_ledger_aborts_as_corrupt() throws Exception {
        seed("Alpha", "Beta");
        run().execute(example(), D1, false);
        Files.writeString(ledgerFile(), Files.readString(ledgerFile()).replace("75.0", "99.0"));

        RunOutcome outcome = run().execute(example(), D2, false);

        assertEquals(AbortReason.LEDGER_CORRUPT, outcome.reason());
        assertEquals(1, store().load().orElseThrow().slotCount());
    }

    @Test
    void ledger_failing_write_check_aborts_and_keeps_previous_file() throws Exception {
        seed("Alpha", "Beta");
        run().execute(example(), D1, false);
        byte[] before = Files.readAllBytes(ledgerFile());

        // a store that garbles one score between stamping and serialization
        JsonLedgerStore json = store();
        LedgerStore garbling = new LedgerStore() {
            @Override public Optional<Ledger> load() { return json.load(); }
            @Override public void write(Ledger ledger) {
                ledger.entities().get(0).history().set(0, 1.0);
                json.write(ledger);
            }
            @Override public Path location() { return json.location(); }
        };

        RunOutcome outcome = run(garbling, 1, null).execute(example(), D2, false);

        assertEquals(RunState.ABORTED, outcome.state());
        assertEquals(AbortReason.PERSIST_FAILURE, outcome.reason());
        assertArrayEquals(before, Files.readAllBytes(ledgerFile()));
        assertEquals(1, published.size(), "only the first run publishes");
    }

    @Test
    void earlier_date_aborts_without_touching_axis() {
        seed("Alpha", "Beta");
        run().execute(example(), D2, false);

        RunOutcome outcome = run().execute(example(), D1, false);

        assertEquals(AbortReason.DATE_OUT_OF_ORDER, outcome.reason());
        assertEquals(List.of("2025-03-02"), reload().dateAxis());
    }

    @Test
    void empty_start_discovers_entities_seen_everywhere() {
        RunOutcome outcome = run().execute(
                measurements(values("Alpha", 80, "Beta", 40), values("Alpha", 2.0, "Beta", 1.0)), D1, false);

        assertEquals(RunState.PERSISTED, outcome.state());
        assertEquals(List.of("Alpha", "Beta"), reload().roster());
    }

    @Test
    void source_with_no_usable_values_is_not_counted_as_hit() {
        seed("Alpha", "Beta");

        RunOutcome outcome = run().execute(
                measurements(values("Alpha", 80, "Beta", 40), values("Alpha", 0, "Beta", -1)), D1, false);

        assertEquals(RunState.PERSISTED, outcome.state());
        assertEquals(1, outcome.summary().sourcesHit());
        assertEquals(2, outcome.summary().sourcesTotal());
        assertTrue(outcome.summary().text().contains("sources 1/2"), outcome.summary().text());
    }

    @Test
    void status_file_records_the_run() {
        seed("Alpha", "Beta");
        var status = new StatusFile(tmp.resolve("status.json"), CLOCK);

        run(1, status).execute(example(), D1, false);

        var entry = status.board("main").orElseThrow();
        assertEquals("PERSISTED", entry.state);
        assertEquals("persist", entry.mode);
        assertEquals("Alpha", entry.topEntity);
        assertEquals(75.0, entry.topScore);
        assertEquals(2, entry.sourcesHit);
        assertNull(entry.error);
    }

    @Test
    void a_run_executes_once() {
        seed("Alpha", "Beta");
        var r = run();
        r.execute(example(), D1, true);
        assertThrows(IllegalStateException.class, () -> r.execute(example(), D1, true));
    }
}
