// file: engine/src/test/java/io/scoreledger/engine/EngineConfigTest.java
package io.scoreledger.engine;

import io.scoreledger.core.score.QualificationMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies deployment configuration can be loaded from JSON.
 */
class EngineConfigTest {

    @TempDir
    Path tmp;

    private Path write(String json) throws Exception {
        Path p = tmp.resolve("scoreledger.json");
        Files.writeString(p, json);
        return p;
    }

    @Test
    void loads_two_boards_from_json() throws Exception {
        Path cfgPath = write("""
                {
                  "statusFile": "out/status.json",
                  "summaryTopN": 3,
                  "aliases": {"alpha-v2-preview": "Alpha"},
                  "groups": {"Alpha": "Acme"},
                  "boards": [
                    {
                      "id": "main",
                      "ledger": "data/main.json",
                      "qualificationMin": 2,
                      "dampenerBase": 0.7,
                      "categories": [
                        {"key": "speed", "weight": 0.5, "sources": [{"id": "speed"}]},
                        {"key": "cost", "weight": 0.5, "sources": [{"id": "cost", "lowerIsBetter": true}]}
                      ]
                    },
                    {
                      "id": "arena",
                      "ledger": "data/arena.json",
                      "qualificationMin": 2,
                      "qualificationMode": "sources",
                      "minDiscoverySources": 1,
                      "categories": [
                        {"key": "quality", "weight": 1.0, "sources": [{"id": "arena_a"}, {"id": "arena_b"}]}
                      ]
                    }
                  ]
                }
                """);

        EngineConfig cfg = EngineConfig.fromJsonFile(cfgPath);

        assertEquals(3, cfg.summaryTopN());
        assertEquals(Optional.of(tmp.resolve("out/status.json")), cfg.statusFile());
        assertEquals(List.of("main", "arena"), cfg.boards().stream().map(EngineConfig.Board::id).toList());

        var main = cfg.board("main");
        assertEquals(tmp.resolve("data/main.json"), main.ledger());
        assertEquals(2, main.minDiscoverySources());
        assertEquals(QualificationMode.CATEGORIES, main.spec().mode());
        assertEquals(0.7, main.spec().coverageDampener().orElseThrow().base());
        assertTrue(main.spec().categories().get(1).sources().get(0).lowerIsBetter());

        var arena = cfg.board("arena");
        assertEquals(QualificationMode.SOURCES, arena.spec().mode());
        assertEquals(List.of("arena_a", "arena_b"), List.copyOf(arena.sourceIds()));
        assertTrue(arena.spec().coverageDampener().isEmpty());

        assertThrows(IllegalArgumentException.class, () -> cfg.board("nope"));
    }

    @Test
    void bundled_tables_are_layered_under_inline_entries() throws Exception {
        EngineConfig cfg = EngineConfig.fromJsonFile(write("""
                {
                  "aliases": {"alpha-v2-preview": "Alpha"},
                  "groups": {"Alpha": "Acme"},
                  "boards": [{"id": "main", "ledger": "main.json", "qualificationMin": 1,
                              "categories": [{"key": "speed", "weight": 1.0, "sources": [{"id": "speed"}]}]}]
                }
                """));

        assertEquals(Optional.of("GPT-4o"), cfg.aliases().lookup("chatgpt-4o-latest"));
        assertEquals(Optional.of("Alpha"), cfg.aliases().lookup("Alpha-V2-Preview"));
        assertTrue(cfg.aliases().version().endsWith("+local"), cfg.aliases().version());
        assertEquals("OpenAI", cfg.groups().get("GPT-5"));
        assertEquals("Acme", cfg.groups().get("Alpha"));
        assertEquals(EngineConfig.DEFAULT_TOP_N, cfg.summaryTopN());
        assertTrue(cfg.statusFile().isEmpty());
    }

    @Test
    void alias_file_replaces_bundled_table() throws Exception {
        Files.writeString(tmp.resolve("aliases.json"), """
                {"version": "test-1", "aliases": {"b-raw": "Beta"}}
                """);
        EngineConfig cfg = EngineConfig.fromJsonFile(write("""
                {
                  "aliasFile": "aliases.json",
                  "boards": [{"id": "main", "ledger": "main.json", "qualificationMin": 1,
                              "categories": [{"key": "speed", "weight": 1.0, "sources": [{"id": "speed"}]}]}]
                }
                """));

        assertEquals("test-1", cfg.aliases().version());
        assertEquals(1, cfg.aliases().size());
        assertEquals(Optional.of("Beta"), cfg.aliases().lookup("B-RAW"));
    }

    @Test
    void invalid_configuration_is_rejected() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJsonFile(write("{}")));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJsonFile(write("""
                {"boards": [{"id": "main", "ledger": "m.json", "qualificationMin": 1, "qualificationMode": "votes",
                             "categories": [{"key": "speed", "weight": 1.0, "sources": [{"id": "speed"}]}]}]}
                """)));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJsonFile(write("""
                {"boards": [
                  {"id": "main", "ledger": "a.json", "qualificationMin": 1,
                   "categories": [{"key": "speed", "weight": 1.0, "sources": [{"id": "speed"}]}]},
                  {"id": "main", "ledger": "b.json", "qualificationMin": 1,
                   "categories": [{"key": "speed", "weight": 1.0, "sources": [{"id": "speed"}]}]}
                ]}
                """)));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJsonFile(tmp.resolve("missing.json")));
    }
}
