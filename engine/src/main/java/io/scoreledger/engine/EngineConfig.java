// file: engine/src/main/java/io/scoreledger/engine/EngineConfig.java
package io.scoreledger.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scoreledger.core.resolve.AliasTable;
import io.scoreledger.core.score.BoardSpec;
import io.scoreledger.core.score.CategorySpec;
import io.scoreledger.core.score.CoverageDampener;
import io.scoreledger.core.score.QualificationMode;
import io.scoreledger.core.score.SourceSpec;
import io.scoreledger.engine.dto.JsonAliasFile;
import io.scoreledger.engine.dto.JsonBoard;
import io.scoreledger.engine.dto.JsonCategory;
import io.scoreledger.engine.dto.JsonEngineConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Deployment configuration loaded from JSON.
 * <p>
 * Example:
 * <pre>
 * {
 *   "statusFile": "status.json",
 *   "summaryTopN": 5,
 *   "aliases": {"alpha-v2-preview": "Alpha"},
 *   "groups":  {"Alpha": "Acme"},
 *   "boards": [{
 *     "id": "main",
 *     "ledger": "data/main.json",
 *     "qualificationMin": 2,
 *     "qualificationMode": "categories",
 *     "minDiscoverySources": 2,
 *     "dampenerBase": 0.7,
 *     "categories": [
 *       {"key": "speed", "weight": 0.5, "sources": [{"id": "speed"}]},
 *       {"key": "cost",  "weight": 0.5, "sources": [{"id": "cost", "lowerIsBetter": true}]}
 *     ]
 *   }]
 * }
 * </pre>
 * Relative paths resolve against the config file's directory. Without an
 * {@code aliasFile}/{@code groupFile} the tables bundled with the engine are used;
 * inline {@code aliases}/{@code groups} are layered on top.
 */
public final class EngineConfig {

    static final String DEFAULT_ALIASES = "/io/scoreledger/engine/aliases.json";
    static final String DEFAULT_GROUPS = "/io/scoreledger/engine/groups.json";
    static final int DEFAULT_TOP_N = 5;
    static final int DEFAULT_MIN_DISCOVERY_SOURCES = 2;

    /** One leaderboard and where its ledger lives. */
    public record Board(BoardSpec spec, Path ledger, int minDiscoverySources) {
        public Board {
            Objects.requireNonNull(spec, "spec");
            Objects.requireNonNull(ledger, "ledger");
            if (minDiscoverySources < 1) {
                throw new IllegalArgumentException("minDiscoverySources must be >= 1 for board " + spec.id());
            }
        }

        public String id() {
            return spec.id();
        }

        /** Every source id the board reads, in category order. */
        public Set<String> sourceIds() {
            var ids = new LinkedHashSet<String>();
            for (var c : spec.categories()) {
                for (var s : c.sources()) ids.add(s.id());
            }
            return ids;
        }
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AliasTable aliases;
    private final Map<String, String> groups;
    private final Path statusFile;   // optional
    private final int summaryTopN;
    private final List<Board> boards;

    public EngineConfig(AliasTable aliases, Map<String, String> groups, Path statusFile, int summaryTopN, List<Board> boards) {
        if (boards == null || boards.isEmpty()) throw new IllegalArgumentException("boards must not be empty");
        if (summaryTopN <= 0) throw new IllegalArgumentException("summaryTopN must be > 0");
        var ids = new HashSet<String>();
        for (Board b : boards) {
            if (!ids.add(b.id())) throw new IllegalArgumentException("duplicate board id: " + b.id());
        }

        this.aliases = Objects.requireNonNull(aliases, "aliases");
        this.groups = Map.copyOf(Objects.requireNonNull(groups, "groups"));
        this.statusFile = statusFile;
        this.summaryTopN = summaryTopN;
        this.boards = List.copyOf(boards);
    }

    public static EngineConfig fromJsonFile(Path path) {
        JsonEngineConfig cfg;
        try {
            cfg = MAPPER.readValue(path.toFile(), JsonEngineConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load EngineConfig from " + path, e);
        }
        if (cfg == null) throw new IllegalArgumentException("EngineConfig " + path + " is empty");

        Path base = path.toAbsolutePath().getParent();

        JsonAliasFile aliasDoc = cfg.aliasFile != null
                ? readTable(base.resolve(cfg.aliasFile))
                : readResource(DEFAULT_ALIASES);
        String fileVersion = aliasDoc.version != null ? aliasDoc.version : "unversioned";
        AliasTable aliases = new AliasTable(fileVersion, orEmpty(aliasDoc.aliases));

        boolean inline = cfg.aliases != null && !cfg.aliases.isEmpty();
        String version;
        if (cfg.aliasVersion != null && !cfg.aliasVersion.isBlank()) version = cfg.aliasVersion;
        else version = inline ? fileVersion + "+local" : fileVersion;
        if (inline || !version.equals(fileVersion)) {
            aliases = aliases.withAliases(version, orEmpty(cfg.aliases));
        }

        JsonAliasFile groupDoc = cfg.groupFile != null
                ? readTable(base.resolve(cfg.groupFile))
                : readResource(DEFAULT_GROUPS);
        var groups = new LinkedHashMap<>(orEmpty(groupDoc.groups));
        if (cfg.groups != null) groups.putAll(cfg.groups);

        if (cfg.boards == null) throw new IllegalArgumentException("EngineConfig " + path + " has no boards");
        var boards = new ArrayList<Board>(cfg.boards.size());
        for (JsonBoard b : cfg.boards) {
            boards.add(toBoard(b, base));
        }

        return new EngineConfig(
                aliases,
                groups,
                cfg.statusFile == null ? null : base.resolve(cfg.statusFile),
                cfg.summaryTopN == null ? DEFAULT_TOP_N : cfg.summaryTopN,
                boards
        );
    }

    private static Board toBoard(JsonBoard b, Path base) {
        if (b == null || b.id == null) throw new IllegalArgumentException("board without id");
        if (b.ledger == null || b.ledger.isBlank()) throw new IllegalArgumentException("board " + b.id + " has no ledger path");
        if (b.categories == null) throw new IllegalArgumentException("board " + b.id + " has no categories");

        var categories = new ArrayList<CategorySpec>(b.categories.size());
        for (JsonCategory c : b.categories) {
            if (c == null || c.sources == null) throw new IllegalArgumentException("board " + b.id + " has a category without sources");
            List<SourceSpec> sources = c.sources.stream()
                    .map(s -> new SourceSpec(s.id, s.lowerIsBetter))
                    .toList();
            categories.add(new CategorySpec(c.key, c.weight, sources));
        }

        QualificationMode mode = b.qualificationMode == null
                ? QualificationMode.CATEGORIES
                : QualificationMode.valueOf(b.qualificationMode.strip().toUpperCase(Locale.ROOT));
        CoverageDampener dampener = b.dampenerBase == null ? null : new CoverageDampener(b.dampenerBase);

        return new Board(
                new BoardSpec(b.id, categories, b.qualificationMin, mode, dampener),
                base.resolve(b.ledger),
                b.minDiscoverySources == null ? DEFAULT_MIN_DISCOVERY_SOURCES : b.minDiscoverySources
        );
    }

    private static JsonAliasFile readTable(Path file) {
        try {
            return MAPPER.readValue(file.toFile(), JsonAliasFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load table from " + file, e);
        }
    }

    private static JsonAliasFile readResource(String name) {
        try (InputStream in = EngineConfig.class.getResourceAsStream(name)) {
            if (in == null) throw new IllegalStateException("missing bundled resource " + name);
            return MAPPER.readValue(in, JsonAliasFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled resource " + name, e);
        }
    }

    private static Map<String, String> orEmpty(Map<String, String> m) {
        return m == null ? Map.of() : m;
    }

    public AliasTable aliases() {
        return aliases;
    }

    public Map<String, String> groups() {
        return groups;
    }

    public Optional<Path> statusFile() {
        return Optional.ofNullable(statusFile);
    }

    public int summaryTopN() {
        return summaryTopN;
    }

    public List<Board> boards() {
        return boards;
    }

    public Board board(String id) {
        return boards.stream()
                .filter(b -> b.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "unknown board %s, configured: %s".formatted(id, boards.stream().map(Board::id).toList())
                ));
    }
}
