// file: core/src/main/java/io/scoreledger/core/ledger/Entity.java
package io.scoreledger.core.ledger;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One tracked subject on a ledger.
 * <p>
 * Persistent: name (primary key, never changes), group, rank, score history.
 * Per-run (overwritten each run, persisted only as diagnostics): category values,
 * qualifying count, source count and the qualified flag.
 */
public final class Entity {

    /** Rank of entities that are not on today's published ranking. */
    public static final int UNRANKED = 0;

    private final String name;
    private String group;            // optional
    private int rank = UNRANKED;
    private final ScoreHistory history;

    private Map<String, Double> categoryValues = Map.of();
    private int qualifyingCount;
    private int sourceCount;
    private boolean qualified;

    public Entity(String name, String group, int rank, ScoreHistory history) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("entity name must not be blank");
        if (rank < 0) throw new IllegalArgumentException("rank must be >= 0");
        this.name = name;
        this.group = group;
        this.rank = rank;
        this.history = Objects.requireNonNull(history, "history");
    }

    /** Newly discovered entity: no group unless known, unranked, all slots absent. */
    public static Entity discovered(String name, String group, int slots) {
        return new Entity(name, group, UNRANKED, ScoreHistory.absent(slots));
    }

    public String name() { return name; }

    public Optional<String> group() { return Optional.ofNullable(group); }

    public void group(String group) { this.group = group; }

    public int rank() { return rank; }

    public void rank(int rank) {
        if (rank < 0) throw new IllegalArgumentException("rank must be >= 0");
        this.rank = rank;
    }

    public boolean ranked() { return rank != UNRANKED; }

    public ScoreHistory history() { return history; }

    public Map<String, Double> categoryValues() { return categoryValues; }

    public int qualifyingCount() { return qualifyingCount; }

    public int sourceCount() { return sourceCount; }

    public boolean qualified() { return qualified; }

    /** Overwrite today's diagnostics. */
    public void diagnostics(Map<String, Double> categoryValues, int qualifyingCount, int sourceCount, boolean qualified) {
        this.categoryValues = Map.copyOf(categoryValues);
        this.qualifyingCount = qualifyingCount;
        this.sourceCount = sourceCount;
        this.qualified = qualified;
    }

    @Override public String toString() {
        return "Entity{" + name + ", rank=" + rank + ", history=" + history + "}";
    }
}
