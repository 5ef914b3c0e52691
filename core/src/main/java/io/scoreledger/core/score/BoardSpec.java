// file: core/src/main/java/io/scoreledger/core/score/BoardSpec.java
package io.scoreledger.core.score;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Scoring rules for one leaderboard.
 *
 * @param id                board identifier (also the sub-scope name on the CLI)
 * @param categories        weighted categories, in display order
 * @param qualificationMin  minimum count (per {@code mode}) for an entity to be ranked
 * @param mode              what the qualification gate counts
 * @param dampener          optional coverage dampener, null when unused
 */
public record BoardSpec(
        String id,
        List<CategorySpec> categories,
        int qualificationMin,
        QualificationMode mode,
        CoverageDampener dampener
) {
    public BoardSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(categories, "categories");
        Objects.requireNonNull(mode, "mode");
        if (id.isBlank()) throw new IllegalArgumentException("board id must not be blank");
        if (categories.isEmpty()) throw new IllegalArgumentException("board " + id + " has no categories");
        if (qualificationMin < 0) throw new IllegalArgumentException("qualificationMin must be >= 0");

        var keys = new HashSet<String>();
        int sourceSlots = 0;
        for (var c : categories) {
            if (!keys.add(c.key())) throw new IllegalArgumentException("duplicate category: " + c.key());
            sourceSlots += c.sources().size();
        }
        int ceiling = mode == QualificationMode.CATEGORIES ? categories.size() : sourceSlots;
        if (qualificationMin > ceiling) {
            throw new IllegalArgumentException(
                    "qualificationMin %d exceeds the %d countable %s of board %s"
                            .formatted(qualificationMin, ceiling, mode.name().toLowerCase(), id));
        }
        categories = List.copyOf(categories);
    }

    /** category key -> weight, in category order. */
    public Map<String, Double> weights() {
        var m = new LinkedHashMap<String, Double>();
        for (var c : categories) m.put(c.key(), c.weight());
        return m;
    }

    public Optional<CoverageDampener> coverageDampener() {
        return Optional.ofNullable(dampener);
    }
}
