// file: core/src/main/java/io/scoreledger/core/score/BoardScorer.java
package io.scoreledger.core.score;

import io.scoreledger.core.resolve.MeasurementIndex;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns today's resolved measurements into one {@link EntityScore} per roster entity.
 * <p>
 * Steps:
 *  1) Normalize every source of every category across all entities.
 *  2) Category value = mean of the entity's present normalized source values.
 *  3) Composite via {@link CompositeScorer} (reweighted, optionally dampened).
 *  4) Qualification: categories present (or source values present, per board mode)
 *     must reach the board minimum.
 * <p>
 * Entities below the gate keep their composite; only ranking ignores them.
 */
public final class BoardScorer {

    private final BoardSpec board;
    private final MetricNormalizer normalizer;
    private final CompositeScorer composite;

    public BoardScorer(BoardSpec board) {
        this(board, new MetricNormalizer());
    }

    public BoardScorer(BoardSpec board, MetricNormalizer normalizer) {
        this.board = Objects.requireNonNull(board, "board");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.composite = CompositeScorer.forBoard(board);
    }

    public BoardSpec board() {
        return board;
    }

    public Map<String, EntityScore> score(List<String> roster, MeasurementIndex index) {
        // category -> list of normalized maps (one per source)
        var normalized = new LinkedHashMap<String, List<Map<String, Double>>>();
        for (var c : board.categories()) {
            normalized.put(c.key(), c.sources().stream()
                    .map(s -> normalizer.normalize(index.valuesFor(s.id()), s.lowerIsBetter()))
                    .toList());
        }

        var out = new LinkedHashMap<String, EntityScore>(roster.size() * 2);
        for (String entity : roster) {
            var categoryValues = new LinkedHashMap<String, Double>();
            int sourcesPresent = 0;

            for (var e : normalized.entrySet()) {
                double sum = 0.0;
                int n = 0;
                for (var perSource : e.getValue()) {
                    Double v = perSource.get(entity);
                    if (v != null) {
                        sum += v;
                        n++;
                    }
                }
                if (n > 0) {
                    categoryValues.put(e.getKey(), sum / n);
                    sourcesPresent += n;
                }
            }

            CompositeScore cs = composite.score(categoryValues);
            int counted = board.mode() == QualificationMode.CATEGORIES ? cs.categoriesPresent() : sourcesPresent;
            boolean qualified = cs.composite().isPresent() && counted >= board.qualificationMin();

            out.put(entity, new EntityScore(cs.composite(), cs.categoriesPresent(), sourcesPresent, categoryValues, qualified));
        }
        return out;
    }

    /** Sources, in board order, that gave at least one entity a normalized value today. */
    public Set<String> scoredSources(MeasurementIndex index) {
        var out = new LinkedHashSet<String>();
        for (var c : board.categories()) {
            for (var s : c.sources()) {
                if (out.contains(s.id())) continue;
                if (!normalizer.normalize(index.valuesFor(s.id()), s.lowerIsBetter()).isEmpty()) out.add(s.id());
            }
        }
        return out;
    }

    /** category key -> number of entities with a value in it today. */
    public static Map<String, Integer> coverage(BoardSpec board, Map<String, EntityScore> scores) {
        var m = new LinkedHashMap<String, Integer>();
        for (var c : board.categories()) m.put(c.key(), 0);
        for (var s : scores.values()) {
            for (String key : s.categoryValues().keySet()) {
                m.merge(key, 1, Integer::sum);
            }
        }
        return m;
    }
}
