// file: core/src/main/java/io/scoreledger/core/score/CompositeScorer.java
package io.scoreledger.core.score;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Weighted composite with proportional reweighting over present categories.
 * <p>
 * For the set P of categories where the entity has a value:
 * <pre>
 *   W         = sum(w_c for c in P)
 *   composite = sum(value_c * (w_c / W) for c in P)
 * </pre>
 * Missing categories therefore neither drag the score towards zero nor
 * penalize broader coverage. When a {@link CoverageDampener} is configured the
 * composite is multiplied by its factor for |P| out of all categories.
 */
public final class CompositeScorer {

    private final Map<String, Double> weights;
    private final CoverageDampener dampener; // optional

    public CompositeScorer(Map<String, Double> weights) {
        this(weights, null);
    }

    public CompositeScorer(Map<String, Double> weights, CoverageDampener dampener) {
        Objects.requireNonNull(weights, "weights");
        if (weights.isEmpty()) throw new IllegalArgumentException("weights must not be empty");
        this.weights = new LinkedHashMap<>(weights);
        this.dampener = dampener;
    }

    public static CompositeScorer forBoard(BoardSpec board) {
        return new CompositeScorer(board.weights(), board.dampener());
    }

    /**
     * @param categoryValues category key -> normalized value; missing keys and nulls are absent
     */
    public CompositeScore score(Map<String, Double> categoryValues) {
        double totalWeight = 0.0;
        int present = 0;
        for (var e : weights.entrySet()) {
            if (categoryValues.get(e.getKey()) != null) {
                totalWeight += e.getValue();
                present++;
            }
        }
        if (present == 0) return CompositeScore.none();

        double composite = 0.0;
        for (var e : weights.entrySet()) {
            Double v = categoryValues.get(e.getKey());
            if (v != null) {
                // w / W first: with one category this is exactly 1.0
                composite += v * (e.getValue() / totalWeight);
            }
        }
        if (dampener != null) {
            composite = dampener.apply(composite, present, weights.size());
        }
        return new CompositeScore(OptionalDouble.of(composite), present);
    }
}
