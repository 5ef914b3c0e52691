// file: core/src/main/java/io/scoreledger/core/score/EntityScore.java
package io.scoreledger.core.score;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * One entity's result for today.
 *
 * @param composite          weighted composite, empty when no category had data
 * @param categoriesPresent  categories with a present value
 * @param sourcesPresent     present per-source values over all categories
 * @param categoryValues     category key -> category value (present ones only)
 * @param qualified          passed the board's qualification gate
 */
public record EntityScore(
        OptionalDouble composite,
        int categoriesPresent,
        int sourcesPresent,
        Map<String, Double> categoryValues,
        boolean qualified
) {
    public EntityScore {
        categoryValues = Map.copyOf(categoryValues);
    }

    public static EntityScore none() {
        return new EntityScore(OptionalDouble.empty(), 0, 0, Map.of(), false);
    }
}
