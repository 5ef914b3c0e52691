package io.scoreledger.core.score;

import java.util.OptionalDouble;

/**
 * Result of {@link CompositeScorer#score}: an empty composite means the entity
 * had no data in any weighted category.
 */
public record CompositeScore(OptionalDouble composite, int categoriesPresent) {

    public static CompositeScore none() {
        return new CompositeScore(OptionalDouble.empty(), 0);
    }
}
