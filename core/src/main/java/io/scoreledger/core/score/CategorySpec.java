package io.scoreledger.core.score;

import java.util.List;
import java.util.Objects;

/**
 * One weighted dimension of the composite, fed by one or more sources.
 * The category value of an entity is the mean of its present normalized source values.
 */
public record CategorySpec(String key, double weight, List<SourceSpec> sources) {
    public CategorySpec {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(sources, "sources");
        if (key.isBlank()) throw new IllegalArgumentException("category key must not be blank");
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("weight must be a positive number: " + key);
        }
        if (sources.isEmpty()) throw new IllegalArgumentException("category " + key + " has no sources");
        sources = List.copyOf(sources);
    }

    public static CategorySpec single(String key, double weight, String sourceId, boolean lowerIsBetter) {
        return new CategorySpec(key, weight, List.of(new SourceSpec(sourceId, lowerIsBetter)));
    }
}
