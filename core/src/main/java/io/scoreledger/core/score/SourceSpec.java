package io.scoreledger.core.score;

import java.util.Objects;

/**
 * Static metadata for one raw source feeding a category.
 *
 * @param id            source identifier, the key in today's measurements
 * @param lowerIsBetter true for error rates, cost, latency and the like
 */
public record SourceSpec(String id, boolean lowerIsBetter) {
    public SourceSpec {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("source id must not be blank");
    }
}
