// file: core/src/main/java/io/scoreledger/core/score/SourceResult.java
package io.scoreledger.core.score;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One source's measurements for today, as handed over by the collector:
 *  - Available:   raw name -> value, in document order (values may be unusable,
 *                 the normalizer drops those).
 *  - Unavailable: the source could not be read or returned nothing.
 * <p>
 * An unavailable source is data, not an error: its categories simply
 * contribute nothing this run.
 */
public sealed interface SourceResult permits SourceResult.Available, SourceResult.Unavailable {

    record Available(Map<String, Double> values) implements SourceResult {
        public Available {
            Objects.requireNonNull(values, "values");
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    record Unavailable(String reason) implements SourceResult {
        public Unavailable {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /** Empty or null maps mean the source had nothing today. */
    static SourceResult of(Map<String, Double> values) {
        if (values == null || values.isEmpty()) return new Unavailable("no values");
        return new Available(values);
    }

    static SourceResult unavailable(String reason) {
        return new Unavailable(reason);
    }
}
