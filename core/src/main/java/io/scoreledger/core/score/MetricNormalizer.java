// file: core/src/main/java/io/scoreledger/core/score/MetricNormalizer.java
package io.scoreledger.core.score;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rescales one source's raw values onto 0..100 relative to the best performer.
 * <p>
 *  - higher is better: reference = max, score = 100 * value / reference
 *  - lower is better:  reference = min, score = 100 * reference / value
 * <p>
 * Absent, non-finite and non-positive values are dropped before the reference is
 * taken and are absent from the result; they are never turned into 0. The best
 * performer gets exactly 100. No present values gives an empty map.
 */
public final class MetricNormalizer {

    public Map<String, Double> normalize(Map<String, Double> rawValues, boolean lowerIsBetter) {
        var present = new LinkedHashMap<String, Double>();
        for (var e : rawValues.entrySet()) {
            Double v = e.getValue();
            if (v != null && !v.isNaN() && !v.isInfinite() && v > 0) {
                present.put(e.getKey(), v);
            }
        }
        if (present.isEmpty()) return Map.of();

        double reference = lowerIsBetter
                ? present.values().stream().mapToDouble(Double::doubleValue).min().orElseThrow()
                : present.values().stream().mapToDouble(Double::doubleValue).max().orElseThrow();

        var out = new LinkedHashMap<String, Double>(present.size() * 2);
        for (var e : present.entrySet()) {
            double v = e.getValue();
            double score;
            if (v == reference) {
                score = 100.0;
            } else {
                score = lowerIsBetter ? 100.0 * reference / v : 100.0 * v / reference;
            }
            out.put(e.getKey(), score);
        }
        return out;
    }
}
