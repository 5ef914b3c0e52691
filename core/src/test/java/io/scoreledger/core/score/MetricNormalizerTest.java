// file: core/src/test/java/io/scoreledger/core/score/MetricNormalizerTest.java
package io.scoreledger.core.score;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricNormalizerTest {

    private final MetricNormalizer normalizer = new MetricNormalizer();

    @Test
    void higher_is_better_scales_against_max() {
        var out = normalizer.normalize(Map.of("Alpha", 80.0, "Beta", 40.0), false);
        assertEquals(100.0, out.get("Alpha"));
        assertEquals(50.0, out.get("Beta"));
    }

    @Test
    void lower_is_better_scales_against_min() {
        var out = normalizer.normalize(Map.of("Alpha", 2.0, "Beta", 1.0), true);
        assertEquals(50.0, out.get("Alpha"));
        assertEquals(100.0, out.get("Beta"));
    }

    @Test
    void best_performer_gets_exactly_one_hundred() {
        var raw = new LinkedHashMap<String, Double>();
        raw.put("a", 0.1);
        raw.put("b", 0.3);
        raw.put("c", 0.7);
        for (boolean lower : new boolean[]{false, true}) {
            var out = normalizer.normalize(raw, lower);
            String best = lower ? "a" : "c";
            assertEquals(100.0, out.get(best), 0.0);
            out.values().forEach(v -> assertTrue(v > 0 && v <= 100.0, "out of range: " + v));
        }
    }

    @Test
    void unusable_values_are_absent_not_zero() {
        var raw = new HashMap<String, Double>();
        raw.put("ok", 10.0);
        raw.put("zero", 0.0);
        raw.put("negative", -3.0);
        raw.put("nan", Double.NaN);
        raw.put("inf", Double.POSITIVE_INFINITY);
        raw.put("missing", null);

        var out = normalizer.normalize(raw, false);
        assertEquals(Map.of("ok", 100.0), out);
    }

    @Test
    void nothing_present_gives_empty_map() {
        assertTrue(normalizer.normalize(Map.of(), false).isEmpty());
        assertTrue(normalizer.normalize(Map.of("x", 0.0), true).isEmpty());
    }
}
