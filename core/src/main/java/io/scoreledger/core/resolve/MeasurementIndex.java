// file: core/src/main/java/io/scoreledger/core/resolve/MeasurementIndex.java
package io.scoreledger.core.resolve;

import io.scoreledger.core.score.SourceResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Today's raw measurements attached to canonical entity names.
 * <p>
 * Built once per run by resolving every raw name of every available source
 * against the roster:
 *  - matched names land in {@code sourceId -> entity -> value},
 *  - UNKNOWN names are kept as {@link Sighting}s for discovery,
 *  - AMBIGUOUS and BLANK names are counted and dropped.
 * <p>
 * When two raw names of one source resolve to the same entity, the first one
 * in document order wins and the clash is counted. Non-finite values are
 * dropped at the door.
 */
public final class MeasurementIndex {

    /** An unmatched raw name seen in one source. */
    public record Sighting(String sourceId, String rawName, String candidateName, double value) {}

    private final Map<String, Map<String, Double>> bySource = new LinkedHashMap<>();
    private final List<Sighting> unmatched = new ArrayList<>();
    private final Set<String> unavailable = new LinkedHashSet<>();
    private final List<String> ambiguous = new ArrayList<>();
    private int collisions;

    private MeasurementIndex() {
    }

    public static MeasurementIndex build(Map<String, SourceResult> sources,
                                         List<String> roster,
                                         EntityResolver resolver) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(roster, "roster");
        Objects.requireNonNull(resolver, "resolver");

        var index = new MeasurementIndex();
        for (var e : sources.entrySet()) {
            String sourceId = e.getKey();
            SourceResult result = e.getValue();
            if (!(result instanceof SourceResult.Available available) || available.values().isEmpty()) {
                index.unavailable.add(sourceId);
                continue;
            }

            var values = index.bySource.computeIfAbsent(sourceId, k -> new LinkedHashMap<>());
            for (var m : available.values().entrySet()) {
                Double v = m.getValue();
                if (v == null || v.isNaN() || v.isInfinite()) continue;

                Resolution r = resolver.resolve(m.getKey(), roster);
                if (r instanceof Resolution.Matched matched) {
                    index.put(values, matched.name(), v);
                } else {
                    var noMatch = (Resolution.NoMatch) r;
                    switch (noMatch.reason()) {
                        case UNKNOWN -> index.unmatched.add(
                                new Sighting(sourceId, m.getKey(), noMatch.candidateName(), v));
                        case AMBIGUOUS -> index.ambiguous.add(sourceId + ":" + m.getKey());
                        case BLANK -> {
                            // nothing to attach
                        }
                    }
                }
            }
        }
        return index;
    }

    /** Attach a discovered entity's sighting; first value per source wins. */
    public void attach(String entityName, Sighting sighting) {
        var values = bySource.computeIfAbsent(sighting.sourceId(), k -> new LinkedHashMap<>());
        put(values, entityName, sighting.value());
    }

    private void put(Map<String, Double> values, String entity, double v) {
        if (values.putIfAbsent(entity, v) != null) {
            collisions++;
        }
    }

    /** entity -> raw value for one source; empty if the source had nothing. */
    public Map<String, Double> valuesFor(String sourceId) {
        var m = bySource.get(sourceId);
        return m == null ? Map.of() : Collections.unmodifiableMap(m);
    }

    public boolean hasValues(String sourceId) {
        var m = bySource.get(sourceId);
        return m != null && !m.isEmpty();
    }

    public List<Sighting> unmatched() { return Collections.unmodifiableList(unmatched); }

    public Set<String> unavailableSources() { return Collections.unmodifiableSet(unavailable); }

    /** "sourceId:rawName" of names that could not be resolved without guessing. */
    public List<String> ambiguousNames() { return Collections.unmodifiableList(ambiguous); }

    public int collisions() { return collisions; }
}
