// file: core/src/main/java/io/scoreledger/core/ledger/LedgerManager.java
package io.scoreledger.core.ledger;

import io.scoreledger.core.AbortReason;
import io.scoreledger.core.RunAbortedException;
import io.scoreledger.core.digest.IntegrityStamper;
import io.scoreledger.core.resolve.EntityResolver;
import io.scoreledger.core.resolve.MeasurementIndex;
import io.scoreledger.core.resolve.MeasurementIndex.Sighting;
import io.scoreledger.core.resolve.Resolution;
import io.scoreledger.core.score.EntityScore;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Owns the roster and the date axis of one ledger.
 * <p>
 * Run steps, in order:
 *  1) {@link #resolveDateSlot}:   append a slot for a new date, or reuse the last one
 *  2) {@link #mergeNewEntities}:  admit unmatched names seen in enough sources
 *  3) {@link #applyScores}:       write today's composites and diagnostics
 *  4) {@link #recomputeRanks}:    full re-rank of qualified entities
 * <p>
 * Every step keeps histories aligned with the axis. Nothing is written to disk here.
 */
public final class LedgerManager {

    private final EntityResolver resolver;
    private final int minDiscoverySources;
    private final Map<String, String> groups;

    /**
     * @param resolver             resolver used to cluster unmatched names
     * @param minDiscoverySources  distinct sources a new name needs before it is admitted
     * @param groups               entity name -> group label for newly admitted entities
     */
    public LedgerManager(EntityResolver resolver, int minDiscoverySources, Map<String, String> groups) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        if (minDiscoverySources < 1) throw new IllegalArgumentException("minDiscoverySources must be >= 1");
        this.minDiscoverySources = minDiscoverySources;
        this.groups = Map.copyOf(groups);
    }

    public EntityResolver resolver() {
        return resolver;
    }

    /**
     * Decide where today's scores go.
     * <p>
     *  - axis empty or date after the last entry: APPEND (absent slot everywhere)
     *  - date equal to the last entry: REPLACE
     *  - anything else would duplicate or reorder the axis and aborts the run
     */
    public SlotMode resolveDateSlot(Ledger ledger, LocalDate date) {
        String d = date.toString();
        var last = ledger.lastDate();
        if (last.isEmpty() || date.isAfter(LocalDate.parse(last.get()))) {
            ledger.appendDate(d);
            return SlotMode.APPEND;
        }
        if (last.get().equals(d)) {
            return SlotMode.REPLACE;
        }
        throw new RunAbortedException(AbortReason.DATE_OUT_OF_ORDER,
                "run date %s is not after the last ledger date %s".formatted(d, last.get()));
    }

    /**
     * Create entities for unmatched names seen in at least {@code minDiscoverySources}
     * distinct sources, and attach their sightings to the measurement index.
     * <p>
     * Unmatched names are grouped by resolving each candidate against the candidates
     * collected so far, so "New-Model X" and "new model x" from two sources count as
     * one name seen twice. New histories are absent for every slot; today's slot is
     * filled by {@link #applyScores}.
     */
    public Discovery mergeNewEntities(Ledger ledger, MeasurementIndex index) {
        var clusters = new LinkedHashMap<String, List<Sighting>>();
        for (Sighting s : index.unmatched()) {
            var pendingNames = new ArrayList<>(clusters.keySet());
            Resolution r = resolver.resolve(s.candidateName(), pendingNames);
            if (r instanceof Resolution.Matched m) {
                clusters.get(m.name()).add(s);
            } else if (((Resolution.NoMatch) r).reason() == Resolution.NoMatch.Reason.UNKNOWN) {
                clusters.computeIfAbsent(s.candidateName(), k -> new ArrayList<>()).add(s);
            }
        }

        var admitted = new ArrayList<String>();
        var pending = new ArrayList<String>();
        var rejected = new ArrayList<String>();
        for (var e : clusters.entrySet()) {
            String name = e.getKey();
            Set<String> sources = new LinkedHashSet<>();
            for (Sighting s : e.getValue()) sources.add(s.sourceId());

            if (sources.size() < minDiscoverySources) {
                pending.add(name);
                continue;
            }
            if (name.contains(IntegrityStamper.NAME_SEPARATOR) || ledger.find(name).isPresent()) {
                rejected.add(name);
                continue;
            }

            ledger.addEntity(Entity.discovered(name, groups.get(name), ledger.slotCount()));
            for (Sighting s : e.getValue()) index.attach(name, s);
            admitted.add(name);
        }
        return new Discovery(admitted, pending, rejected);
    }

    /**
     * Write every entity's composite into the current slot (absent when it has none)
     * and overwrite its per-run diagnostics. Stored composites are rounded to two decimals.
     */
    public void applyScores(Ledger ledger, Map<String, EntityScore> scores) {
        int slot = ledger.currentSlot();
        if (slot < 0) throw new IllegalStateException("no date slot resolved");

        for (Entity e : ledger.entities()) {
            EntityScore s = scores.getOrDefault(e.name(), EntityScore.none());
            if (s.composite().isPresent()) {
                e.history().set(slot, round2(s.composite().getAsDouble()));
            } else {
                e.history().clear(slot);
            }
            e.diagnostics(s.categoryValues(), s.categoriesPresent(), s.sourcesPresent(), s.qualified());
        }
    }

    /**
     * Re-rank from scratch: qualified entities with a score in the current slot,
     * by score descending, ties in ledger order. Everyone else is unranked.
     *
     * @return ranked entities, rank 1 first
     */
    public List<Entity> recomputeRanks(Ledger ledger) {
        int slot = ledger.currentSlot();
        var ranked = new ArrayList<Entity>();
        for (Entity e : ledger.entities()) {
            e.rank(Entity.UNRANKED);
            if (slot >= 0 && e.qualified() && e.history().get(slot).isPresent()) {
                ranked.add(e);
            }
        }
        // List.sort is stable, which keeps ledger order for equal scores
        ranked.sort((a, b) -> Double.compare(
                b.history().get(slot).getAsDouble(),
                a.history().get(slot).getAsDouble()));
        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).rank(i + 1);
        }
        return ranked;
    }

    /** Two decimals from the exact binary value, ties to even. */
    static double round2(double v) {
        return new BigDecimal(v).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
