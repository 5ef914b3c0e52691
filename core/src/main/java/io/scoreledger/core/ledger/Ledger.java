// file: core/src/main/java/io/scoreledger/core/ledger/Ledger.java
package io.scoreledger.core.ledger;

import io.scoreledger.core.LedgerCorruptException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory score ledger: a shared date axis plus entities whose histories are
 * aligned to it slot for slot.
 * <p>
 * Invariants (checked by {@link #validateStructure()} and kept by every mutator here):
 *  - every history has exactly one slot per axis entry,
 *  - names are unique,
 *  - the axis holds ISO dates in strictly increasing order.
 * <p>
 * Entity order is insertion order and is the tie-break order for ranking.
 * Entities are never removed.
 */
public final class Ledger {

    private final List<String> dateAxis;
    private final List<Entity> entities;
    private String integrityDigest; // null until stamped

    public Ledger(List<String> dateAxis, List<Entity> entities, String integrityDigest) {
        this.dateAxis = new ArrayList<>(Objects.requireNonNull(dateAxis, "dateAxis"));
        this.entities = new ArrayList<>(Objects.requireNonNull(entities, "entities"));
        this.integrityDigest = integrityDigest;
    }

    public static Ledger empty() {
        return new Ledger(List.of(), List.of(), null);
    }

    public List<String> dateAxis() { return Collections.unmodifiableList(dateAxis); }

    public List<Entity> entities() { return Collections.unmodifiableList(entities); }

    /** Entity names in ledger order. */
    public List<String> roster() {
        return entities.stream().map(Entity::name).toList();
    }

    public Optional<Entity> find(String name) {
        return entities.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public Optional<String> lastDate() {
        return dateAxis.isEmpty() ? Optional.empty() : Optional.of(dateAxis.get(dateAxis.size() - 1));
    }

    public int slotCount() { return dateAxis.size(); }

    /** Index of the newest slot; -1 on an empty axis. */
    public int currentSlot() { return dateAxis.size() - 1; }

    public String integrityDigest() { return integrityDigest; }

    public void integrityDigest(String digest) { this.integrityDigest = digest; }

    /** Append a date and one absent slot to every history. */
    public void appendDate(String date) {
        Objects.requireNonNull(date, "date");
        dateAxis.add(date);
        for (Entity e : entities) {
            e.history().appendAbsent();
        }
    }

    /** Add an entity whose history is already aligned to the axis. */
    public void addEntity(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        if (find(entity.name()).isPresent()) {
            throw new IllegalStateException("duplicate entity name: " + entity.name());
        }
        if (entity.history().size() != dateAxis.size()) {
            throw new IllegalStateException("history of %s has %d slots, axis has %d"
                    .formatted(entity.name(), entity.history().size(), dateAxis.size()));
        }
        entities.add(entity);
    }

    /**
     * Check structural invariants of a freshly loaded ledger.
     *
     * @throws LedgerCorruptException on the first violation found
     */
    public void validateStructure() {
        LocalDate previous = null;
        var seenDates = new HashSet<String>();
        for (String d : dateAxis) {
            if (d == null) throw new LedgerCorruptException("date axis contains a null entry");
            if (!seenDates.add(d)) throw new LedgerCorruptException("date axis repeats " + d);
            LocalDate parsed;
            try {
                parsed = LocalDate.parse(d);
            } catch (DateTimeParseException e) {
                throw new LedgerCorruptException("date axis entry is not an ISO date: " + d, e);
            }
            if (previous != null && !parsed.isAfter(previous)) {
                throw new LedgerCorruptException("date axis is not increasing at " + d);
            }
            previous = parsed;
        }

        var names = new HashSet<String>();
        for (Entity e : entities) {
            if (!names.add(e.name())) throw new LedgerCorruptException("duplicate entity name: " + e.name());
            if (e.history().size() != dateAxis.size()) {
                throw new LedgerCorruptException("history of %s has %d slots, axis has %d"
                        .formatted(e.name(), e.history().size(), dateAxis.size()));
            }
        }
    }
}
