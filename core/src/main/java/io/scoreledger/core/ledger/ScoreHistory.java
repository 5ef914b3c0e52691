// file: core/src/main/java/io/scoreledger/core/ledger/ScoreHistory.java
package io.scoreledger.core.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * One entity's scores, one slot per date on the ledger's axis.
 * <p>
 * A slot is either present (a score) or absent (no composite that day).
 * Absent is not zero: {@link #get(int)} returns an empty OptionalDouble.
 * Internally absent slots are nulls; {@link #slots()} exposes that form for
 * serialization only.
 */
public final class ScoreHistory {

    private final List<Double> slots;

    public ScoreHistory() {
        this.slots = new ArrayList<>();
    }

    /** Copy of {@code slots}; null entries are absent. */
    public ScoreHistory(List<Double> slots) {
        this.slots = new ArrayList<>(slots);
    }

    /** History of {@code size} absent slots. */
    public static ScoreHistory absent(int size) {
        var h = new ScoreHistory();
        for (int i = 0; i < size; i++) h.appendAbsent();
        return h;
    }

    public int size() {
        return slots.size();
    }

    public OptionalDouble get(int slot) {
        Double v = slots.get(slot);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public void set(int slot, double score) {
        if (Double.isNaN(score) || Double.isInfinite(score)) {
            throw new IllegalArgumentException("score must be finite: " + score);
        }
        slots.set(slot, score);
    }

    public void clear(int slot) {
        slots.set(slot, null);
    }

    public void appendAbsent() {
        slots.add(null);
    }

    /** Last slot, empty if the history is empty or the last slot is absent. */
    public OptionalDouble latest() {
        return slots.isEmpty() ? OptionalDouble.empty() : get(slots.size() - 1);
    }

    /** Read-only view with nulls for absent slots. */
    public List<Double> slots() {
        return Collections.unmodifiableList(slots);
    }

    @Override public String toString() {
        return slots.toString();
    }
}
