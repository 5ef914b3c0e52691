package io.scoreledger.core.ledger;

/**
 * How today's run maps onto the date axis.
 */
public enum SlotMode {
    /** New date: one slot appended to the axis and to every history. */
    APPEND,
    /** Date already last on the axis: that slot is overwritten for every entity. */
    REPLACE
}
