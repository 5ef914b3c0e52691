// file: engine/src/main/java/io/scoreledger/engine/RunState.java
package io.scoreledger.engine;

/**
 * States of one board run, in order.
 * <p>
 * Terminal states:
 *  - PERSISTED: ledger written and verified
 *  - REPORTED:  dry run, everything computed, nothing written
 *  - ABORTED:   a precondition failed; nothing written
 */
public enum RunState {
    LOAD,
    RESOLVE_DATE_SLOT,
    MERGE_NEW_ENTITIES,
    APPLY_SCORES,
    RECOMPUTE_RANKS,
    STAMP,
    PERSIST,
    PERSISTED,
    REPORTED,
    ABORTED;

    public boolean terminal() {
        return this == PERSISTED || this == REPORTED || this == ABORTED;
    }
}
