package io.scoreledger.core;

/**
 * Why a scoring run stopped before publishing.
 * <p>
 * A run either persists or aborts with exactly one of these reasons.
 * Recoverable conditions (an unavailable source, an ambiguous name) are
 * data and never show up here.
 */
public enum AbortReason {
    /** Loaded ledger breaks a structural invariant or fails its digest check. */
    LEDGER_CORRUPT,
    /** Run date is already in the axis but not last, or sorts before the last entry. */
    DATE_OUT_OF_ORDER,
    /** Nobody passed the qualification gate, so there is no ranking to publish. */
    NO_QUALIFIED_ENTITIES,
    /** The atomic write or the post-write verification failed. */
    PERSIST_FAILURE
}
