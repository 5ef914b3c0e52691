package io.scoreledger.core;

/**
 * Writing (or re-reading after writing) the ledger failed.
 */
public class PersistFailureException extends RunAbortedException {

    public PersistFailureException(String message) {
        super(AbortReason.PERSIST_FAILURE, message);
    }

    public PersistFailureException(String message, Throwable cause) {
        super(AbortReason.PERSIST_FAILURE, message, cause);
    }
}
