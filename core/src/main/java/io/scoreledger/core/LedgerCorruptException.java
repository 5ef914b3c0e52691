package io.scoreledger.core;

/**
 * The persisted ledger cannot be trusted: bad structure or a digest mismatch.
 * Never repaired automatically.
 */
public class LedgerCorruptException extends RunAbortedException {

    public LedgerCorruptException(String message) {
        super(AbortReason.LEDGER_CORRUPT, message);
    }

    public LedgerCorruptException(String message, Throwable cause) {
        super(AbortReason.LEDGER_CORRUPT, message, cause);
    }
}
