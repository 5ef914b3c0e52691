// file: core/src/main/java/io/scoreledger/core/RunAbortedException.java
package io.scoreledger.core;

import java.util.Objects;

/**
 * Fatal condition for a single board run.
 * <p>
 * Thrown anywhere between load and persist; the run state machine turns it
 * into an ABORTED outcome and nothing is written.
 */
public class RunAbortedException extends RuntimeException {
    private final AbortReason reason;

    public RunAbortedException(AbortReason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public RunAbortedException(AbortReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public AbortReason reason() {
        return reason;
    }
}
