// file: engine/src/main/java/io/scoreledger/engine/RunLogger.java
package io.scoreledger.engine;

import io.scoreledger.core.RunAbortedException;
import io.scoreledger.core.ledger.Discovery;
import io.scoreledger.core.resolve.MeasurementIndex;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single place that formats run-level log lines.
 *
 * Responsibilities:
 *  - State transitions and terminal outcomes of each board run.
 *  - Resolution diagnostics (unavailable sources, ambiguous names, pending discoveries).
 */
public final class RunLogger {
    private static final Logger log = Logger.getLogger(RunLogger.class.getName());

    private RunLogger() {
        // utility
    }

    public static void transition(String boardId, RunState state) {
        log.log(Level.INFO, () -> "[%s] -> %s".formatted(boardId, state));
    }

    public static void resolution(String boardId, MeasurementIndex index, Discovery discovery) {
        if (!index.unavailableSources().isEmpty()) {
            log.log(Level.INFO, () -> "[%s] unavailable sources: %s".formatted(boardId, index.unavailableSources()));
        }
        if (!discovery.admitted().isEmpty()) {
            log.log(Level.INFO, () -> "[%s] new entities: %s".formatted(boardId, discovery.admitted()));
        }
        if (!discovery.rejected().isEmpty()) {
            log.log(Level.WARNING, () -> "[%s] rejected names: %s".formatted(boardId, discovery.rejected()));
        }
        if (index.collisions() > 0) {
            log.log(Level.INFO, () -> "[%s] %d duplicate spellings ignored".formatted(boardId, index.collisions()));
        }
        log.log(Level.FINE, () -> "[%s] ambiguous: %s, pending: %s"
                .formatted(boardId, index.ambiguousNames(), discovery.pending()));
    }

    public static void finished(RunOutcome outcome) {
        log.log(Level.INFO, () -> "[%s] %s in %dms (%d of %d qualified)".formatted(
                outcome.boardId(),
                outcome.state(),
                outcome.durationMillis(),
                outcome.summary().qualified(),
                outcome.summary().total()));
    }

    public static void aborted(String boardId, RunState at, RunAbortedException e) {
        log.log(Level.WARNING, "[%s] aborted in %s: %s %s".formatted(boardId, at, e.reason(), e.getMessage()), e);
    }
}
