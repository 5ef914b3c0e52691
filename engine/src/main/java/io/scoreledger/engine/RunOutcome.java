// file: engine/src/main/java/io/scoreledger/engine/RunOutcome.java
package io.scoreledger.engine;

import io.scoreledger.core.AbortReason;

/**
 * Result of {@link ScoringRun#execute}.
 *
 * @param state   terminal state reached
 * @param reason  abort reason, null unless {@code state == ABORTED}
 */
public record RunOutcome(String boardId, RunState state, AbortReason reason, RunSummary summary, long durationMillis) {

    public boolean succeeded() {
        return state != RunState.ABORTED;
    }
}
