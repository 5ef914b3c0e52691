// file: engine/src/main/java/io/scoreledger/engine/LedgerPublisher.java
package io.scoreledger.engine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Hands a freshly persisted and verified ledger to whatever publishes it
 * (a version-controlled location, a static site). Called only after PERSISTED.
 */
@FunctionalInterface
public interface LedgerPublisher {

    /** Publishes nothing. */
    LedgerPublisher NONE = (ledgerFile, summary) -> { };

    void publish(Path ledgerFile, RunSummary summary) throws IOException;
}
