// file: engine/src/main/java/io/scoreledger/engine/LoggingNotifier.java
package io.scoreledger.engine;

import java.util.logging.Level;
import java.util.logging.Logger;

/** Default notifier: writes the summary to the log. */
public final class LoggingNotifier implements Notifier {
    private static final Logger log = Logger.getLogger(LoggingNotifier.class.getName());

    @Override
    public void send(RunSummary summary) {
        Level level = summary.state() == RunState.ABORTED ? Level.WARNING : Level.INFO;
        log.log(level, summary.text());
    }
}
