// file: engine/src/main/java/io/scoreledger/engine/Notifier.java
package io.scoreledger.engine;

/**
 * Outbound human notification (chat, e-mail and so on) of a finished run.
 * Delivery is someone else's job; the engine only produces the summary.
 */
public interface Notifier {

    void send(RunSummary summary);
}
