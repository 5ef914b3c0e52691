// file: storage/src/main/java/io/scoreledger/storage/LedgerStore.java
package io.scoreledger.storage;

import io.scoreledger.core.ledger.Ledger;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Durable home of one board's ledger.
 * <p>
 * A run:
 *  - loads the ledger once at the start (empty when nothing was written yet),
 *  - mutates it in memory,
 *  - writes it back once at the end.
 * A failed write must leave the previously written ledger readable and unchanged.
 */
public interface LedgerStore {

    /**
     * Load and structurally validate the stored ledger.
     * The integrity digest is carried over but not checked here.
     *
     * @return the ledger, or empty if none has been written yet
     * @throws io.scoreledger.core.LedgerCorruptException if the document cannot be read back into a valid ledger
     */
    Optional<Ledger> load();

    /**
     * Replace the stored ledger. The new version is checked to load back with a
     * matching digest before it replaces the old one.
     *
     * @throws io.scoreledger.core.PersistFailureException if the check or the write failed;
     *         the previous version is then still in place
     */
    void write(Ledger ledger);

    /** Where the ledger lives, for logs and operator output. */
    Path location();
}
