// file: storage/src/main/java/io/scoreledger/storage/StatusFile.java
package io.scoreledger.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.scoreledger.core.PersistFailureException;
import io.scoreledger.storage.dto.BoardStatus;
import io.scoreledger.storage.dto.StatusDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared status.json: one entry per board, replaced after each run of that board.
 * <p>
 * Entries of other boards are kept. An unreadable status file is not a ledger and
 * never blocks a run: it is logged and rebuilt from scratch.
 */
public final class StatusFile {
    private static final Logger log = Logger.getLogger(StatusFile.class.getName());

    private final Path file;
    private final Clock clock;

    public StatusFile(Path file) {
        this(file, Clock.systemUTC());
    }

    public StatusFile(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path location() {
        return file;
    }

    /** Current document; an empty one when the file is missing or unreadable. */
    public StatusDocument read() {
        if (!Files.exists(file)) return new StatusDocument();
        try {
            StatusDocument doc = JsonLedgerStore.MAPPER.readValue(file.toFile(), StatusDocument.class);
            if (doc == null) return new StatusDocument();
            if (doc.boards == null) doc.boards = new LinkedHashMap<>();
            return doc;
        } catch (IOException e) {
            log.log(Level.WARNING, "Ignoring unreadable status file " + file, e);
            return new StatusDocument();
        }
    }

    public Optional<BoardStatus> board(String boardId) {
        return Optional.ofNullable(read().boards.get(boardId));
    }

    /**
     * Replace one board's entry and rewrite the file atomically.
     *
     * @throws PersistFailureException if the file could not be written
     */
    public void record(String boardId, BoardStatus status) {
        Objects.requireNonNull(boardId, "boardId");
        Objects.requireNonNull(status, "status");

        StatusDocument doc = read();
        doc.boards.put(boardId, status);
        doc.updatedAt = clock.instant().toString();

        byte[] bytes;
        try {
            bytes = JsonLedgerStore.MAPPER.writeValueAsBytes(doc);
        } catch (JsonProcessingException e) {
            throw new PersistFailureException("Failed to serialize status for " + file, e);
        }
        AtomicFiles.write(file, bytes);
    }
}
