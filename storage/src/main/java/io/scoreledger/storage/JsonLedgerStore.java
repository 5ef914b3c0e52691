// file: storage/src/main/java/io/scoreledger/storage/JsonLedgerStore.java
package io.scoreledger.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.scoreledger.core.LedgerCorruptException;
import io.scoreledger.core.PersistFailureException;
import io.scoreledger.core.digest.IntegrityStamper;
import io.scoreledger.core.ledger.Ledger;
import io.scoreledger.storage.dto.LedgerDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Ledger stored as one pretty-printed JSON document.
 * <p>
 * Responsibilities:
 *  - Read the document and turn any parse or shape problem into LEDGER_CORRUPT.
 *  - Decode the serialized bytes and check them before they replace anything.
 *  - Write through {@link AtomicFiles} so readers only ever see a whole document.
 */
public final class JsonLedgerStore implements LedgerStore {
    private static final Logger log = Logger.getLogger(JsonLedgerStore.class.getName());

    static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    public JsonLedgerStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public Optional<Ledger> load() {
        if (!Files.exists(file)) {
            log.info(() -> "No ledger at " + file + ", starting empty");
            return Optional.empty();
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new LedgerCorruptException("Failed to read ledger " + file, e);
        }
        Ledger ledger = parse(bytes);
        log.fine(() -> "Loaded ledger %s: %d dates, %d entities"
                .formatted(file, ledger.slotCount(), ledger.entities().size()));
        return Optional.of(ledger);
    }

    @Override
    public void write(Ledger ledger) {
        byte[] bytes;
        try {
            bytes = MAPPER.writeValueAsBytes(LedgerCodec.encode(ledger));
        } catch (JsonProcessingException e) {
            throw new PersistFailureException("Failed to serialize ledger for " + file, e);
        }
        checkReadBack(ledger, bytes);
        AtomicFiles.write(file, bytes);
        log.fine(() -> "Wrote ledger " + file + " (" + bytes.length + " bytes)");
    }

    private Ledger parse(byte[] bytes) {
        LedgerDocument doc;
        try {
            doc = MAPPER.readValue(bytes, LedgerDocument.class);
        } catch (JsonProcessingException e) {
            throw new LedgerCorruptException("Failed to parse ledger " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LedgerCorruptException("Failed to parse ledger " + file, e);
        }
        Ledger ledger = LedgerCodec.decode(doc);
        ledger.validateStructure();
        return ledger;
    }

    /** The bytes about to replace the file must load back to the same stamped ledger. */
    private void checkReadBack(Ledger written, byte[] bytes) {
        Ledger reread;
        try {
            reread = parse(bytes);
            IntegrityStamper.verify(reread);
        } catch (LedgerCorruptException e) {
            throw new PersistFailureException("Refusing to write " + file + ": " + e.getMessage(), e);
        }
        if (!Objects.equals(written.integrityDigest(), reread.integrityDigest())) {
            throw new PersistFailureException("Refusing to write " + file + ": digest changed in serialization");
        }
        if (reread.slotCount() != written.slotCount() || reread.entities().size() != written.entities().size()) {
            throw new PersistFailureException("Refusing to write " + file + ": shape changed in serialization");
        }
    }

    @Override
    public Path location() {
        return file;
    }
}
