// file: storage/src/main/java/io/scoreledger/storage/AtomicFiles.java
package io.scoreledger.storage;

import io.scoreledger.core.PersistFailureException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Whole-file replacement without a visible half-written state.
 * <p>
 * Protocol:
 *   - write the bytes to "<name>.tmp" next to the target,
 *   - move it over the target with ATOMIC_MOVE (plain replace where the
 *     file system cannot do an atomic rename).
 * On failure the temp file is removed and the target is left as it was.
 */
public final class AtomicFiles {

    private AtomicFiles() {
        // utility
    }

    public static Path tempFor(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }

    public static void write(Path target, byte[] bytes) {
        Path tmp = tempFor(target);
        try {
            Path dir = target.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);

            Files.write(tmp, bytes,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            try {
                Files.move(tmp, target, ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new PersistFailureException("Failed to write " + target, e);
        }
    }
}
