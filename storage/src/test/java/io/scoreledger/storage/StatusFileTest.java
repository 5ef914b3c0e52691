// file: storage/src/test/java/io/scoreledger/storage/StatusFileTest.java
package io.scoreledger.storage;

import io.scoreledger.storage.dto.BoardStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusFileTest {

    @TempDir
    Path tmp;

    private static BoardStatus status(String state, String top) {
        var s = new BoardStatus();
        s.state = state;
        s.runDate = "2025-03-01";
        s.topEntity = top;
        s.topScore = 75.0;
        s.top = List.of(new BoardStatus.TopEntry(top, 75.0));
        return s;
    }

    @Test
    void other_boards_survive_an_update() {
        var clock = Clock.fixed(Instant.parse("2025-03-01T06:00:00Z"), ZoneOffset.UTC);
        var file = new StatusFile(tmp.resolve("status.json"), clock);

        file.record("main", status("PERSISTED", "Alpha"));
        file.record("coding", status("ABORTED", null));
        file.record("main", status("PERSISTED", "Beta"));

        var doc = file.read();
        assertEquals("2025-03-01T06:00:00Z", doc.updatedAt);
        assertEquals(List.of("main", "coding"), List.copyOf(doc.boards.keySet()));
        assertEquals("Beta", doc.boards.get("main").topEntity);
        assertEquals("ABORTED", file.board("coding").orElseThrow().state);
        assertEquals("Beta", file.board("main").orElseThrow().top.get(0).name);
    }

    @Test
    void unreadable_status_file_is_rebuilt() throws Exception {
        Path p = tmp.resolve("status.json");
        Files.writeString(p, "not json");
        var file = new StatusFile(p);

        assertTrue(file.read().boards.isEmpty());
        file.record("main", status("PERSISTED", "Alpha"));
        assertEquals("Alpha", file.board("main").orElseThrow().topEntity);
    }
}
