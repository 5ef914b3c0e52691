// file: core/src/test/java/io/scoreledger/core/digest/IntegrityStamperTest.java
package io.scoreledger.core.digest;

import io.scoreledger.core.LedgerCorruptException;
import io.scoreledger.core.ledger.Entity;
import io.scoreledger.core.ledger.Ledger;
import io.scoreledger.core.ledger.ScoreHistory;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntegrityStamperTest {

    private static Ledger sample() {
        return new Ledger(List.of("2025-01-01", "2025-01-02"), List.of(
                new Entity("Alpha", null, 1, new ScoreHistory(Arrays.asList(75.0, null))),
                new Entity("Beta", "Acme", 2, new ScoreHistory(Arrays.asList(80.44, 75.0)))
        ), null);
    }

    @Test
    void canonical_form_is_names_then_scores_in_ledger_order() {
        assertEquals("Alpha|Beta:75.0,null,80.4,75.0", IntegrityStamper.canonicalForm(sample().entities()));
    }

    @Test
    void digest_is_lowercase_sha256_hex() {
        String d = IntegrityStamper.digest(sample().entities());
        assertEquals(64, d.length());
        assertTrue(d.matches("[0-9a-f]{64}"), d);
        assertEquals(d, IntegrityStamper.digest(sample().entities()));
    }

    @Test
    void stamped_ledger_verifies() {
        var l = sample();
        String d = IntegrityStamper.stamp(l);
        assertEquals(d, l.integrityDigest());
        assertTrue(IntegrityStamper.matches(l));
        assertDoesNotThrow(() -> IntegrityStamper.verify(l));
    }

    @Test
    void edited_score_breaks_verification() {
        var l = sample();
        IntegrityStamper.stamp(l);
        l.entities().get(0).history().set(1, 12.0);

        assertFalse(IntegrityStamper.matches(l));
        assertThrows(LedgerCorruptException.class, () -> IntegrityStamper.verify(l));
    }

    @Test
    void ties_round_to_even_on_the_binary_value() {
        var tie = List.of(new Entity("A", null, 1, new ScoreHistory(List.of(72.25))));
        assertEquals("A:72.2", IntegrityStamper.canonicalForm(tie));
        assertEquals("d08f84c660323e36486cc5746a249c7cd65dcb8f71dace13d7b3c7b82c432c74",
                IntegrityStamper.digest(tie));

        // 0.35 is stored just below the half, 72.35 just above
        assertEquals("0.3", IntegrityStamper.renderScore(0.35));
        assertEquals("72.4", IntegrityStamper.renderScore(72.35));
        assertEquals("88.0", IntegrityStamper.renderScore(88));
    }

    @Test
    void renaming_an_entity_changes_digest() {
        var l = sample();
        var renamed = List.of(
                new Entity("Alpha2", null, 1, new ScoreHistory(Arrays.asList(75.0, null))),
                l.entities().get(1));
        assertNotEquals(IntegrityStamper.digest(l.entities()), IntegrityStamper.digest(renamed));
    }

    @Test
    void reordering_entities_changes_digest() {
        var l = sample();
        var reversed = List.of(l.entities().get(1), l.entities().get(0));
        assertNotEquals(IntegrityStamper.digest(l.entities()), IntegrityStamper.digest(reversed));
    }

    @Test
    void rank_and_group_are_not_covered() {
        var l = sample();
        String before = IntegrityStamper.digest(l.entities());
        l.entities().get(0).rank(7);
        l.entities().get(0).group("Other");
        assertEquals(before, IntegrityStamper.digest(l.entities()));
    }

    @Test
    void missing_digest_is_only_fine_for_empty_ledger() {
        assertDoesNotThrow(() -> IntegrityStamper.verify(Ledger.empty()));
        assertThrows(LedgerCorruptException.class, () -> IntegrityStamper.verify(sample()));
    }

    @Test
    void hex_encodes_each_byte_as_two_chars() {
        assertEquals("00ff0a", IntegrityStamper.hex(new byte[]{0x00, (byte) 0xff, 0x0a}));
    }
}
