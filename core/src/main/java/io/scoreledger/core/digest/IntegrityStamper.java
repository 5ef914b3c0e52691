// file: core/src/main/java/io/scoreledger/core/digest/IntegrityStamper.java
package io.scoreledger.core.digest;

import io.scoreledger.core.LedgerCorruptException;
import io.scoreledger.core.ledger.Entity;
import io.scoreledger.core.ledger.Ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * SHA-256 integrity fingerprint over a ledger's names and score histories.
 * <p>
 * Canonical form, entities in ledger order (not sorted):
 * <pre>
 *   name1|name2|...|nameN:s11,s12,...,s1D,s21,...,sND
 * </pre>
 *  - names joined with '|'
 *  - every history slot, entity-major then date-minor, joined with ','
 *  - a present score with one decimal (88 -> "88.0"), an absent slot as "null"
 *  - rounding works on the exact binary value, ties to even (72.25 -> "72.2",
 *    0.35 -> "0.3"), the same digits Python's "{:.1f}" produces
 *  - the two halves joined with ':'
 * <p>
 * The digest is the lowercase hex SHA-256 of the UTF-8 bytes. Ranks, groups and
 * diagnostics are not covered; the date axis is covered only through the history
 * lengths.
 */
public final class IntegrityStamper {

    public static final String NAME_SEPARATOR = "|";
    static final String SCORE_SEPARATOR = ",";
    static final String HALF_SEPARATOR = ":";
    static final String ABSENT = "null";

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private IntegrityStamper() {
        // utility
    }

    public static String canonicalForm(List<Entity> entities) {
        var sb = new StringBuilder();
        for (int i = 0; i < entities.size(); i++) {
            if (i > 0) sb.append(NAME_SEPARATOR);
            sb.append(entities.get(i).name());
        }
        sb.append(HALF_SEPARATOR);

        boolean first = true;
        for (Entity e : entities) {
            for (Double s : e.history().slots()) {
                if (!first) sb.append(SCORE_SEPARATOR);
                sb.append(s == null ? ABSENT : renderScore(s));
                first = false;
            }
        }
        return sb.toString();
    }

    static String renderScore(double s) {
        return new BigDecimal(s).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
    }

    public static String digest(List<Entity> entities) {
        byte[] h = newDigest().digest(canonicalForm(entities).getBytes(StandardCharsets.UTF_8));
        return hex(h);
    }

    /** Compute and store the digest on the ledger; returns it. */
    public static String stamp(Ledger ledger) {
        String d = digest(ledger.entities());
        ledger.integrityDigest(d);
        return d;
    }

    public static boolean matches(Ledger ledger) {
        return digest(ledger.entities()).equals(ledger.integrityDigest());
    }

    /**
     * Recompute-and-compare self-test for a loaded ledger.
     * An empty ledger may carry no digest; anything else must match exactly.
     *
     * @throws LedgerCorruptException when the stored digest is missing or differs
     */
    public static void verify(Ledger ledger) {
        String stored = ledger.integrityDigest();
        if (stored == null || stored.isBlank()) {
            if (ledger.entities().isEmpty()) return;
            throw new LedgerCorruptException("ledger has entities but no integrity digest");
        }
        String actual = digest(ledger.entities());
        if (!actual.equals(stored)) {
            throw new LedgerCorruptException("integrity digest mismatch: stored " + stored + ", computed " + actual);
        }
    }

    static String hex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    static MessageDigest newDigest() {
        try { return MessageDigest.getInstance("SHA-256"); }
        catch (NoSuchAlgorithmException e) { throw new IllegalStateException("SHA-256 not available", e); }
    }
}
