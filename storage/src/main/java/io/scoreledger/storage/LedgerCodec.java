// file: storage/src/main/java/io/scoreledger/storage/LedgerCodec.java
package io.scoreledger.storage;

import io.scoreledger.core.LedgerCorruptException;
import io.scoreledger.core.ledger.Entity;
import io.scoreledger.core.ledger.Ledger;
import io.scoreledger.core.ledger.ScoreHistory;
import io.scoreledger.storage.dto.LedgerDocument;
import io.scoreledger.storage.dto.ModelDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps between the in-memory {@link Ledger} and its JSON document.
 * <p>
 * Decoding rejects documents that cannot form a ledger at all (missing arrays,
 * nameless models, negative ranks). Alignment, uniqueness and axis order are
 * checked afterwards by {@link Ledger#validateStructure()}.
 */
final class LedgerCodec {

    private LedgerCodec() {
        // utility
    }

    static LedgerDocument encode(Ledger ledger) {
        var doc = new LedgerDocument();
        doc.dates = new ArrayList<>(ledger.dateAxis());
        doc.models = new ArrayList<>(ledger.entities().size());
        for (Entity e : ledger.entities()) {
            var m = new ModelDocument();
            m.name = e.name();
            m.company = e.group().orElse(null);
            m.rank = e.rank();
            m.scores = new ArrayList<>(e.history().slots());
            m.qualifyingCategories = e.qualifyingCount();
            m.sourceCount = e.sourceCount();
            m.categoryValues = new LinkedHashMap<>(e.categoryValues());
            doc.models.add(m);
        }
        doc.checksum = ledger.integrityDigest();
        return doc;
    }

    static Ledger decode(LedgerDocument doc) {
        if (doc == null) throw new LedgerCorruptException("ledger document is empty");
        if (doc.dates == null) throw new LedgerCorruptException("ledger document has no \"dates\"");
        if (doc.models == null) throw new LedgerCorruptException("ledger document has no \"models\"");

        List<Entity> entities = new ArrayList<>(doc.models.size());
        for (int i = 0; i < doc.models.size(); i++) {
            ModelDocument m = doc.models.get(i);
            if (m == null) throw new LedgerCorruptException("model #" + i + " is null");
            if (m.name == null || m.name.isBlank()) throw new LedgerCorruptException("model #" + i + " has no name");
            if (m.scores == null) throw new LedgerCorruptException("model " + m.name + " has no \"scores\"");
            int rank = m.rank == null ? Entity.UNRANKED : m.rank;
            if (rank < 0) throw new LedgerCorruptException("model " + m.name + " has negative rank " + rank);

            var entity = new Entity(m.name, m.company, rank, new ScoreHistory(m.scores));
            Map<String, Double> values = m.categoryValues == null ? Map.of() : withoutNulls(m.categoryValues);
            entity.diagnostics(values, m.qualifyingCategories, m.sourceCount, rank != Entity.UNRANKED);
            entities.add(entity);
        }
        return new Ledger(doc.dates, entities, doc.checksum);
    }

    private static Map<String, Double> withoutNulls(Map<String, Double> in) {
        var out = new LinkedHashMap<String, Double>();
        in.forEach((k, v) -> {
            if (k != null && v != null) out.put(k, v);
        });
        return out;
    }
}
