// file: engine/src/main/java/io/scoreledger/engine/MeasurementLoader.java
package io.scoreledger.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scoreledger.core.score.SourceResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads the collector's hand-off file:
 * <pre>
 * {
 *   "sources": {
 *     "speed": {"alpha-v2": 80, "Beta": 40},
 *     "cost":  {"Alpha": 2.0, "Beta": 1.0},
 *     "arena": null
 *   }
 * }
 * </pre>
 * The content is untrusted. A source that is missing, null, not an object or has no
 * numeric values is {@link SourceResult.Unavailable}; non-numeric values are skipped.
 */
public final class MeasurementLoader {
    private static final Logger log = Logger.getLogger(MeasurementLoader.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MeasurementLoader() {
        // utility
    }

    /**
     * @param sourceIds sources the caller will read; each one gets a result
     */
    public static Map<String, SourceResult> load(Path file, Collection<String> sourceIds) {
        JsonNode root;
        try {
            root = MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load measurements from " + file, e);
        }
        JsonNode sources = root == null ? null : root.get("sources");
        if (sources == null || !sources.isObject()) {
            throw new IllegalArgumentException("Measurements file " + file + " has no \"sources\" object");
        }
        return fromTree(sources, sourceIds);
    }

    static Map<String, SourceResult> fromTree(JsonNode sources, Collection<String> sourceIds) {
        var out = new LinkedHashMap<String, SourceResult>();
        for (String id : sourceIds) {
            JsonNode node = sources.get(id);
            if (node == null || node.isNull()) {
                out.put(id, SourceResult.unavailable("no data"));
                continue;
            }
            if (!node.isObject()) {
                out.put(id, SourceResult.unavailable("not an object: " + node.getNodeType()));
                continue;
            }

            var values = new LinkedHashMap<String, Double>();
            int skipped = 0;
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                var f = fields.next();
                if (f.getValue().isNumber()) {
                    values.put(f.getKey(), f.getValue().asDouble());
                } else {
                    skipped++;
                }
            }
            if (skipped > 0) {
                int n = skipped;
                log.fine(() -> "Source " + id + ": skipped " + n + " non-numeric values");
            }
            out.put(id, SourceResult.of(values));
        }

        Iterator<String> names = sources.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!sourceIds.contains(name)) {
                log.fine(() -> "Ignoring unconfigured source " + name);
            }
        }
        return out;
    }
}
