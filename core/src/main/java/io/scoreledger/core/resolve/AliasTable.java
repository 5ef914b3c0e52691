// file: core/src/main/java/io/scoreledger/core/resolve/AliasTable.java
package io.scoreledger.core.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, versioned mapping from known noisy spellings to canonical names.
 * <p>
 * Keys are compared case-insensitively (stored lowercased and trimmed).
 * A table is never edited in place: {@link #withAliases(String, Map)} returns a
 * new table carrying a new version label, so a resolver built at the start of a
 * run sees one consistent table for the whole run.
 */
public final class AliasTable {

    private final String version;
    private final Map<String, String> aliases;

    public AliasTable(String version, Map<String, String> aliases) {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(aliases, "aliases");
        if (version.isBlank()) throw new IllegalArgumentException("version must not be blank");

        var m = new LinkedHashMap<String, String>(aliases.size() * 2);
        for (var e : aliases.entrySet()) {
            String key = e.getKey() == null ? "" : key(e.getKey());
            String target = e.getValue() == null ? "" : e.getValue().strip();
            if (key.isEmpty() || target.isEmpty()) {
                throw new IllegalArgumentException("alias entries must have a non-blank key and target: " + e);
            }
            m.put(key, target);
        }
        this.version = version;
        this.aliases = Collections.unmodifiableMap(m);
    }

    /** Table with no aliases, version "empty". */
    public static AliasTable empty() {
        return new AliasTable("empty", Map.of());
    }

    public String version() { return version; }

    public int size() { return aliases.size(); }

    /** Read-only view, lowercased keys. */
    public Map<String, String> entries() { return aliases; }

    /**
     * Look up the raw spelling first, then its cleaned form.
     * Some keys deliberately include suffixes that cleaning would strip.
     */
    public Optional<String> lookup(String rawName) {
        if (rawName == null) return Optional.empty();
        String hit = aliases.get(key(rawName));
        if (hit == null) {
            hit = aliases.get(key(NameForms.clean(rawName)));
        }
        return Optional.ofNullable(hit);
    }

    /**
     * New table containing this table's entries plus {@code additions}
     * (additions win on key clashes).
     */
    public AliasTable withAliases(String newVersion, Map<String, String> additions) {
        var merged = new LinkedHashMap<String, String>(aliases);
        for (var e : additions.entrySet()) {
            merged.put(key(e.getKey()), e.getValue());
        }
        return new AliasTable(newVersion, merged);
    }

    private static String key(String s) {
        return s.strip().toLowerCase(Locale.ROOT);
    }

    @Override public String toString() {
        return "AliasTable{version=" + version + ", size=" + aliases.size() + "}";
    }
}
