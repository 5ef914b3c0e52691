// file: core/src/main/java/io/scoreledger/core/resolve/NameForms.java
package io.scoreledger.core.resolve;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic string forms of an entity name used by {@link EntityResolver}.
 * <p>
 * Two forms:
 *  - cleaned:    decoration stripped, original casing kept. Used for exact
 *                comparison and as the display name of a discovered entity.
 *  - normalized: lowercase, separators unified, version dashes turned into dots.
 *                Used for containment and token-overlap matching only, never shown.
 * <p>
 * Examples:
 *  - "🆕 anthropic/claude-opus-4-6 (thinking)" cleans to "claude-opus-4-6"
 *    and normalizes to "claude opus 4.6".
 *  - "Qwen3-Coder 480B/A35B Instruct" keeps its slash: the part before it is not
 *    a lowercase org slug.
 */
public final class NameForms {

    // Anything before the first letter or digit: emoji, bullets, stray punctuation.
    private static final Pattern LEADING_DECORATION = Pattern.compile("^[^\\p{L}\\p{N}]+");
    private static final Pattern ORG_SLUG = Pattern.compile("^[a-z0-9_\\-]+$");
    private static final Pattern TRAILING_QUALIFIER = Pattern.compile(
            "\\s*\\((zero shot|scratchpad|thinking|high reasoning)\\)\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DIGIT_DASH_DIGIT = Pattern.compile("(\\d)\\s*-\\s*(\\d)");
    private static final Pattern VERSION_PREFIX = Pattern.compile("\\bv(\\d)");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}.\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameForms() {
        // utility
    }

    /**
     * Strip decorative prefixes, an org-path prefix and known raw-API suffixes.
     * Casing is preserved.
     */
    public static String clean(String raw) {
        if (raw == null) return "";
        String s = LEADING_DECORATION.matcher(raw.strip()).replaceFirst("");

        int slash = s.indexOf('/');
        if (slash > 0 && ORG_SLUG.matcher(s.substring(0, slash)).matches()) {
            s = s.substring(slash + 1);
        }

        s = TRAILING_QUALIFIER.matcher(s).replaceFirst("");
        return s.strip();
    }

    /**
     * Lowercased matching form. The digit-dash rule runs before dashes become
     * spaces, otherwise "4-5" could never turn into "4.5".
     */
    public static String normalize(String raw) {
        String s = clean(raw).toLowerCase(Locale.ROOT);
        s = DIGIT_DASH_DIGIT.matcher(s).replaceAll("$1.$2");
        s = s.replace('-', ' ').replace('_', ' ');
        s = VERSION_PREFIX.matcher(s).replaceAll("$1");
        s = PUNCTUATION.matcher(s).replaceAll(" ");
        return WHITESPACE.matcher(s).replaceAll(" ").strip();
    }

    /** Word set of the normalized form. */
    public static Set<String> tokens(String raw) {
        String n = normalize(raw);
        if (n.isEmpty()) return Set.of();
        return new LinkedHashSet<>(Arrays.asList(n.split(" ")));
    }
}
