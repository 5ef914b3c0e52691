// file: core/src/main/java/io/scoreledger/core/resolve/Resolution.java
package io.scoreledger.core.resolve;

/**
 * Outcome of resolving one raw name against a roster:
 *  - Matched: the raw name belongs to exactly one roster entry.
 *  - NoMatch: it does not, with the name a new entity would carry and why.
 */
public sealed interface Resolution permits Resolution.Matched, Resolution.NoMatch {

    /** Which tier produced the match. */
    enum Tier { EXACT, ALIAS, CONTAINMENT, TOKEN_OVERLAP }

    record Matched(String name, Tier tier) implements Resolution {}

    /**
     * @param candidateName cleaned (or alias-mapped) name, used for discovery
     * @param reason        UNKNOWN is a discovery candidate; AMBIGUOUS and BLANK are not
     */
    record NoMatch(String candidateName, Reason reason) implements Resolution {
        public enum Reason { UNKNOWN, AMBIGUOUS, BLANK }
    }

    default boolean matched() {
        return this instanceof Matched;
    }
}
