// file: core/src/main/java/io/scoreledger/core/resolve/EntityResolver.java
package io.scoreledger.core.resolve;

import io.scoreledger.core.resolve.Resolution.Matched;
import io.scoreledger.core.resolve.Resolution.NoMatch;
import io.scoreledger.core.resolve.Resolution.Tier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a raw, source-provided name onto a canonical roster name.
 * <p>
 * Tiers, first hit wins:
 *  1) exact:         cleaned raw name equals a cleaned roster name (ignoring case)
 *  2) alias:         the alias table maps the raw name to a roster name
 *  3) containment:   one normalized form contains the other
 *  4) token overlap: normalized word sets share at least two tokens
 * <p>
 * Ties are never broken by guessing. Within a tier:
 *  - exact:       several hits resolve only if exactly one equals the cleaned name verbatim
 *  - containment: the hit whose normalized length is closest to the candidate's wins
 *  - overlap:     the hit with the largest overlap wins
 * and an unbroken tie returns {@link NoMatch.Reason#AMBIGUOUS}, which also stops the cascade.
 * <p>
 * Pure: same raw name, roster and alias table always give the same result.
 */
public final class EntityResolver {

    static final int MIN_TOKEN_OVERLAP = 2;

    private final AliasTable aliases;

    public EntityResolver(AliasTable aliases) {
        this.aliases = Objects.requireNonNull(aliases, "aliases");
    }

    public AliasTable aliases() {
        return aliases;
    }

    public Resolution resolve(String rawName, List<String> roster) {
        Objects.requireNonNull(roster, "roster");
        String cleaned = NameForms.clean(rawName);
        if (cleaned.isEmpty()) {
            return new NoMatch("", NoMatch.Reason.BLANK);
        }

        // 1) exact on cleaned forms
        List<String> exact = new ArrayList<>();
        for (String name : roster) {
            if (NameForms.clean(name).equalsIgnoreCase(cleaned)) exact.add(name);
        }
        if (!exact.isEmpty()) {
            return pickExact(exact, cleaned, Tier.EXACT);
        }

        // 2) alias table; an unknown target still becomes the candidate for later tiers
        String candidate = cleaned;
        Optional<String> target = aliases.lookup(rawName);
        if (target.isPresent()) {
            String t = target.get();
            List<String> hits = new ArrayList<>();
            for (String name : roster) {
                if (name.equalsIgnoreCase(t) || NameForms.clean(name).equalsIgnoreCase(t)) hits.add(name);
            }
            if (!hits.isEmpty()) {
                return pickExact(hits, t, Tier.ALIAS);
            }
            candidate = t;
        }

        String norm = NameForms.normalize(candidate);
        if (norm.isEmpty()) {
            return new NoMatch(candidate, NoMatch.Reason.UNKNOWN);
        }

        // 3) containment, closest length wins
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        boolean tied = false;
        for (String name : roster) {
            String n = NameForms.normalize(name);
            if (n.isEmpty() || !(n.contains(norm) || norm.contains(n))) continue;
            int distance = Math.abs(n.length() - norm.length());
            if (distance < bestDistance) {
                best = name;
                bestDistance = distance;
                tied = false;
            } else if (distance == bestDistance) {
                tied = true;
            }
        }
        if (best != null) {
            return tied ? new NoMatch(candidate, NoMatch.Reason.AMBIGUOUS) : new Matched(best, Tier.CONTAINMENT);
        }

        // 4) token overlap, largest overlap wins
        Set<String> tokens = NameForms.tokens(candidate);
        best = null;
        int bestOverlap = MIN_TOKEN_OVERLAP - 1;
        tied = false;
        for (String name : roster) {
            int overlap = 0;
            for (String t : NameForms.tokens(name)) {
                if (tokens.contains(t)) overlap++;
            }
            if (overlap > bestOverlap) {
                best = name;
                bestOverlap = overlap;
                tied = false;
            } else if (overlap == bestOverlap && best != null) {
                tied = true;
            }
        }
        if (best != null) {
            return tied ? new NoMatch(candidate, NoMatch.Reason.AMBIGUOUS) : new Matched(best, Tier.TOKEN_OVERLAP);
        }

        return new NoMatch(candidate, NoMatch.Reason.UNKNOWN);
    }

    private static Resolution pickExact(List<String> hits, String wanted, Tier tier) {
        if (hits.size() == 1) return new Matched(hits.get(0), tier);

        String verbatim = null;
        for (String h : hits) {
            if (h.equals(wanted)) {
                if (verbatim != null) return new NoMatch(wanted, NoMatch.Reason.AMBIGUOUS);
                verbatim = h;
            }
        }
        return verbatim != null
                ? new Matched(verbatim, tier)
                : new NoMatch(wanted, NoMatch.Reason.AMBIGUOUS);
    }
}
