package io.scoreledger.core.ledger;

import java.util.List;

/**
 * What {@link LedgerManager#mergeNewEntities} did with today's unmatched names.
 *
 * @param admitted  names of entities created this run, in creation order
 * @param pending   candidate names seen in too few sources to be admitted
 * @param rejected  candidate names refused outright (reserved characters)
 */
public record Discovery(List<String> admitted, List<String> pending, List<String> rejected) {
    public Discovery {
        admitted = List.copyOf(admitted);
        pending = List.copyOf(pending);
        rejected = List.copyOf(rejected);
    }
}
