// file: engine/src/main/java/io/scoreledger/engine/RunSummary.java
package io.scoreledger.engine;

import io.scoreledger.core.AbortReason;
import io.scoreledger.core.ledger.SlotMode;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Human-readable outcome of one board run, handed to the notifier and printed by the CLI.
 *
 * @param top          today's ranking, best first, at most the configured top-N
 * @param coverage     category key -> entities with a value today
 * @param sourcesHit   sources that produced at least one normalized value
 * @param discovered   entities admitted this run
 * @param pending      new names seen in too few sources
 * @param ambiguous    raw names that matched more than one roster entry equally well
 * @param collisions   raw names dropped because another spelling in the same source won
 * @param abortReason  null unless the run aborted
 */
public record RunSummary(
        String boardId,
        String date,
        RunState state,
        SlotMode slotMode,
        int qualified,
        int total,
        List<Standing> top,
        Map<String, Integer> coverage,
        Set<String> unavailableSources,
        int sourcesHit,
        int sourcesTotal,
        List<String> discovered,
        List<String> pending,
        int ambiguous,
        int collisions,
        AbortReason abortReason,
        String message
) {

    /** One ranked entity. */
    public record Standing(int rank, String name, double score) {}

    public RunSummary {
        top = List.copyOf(top);
        coverage = Map.copyOf(coverage);
        unavailableSources = Set.copyOf(unavailableSources);
        discovered = List.copyOf(discovered);
        pending = List.copyOf(pending);
    }

    public static RunSummary aborted(String boardId, String date, AbortReason reason, String message) {
        return new RunSummary(boardId, date, RunState.ABORTED, null, 0, 0, List.of(), Map.of(), Set.of(), 0, 0,
                List.of(), List.of(), 0, 0, reason, message);
    }

    public String text() {
        if (state == RunState.ABORTED) {
            return "[%s] %s ABORTED (%s): %s".formatted(boardId, date, abortReason, message);
        }

        var sb = new StringBuilder();
        sb.append("[%s] %s %s%s: %d of %d qualified, sources %d/%d%n".formatted(
                boardId, date,
                slotMode == null ? "" : slotMode.name().toLowerCase(Locale.ROOT),
                state == RunState.REPORTED ? " (dry run)" : "",
                qualified, total, sourcesHit, sourcesTotal));
        for (Standing s : top) {
            sb.append(String.format(Locale.ROOT, "  %2d. %-32s %6.2f%n", s.rank(), s.name(), s.score()));
        }
        if (!coverage.isEmpty()) {
            sb.append("  coverage:");
            coverage.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> sb.append(' ').append(e.getKey()).append('=').append(e.getValue()));
            sb.append('\n');
        }
        if (!unavailableSources.isEmpty()) {
            sb.append("  unavailable: ").append(String.join(", ", unavailableSources.stream().sorted().toList())).append('\n');
        }
        if (!discovered.isEmpty()) {
            sb.append("  new: ").append(String.join(", ", discovered)).append('\n');
        }
        if (ambiguous > 0 || collisions > 0) {
            sb.append("  ambiguous names: ").append(ambiguous).append(", duplicate spellings: ").append(collisions).append('\n');
        }
        return sb.toString().stripTrailing();
    }
}
