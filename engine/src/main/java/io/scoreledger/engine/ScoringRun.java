// file: engine/src/main/java/io/scoreledger/engine/ScoringRun.java
package io.scoreledger.engine;

import io.scoreledger.core.AbortReason;
import io.scoreledger.core.PersistFailureException;
import io.scoreledger.core.RunAbortedException;
import io.scoreledger.core.digest.IntegrityStamper;
import io.scoreledger.core.ledger.Discovery;
import io.scoreledger.core.ledger.Entity;
import io.scoreledger.core.ledger.Ledger;
import io.scoreledger.core.ledger.LedgerManager;
import io.scoreledger.core.ledger.SlotMode;
import io.scoreledger.core.resolve.EntityResolver;
import io.scoreledger.core.resolve.MeasurementIndex;
import io.scoreledger.core.score.BoardScorer;
import io.scoreledger.core.score.EntityScore;
import io.scoreledger.core.score.SourceResult;
import io.scoreledger.storage.JsonLedgerStore;
import io.scoreledger.storage.LedgerStore;
import io.scoreledger.storage.StatusFile;
import io.scoreledger.storage.dto.BoardStatus;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One board's daily batch:
 * <pre>
 *   LOAD -> RESOLVE_DATE_SLOT -> MERGE_NEW_ENTITIES -> APPLY_SCORES
 *        -> RECOMPUTE_RANKS -> STAMP -> PERSIST -> PERSISTED
 * </pre>
 * Any {@link RunAbortedException} ends the run in ABORTED with nothing written.
 * A dry run stops after STAMP in REPORTED.
 * <p>
 * Responsibilities:
 *  - Drive {@link LedgerManager} and {@link BoardScorer} over a freshly loaded ledger.
 *  - Refuse to publish a ranking with no qualified entity.
 *  - Persist only a ledger the store has verified to load back intact.
 *  - Report the outcome to the notifier, the publisher and the status file.
 * <p>
 * Single-threaded; one instance per board per invocation.
 */
public final class ScoringRun {
    private static final Logger log = Logger.getLogger(ScoringRun.class.getName());

    private final EngineConfig.Board board;
    private final LedgerStore store;
    private final EntityResolver resolver;
    private final LedgerManager manager;
    private final BoardScorer scorer;
    private final int topN;
    private final Notifier notifier;
    private final LedgerPublisher publisher;
    private final StatusFile statusFile; // optional
    private final Clock clock;

    private RunState state = RunState.LOAD;

    public ScoringRun(
            EngineConfig.Board board,
            LedgerStore store,
            EntityResolver resolver,
            Map<String, String> groups,
            int topN,
            Notifier notifier,
            LedgerPublisher publisher,
            StatusFile statusFile,
            Clock clock
    ) {
        this.board = Objects.requireNonNull(board, "board");
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.manager = new LedgerManager(resolver, board.minDiscoverySources(), groups);
        this.scorer = new BoardScorer(board.spec());
        this.topN = topN;
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.statusFile = statusFile;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Wire a run for one configured board with the JSON ledger store. */
    public static ScoringRun forBoard(
            EngineConfig config,
            EngineConfig.Board board,
            Notifier notifier,
            LedgerPublisher publisher,
            Clock clock
    ) {
        return new ScoringRun(
                board,
                new JsonLedgerStore(board.ledger()),
                new EntityResolver(config.aliases()),
                config.groups(),
                config.summaryTopN(),
                notifier,
                publisher,
                config.statusFile().map(StatusFile::new).orElse(null),
                clock
        );
    }

    public RunState state() {
        return state;
    }

    /**
     * @param measurements source id -> today's result, for every source of the board
     * @param date         run date, the ledger's slot key
     * @param dryRun       compute and report only
     */
    public RunOutcome execute(Map<String, SourceResult> measurements, LocalDate date, boolean dryRun) {
        if (state != RunState.LOAD) throw new IllegalStateException("run already executed: " + state);
        long startedAt = clock.millis();
        String boardId = board.id();

        RunSummary summary;
        try {
            summary = pipeline(measurements, date, dryRun);
        } catch (RunAbortedException e) {
            RunLogger.aborted(boardId, state, e);
            state = RunState.ABORTED;
            summary = RunSummary.aborted(boardId, date.toString(), e.reason(), e.getMessage());
        }

        var outcome = new RunOutcome(boardId, state, summary.abortReason(), summary, clock.millis() - startedAt);
        RunLogger.finished(outcome);
        recordStatus(outcome, dryRun);
        notifier.send(summary);
        return outcome;
    }

    private RunSummary pipeline(Map<String, SourceResult> measurements, LocalDate date, boolean dryRun) {
        String boardId = board.id();

        enter(RunState.LOAD);
        Ledger ledger = store.load().orElseGet(Ledger::empty);
        IntegrityStamper.verify(ledger);

        enter(RunState.RESOLVE_DATE_SLOT);
        SlotMode mode = manager.resolveDateSlot(ledger, date);

        enter(RunState.MERGE_NEW_ENTITIES);
        MeasurementIndex index = MeasurementIndex.build(measurements, ledger.roster(), resolver);
        Discovery discovery = manager.mergeNewEntities(ledger, index);
        RunLogger.resolution(boardId, index, discovery);

        enter(RunState.APPLY_SCORES);
        Map<String, EntityScore> scores = scorer.score(ledger.roster(), index);
        manager.applyScores(ledger, scores);

        enter(RunState.RECOMPUTE_RANKS);
        List<Entity> ranked = manager.recomputeRanks(ledger);
        if (ranked.isEmpty()) {
            if (log.isLoggable(Level.FINE)) {
                scores.forEach((name, s) -> log.fine("[%s] %s composite=%s categories=%d"
                        .formatted(boardId, name, s.composite(), s.categoriesPresent())));
            }
            throw new RunAbortedException(AbortReason.NO_QUALIFIED_ENTITIES,
                    "none of %d entities met the qualification minimum of %d"
                            .formatted(ledger.entities().size(), board.spec().qualificationMin()));
        }

        enter(RunState.STAMP);
        IntegrityStamper.stamp(ledger);

        if (dryRun) {
            state = RunState.REPORTED;
            return summarize(ledger, date, mode, ranked, scores, index, discovery);
        }

        enter(RunState.PERSIST);
        store.write(ledger);
        state = RunState.PERSISTED;

        RunSummary summary = summarize(ledger, date, mode, ranked, scores, index, discovery);
        try {
            publisher.publish(store.location(), summary);
        } catch (IOException e) {
            log.log(Level.WARNING, "[" + boardId + "] ledger persisted but not published", e);
        }
        return summary;
    }

    private void enter(RunState next) {
        state = next;
        RunLogger.transition(board.id(), next);
    }

    private RunSummary summarize(
            Ledger ledger,
            LocalDate date,
            SlotMode mode,
            List<Entity> ranked,
            Map<String, EntityScore> scores,
            MeasurementIndex index,
            Discovery discovery
    ) {
        int slot = ledger.currentSlot();
        var top = new ArrayList<RunSummary.Standing>();
        for (Entity e : ranked.subList(0, Math.min(topN, ranked.size()))) {
            top.add(new RunSummary.Standing(e.rank(), e.name(), e.history().get(slot).getAsDouble()));
        }
        return new RunSummary(
                board.id(),
                date.toString(),
                state,
                mode,
                ranked.size(),
                ledger.entities().size(),
                top,
                BoardScorer.coverage(board.spec(), scores),
                index.unavailableSources(),
                scorer.scoredSources(index).size(),
                board.sourceIds().size(),
                discovery.admitted(),
                discovery.pending(),
                index.ambiguousNames().size(),
                index.collisions(),
                null,
                null
        );
    }

    private void recordStatus(RunOutcome outcome, boolean dryRun) {
        if (statusFile == null) return;

        RunSummary s = outcome.summary();
        var status = new BoardStatus();
        status.lastRun = clock.instant().toString();
        status.runDate = s.date();
        status.state = outcome.state().name();
        status.mode = dryRun ? "dry-run" : "persist";
        status.qualified = s.qualified();
        status.total = s.total();
        if (!s.top().isEmpty()) {
            status.topEntity = s.top().get(0).name();
            status.topScore = s.top().get(0).score();
        }
        for (RunSummary.Standing st : s.top()) {
            status.top.add(new BoardStatus.TopEntry(st.name(), st.score()));
        }
        status.sourcesHit = s.sourcesHit();
        status.sourcesTotal = s.sourcesTotal();
        status.durationMillis = outcome.durationMillis();
        status.error = outcome.reason() == null ? null : outcome.reason() + ": " + s.message();

        try {
            statusFile.record(board.id(), status);
        } catch (PersistFailureException e) {
            log.log(Level.WARNING, "[" + board.id() + "] could not update " + statusFile.location(), e);
        }
    }
}
