// file: engine/src/main/java/io/scoreledger/engine/Main.java
package io.scoreledger.engine;

import io.scoreledger.core.LedgerCorruptException;
import io.scoreledger.core.digest.IntegrityStamper;
import io.scoreledger.core.ledger.Ledger;
import io.scoreledger.storage.JsonLedgerStore;
import io.scoreledger.storage.LedgerStore;

import java.io.PrintStream;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the scoring engine.
 *
 * Responsibilities:
 *  - Parse the invocation from CLI and load the deployment config.
 *  - run:     load today's measurements and execute a {@link ScoringRun} per selected board.
 *  - verify:  check every selected ledger's structure and digest.
 *  - restamp: recompute and store one board's digest after a manual edit.
 *
 * Exit codes: 0 success, 1 a board aborted or a ledger is corrupt, 2 usage or unexpected error.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_ERROR = 2;

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, Clock.systemUTC()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, Clock clock) {
        RunConfig cfg;
        try {
            cfg = RunConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(RunConfig.usage());
            return EXIT_ERROR;
        }
        if (cfg.help()) {
            out.println(RunConfig.usage());
            return EXIT_OK;
        }

        try {
            EngineConfig engine = EngineConfig.fromJsonFile(cfg.configPath());
            List<EngineConfig.Board> boards = cfg.boardId() == null
                    ? engine.boards()
                    : List.of(engine.board(cfg.boardId()));
            log.info(() -> "Config %s: %d board(s), aliases %s"
                    .formatted(cfg.configPath(), boards.size(), engine.aliases()));

            return switch (cfg.command()) {
                case RUN -> runBoards(cfg, engine, boards, out, clock);
                case VERIFY -> verify(boards, out);
                case RESTAMP -> restamp(boards.get(0), out);
            };
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "scoreledger " + cfg.command().name().toLowerCase(Locale.ROOT) + " failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static int runBoards(RunConfig cfg, EngineConfig engine, List<EngineConfig.Board> boards,
                                 PrintStream out, Clock clock) {
        LocalDate date = cfg.date() != null ? cfg.date() : LocalDate.now(clock);
        var notifier = new LoggingNotifier();

        int exit = EXIT_OK;
        for (EngineConfig.Board board : boards) {
            var measurements = MeasurementLoader.load(cfg.measurementsPath(), board.sourceIds());
            var run = ScoringRun.forBoard(engine, board, notifier, LedgerPublisher.NONE, clock);
            RunOutcome outcome = run.execute(measurements, date, cfg.dryRun());

            out.println(outcome.summary().text());
            if (!outcome.succeeded()) exit = EXIT_FAILED;
        }
        return exit;
    }

    private static int verify(List<EngineConfig.Board> boards, PrintStream out) {
        int exit = EXIT_OK;
        for (EngineConfig.Board board : boards) {
            LedgerStore store = new JsonLedgerStore(board.ledger());
            try {
                Optional<Ledger> loaded = store.load();
                if (loaded.isEmpty()) {
                    out.printf("EMPTY   %s (no ledger at %s)%n", board.id(), store.location());
                    continue;
                }
                Ledger ledger = loaded.get();
                IntegrityStamper.verify(ledger);
                out.printf("OK      %s: %d entities, %d dates, checksum %s%n",
                        board.id(), ledger.entities().size(), ledger.slotCount(), ledger.integrityDigest());
            } catch (LedgerCorruptException e) {
                out.printf("CORRUPT %s: %s%n", board.id(), e.getMessage());
                exit = EXIT_FAILED;
            }
        }
        return exit;
    }

    private static int restamp(EngineConfig.Board board, PrintStream out) {
        LedgerStore store = new JsonLedgerStore(board.ledger());
        Optional<Ledger> loaded = store.load();
        if (loaded.isEmpty()) {
            out.printf("Nothing to restamp: no ledger at %s%n", store.location());
            return EXIT_FAILED;
        }

        Ledger ledger = loaded.get();
        String before = ledger.integrityDigest();
        String after = IntegrityStamper.stamp(ledger);
        store.write(ledger);
        log.warning(() -> "[%s] digest restamped by operator: %s -> %s".formatted(board.id(), before, after));
        out.printf("RESTAMPED %s: %s -> %s%n", board.id(), before, after);
        return EXIT_OK;
    }
}
