// file: engine/src/main/java/io/scoreledger/engine/RunConfig.java
package io.scoreledger.engine;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * One invocation's options, parsed from CLI args.
 *
 * Supports:
 *  - command:          run (default), verify or restamp
 *  - configPath:       JSON deployment config
 *  - measurementsPath: today's per-source measurements (run only)
 *  - boardId:          limit the command to one board; null means all boards
 *  - date:             run date; null means today (UTC)
 *  - dryRun:           compute and report, never write the ledger
 *  - help:             print usage and do nothing else
 */
public record RunConfig(
        Command command,
        Path configPath,
        Path measurementsPath,
        String boardId,
        LocalDate date,
        boolean dryRun,
        boolean help
) {

    public enum Command { RUN, VERIFY, RESTAMP }

    static final String DEFAULT_CONFIG = "scoreledger.json";

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --config,       -c   <path>
     *   --measurements, -m   <path>
     *   --board,        -b   <id>
     *   --date,         -d   <yyyy-MM-dd>
     *   --dry-run
     *   --help,         -h
     *
     * @throws IllegalArgumentException on unknown flags, missing values or bad dates
     */
    public static RunConfig fromArgs(String[] args) {
        Command command = Command.RUN;
        String config = DEFAULT_CONFIG;
        String measurements = null;
        String board = null;
        LocalDate date = null;
        boolean dryRun = false;
        boolean help = false;

        int i = 0;
        if (args.length > 0 && !args[0].startsWith("-")) {
            try {
                command = Command.valueOf(args[0].toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown command: " + args[0], e);
            }
            i = 1;
        }

        for (; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--config", "-c" -> config = value(args, i++);

                case "--measurements", "-m" -> measurements = value(args, i++);

                case "--board", "-b" -> board = value(args, i++);

                case "--date", "-d" -> {
                    String d = value(args, i++);
                    try {
                        date = LocalDate.parse(d);
                    } catch (DateTimeParseException e) {
                        throw new IllegalArgumentException("Invalid date (expected yyyy-MM-dd): " + d, e);
                    }
                }

                case "--dry-run" -> dryRun = true;

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (!help) {
            if (command == Command.RUN && measurements == null) {
                throw new IllegalArgumentException("run needs --measurements <path>");
            }
            if (command == Command.RESTAMP && board == null) {
                throw new IllegalArgumentException("restamp needs --board <id>");
            }
        }

        return new RunConfig(
                command,
                Path.of(config),
                measurements == null ? null : Path.of(measurements),
                board,
                date,
                dryRun,
                help
        );
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    static String usage() {
        return """
            Usage: scoreledger [run|verify|restamp] [options]

            Commands:
              run       Score today's measurements and update each board's ledger (default)
              verify    Check every ledger's structure and integrity digest
              restamp   Recompute and store the digest of one board after a manual edit

            Options:
              --config,       -c   Path to JSON config (default: scoreledger.json)
              --measurements, -m   Path to today's measurements JSON (required for run)
              --board,        -b   Only this board (required for restamp)
              --date,         -d   Run date yyyy-MM-dd (default: today, UTC)
              --dry-run            Compute and report without writing the ledger
              --help,         -h   Show this help message
            """;
    }
}
