package com.testtree.report;

import com.testtree.core.ResolvedConfig;
import com.testtree.core.StandardOptions;
import com.testtree.executor.RunListener;
import com.testtree.model.LeafResult;
import com.testtree.model.Outcome;
import com.testtree.model.OutcomeKind;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable output of a run.
 *
 * While the run is in progress one symbol is printed per finished leaf:
 *
 *   .  passed     F  failed     E  errored     S  skipped     T  todo
 *
 * When the run finishes a summary follows: every failed or errored leaf with its
 * path, message and location, then the counts by kind, the total time and the verdict.
 */
public class ConsoleReporter implements RunListener {

    private static final int    SYMBOLS_PER_LINE = 70;
    private static final String SEPARATOR        = "=".repeat(SYMBOLS_PER_LINE);

    private final PrintStream out;
    private final boolean     showProgress;
    private int printed;

    public ConsoleReporter(PrintStream out, boolean showProgress) {
        this.out          = out;
        this.showProgress = showProgress;
    }

    /** Progress symbols follow the {@code display} option. */
    public static ConsoleReporter fromConfig(PrintStream out, ResolvedConfig config) {
        boolean display = !config.has(StandardOptions.DISPLAY) || config.getBoolean(StandardOptions.DISPLAY);
        return new ConsoleReporter(out, display);
    }

    // ── Progress ──────────────────────────────────────────────────────────────

    @Override
    public void onLeafFinished(LeafResult result) {
        if (!showProgress) return;
        out.print(result.kind().symbol());
        if (++printed % SYMBOLS_PER_LINE == 0) {
            out.println();
        }
        out.flush();
    }

    @Override
    public void onRunFinished(RunReport report) {
        if (showProgress && printed % SYMBOLS_PER_LINE != 0) {
            out.println();
        }
        printSummary(report);
    }

    // ── Summary ───────────────────────────────────────────────────────────────

    public void printSummary(RunReport report) {
        List<LeafResult> failures = report.failures();
        for (LeafResult failure : failures) {
            out.println(SEPARATOR);
            out.println(formatFailure(failure));
        }
        if (!failures.isEmpty()) {
            out.println(SEPARATOR);
        }

        for (LeafResult r : report.getResults()) {
            if (r.kind() == OutcomeKind.SKIPPED || r.kind() == OutcomeKind.TODO) {
                out.println(r.kind() + " " + r.path().render() + ": " + r.outcome().getReason());
            }
        }

        out.printf(Locale.ROOT, "Ran %d test(s) in %.3f seconds.%n", report.size(), report.getWallClock().toNanos() / 1e9);
        Map<OutcomeKind, Integer> counts = report.getCounts();
        out.printf("Passed: %d, Failed: %d, Errors: %d, Skipped: %d, Todo: %d%n",
            counts.get(OutcomeKind.PASSED),
            counts.get(OutcomeKind.FAILED),
            counts.get(OutcomeKind.ERRORED),
            counts.get(OutcomeKind.SKIPPED),
            counts.get(OutcomeKind.TODO));
        out.println(report.isOk() ? "OK" : "FAILED");
        out.flush();
    }

    static String formatFailure(LeafResult result) {
        Outcome outcome = result.outcome();
        StringBuilder sb = new StringBuilder()
            .append(outcome.isFailed() ? "Failure: " : "Error: ")
            .append(result.path().render())
            .append('\n');
        outcome.getLocation().ifPresent(loc -> sb.append(loc).append(": "));
        sb.append(outcome.getMessage());
        outcome.getNote().ifPresent(note -> sb.append('\n').append("Note: ").append(note));
        return sb.toString();
    }
}
