package com.testtree.report;

import com.testtree.model.LeafResult;
import com.testtree.model.OutcomeKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregate of one run: every leaf result in execution order, counts per
 * {@link OutcomeKind}, cumulative leaf time and wall-clock time.
 *
 * A run is OK when it has no FAILED and no ERRORED leaf. Skipped and todo leaves never
 * affect OK-ness.
 *
 * Recording is pure accumulation and never throws on an outcome.
 */
public class RunReport {

    private final Instant                  startedAt;
    private final List<LeafResult>         results = new ArrayList<>();
    private final Map<OutcomeKind, Integer> counts = new EnumMap<>(OutcomeKind.class);

    private Duration leafTime  = Duration.ZERO;
    private Duration wallClock = Duration.ZERO;

    public RunReport(Instant startedAt) {
        this.startedAt = startedAt;
        for (OutcomeKind kind : OutcomeKind.values()) {
            counts.put(kind, 0);
        }
    }

    // ── Accumulation ──────────────────────────────────────────────────────────

    public void record(LeafResult result) {
        results.add(result);
        counts.merge(result.kind(), 1, Integer::sum);
        leafTime = leafTime.plus(result.duration());
    }

    public void finish(Duration wallClock) {
        this.wallClock = wallClock;
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public Instant          getStartedAt() { return startedAt; }
    public List<LeafResult> getResults()   { return Collections.unmodifiableList(results); }
    public Duration         getLeafTime()  { return leafTime; }
    public Duration         getWallClock() { return wallClock; }
    public int              size()         { return results.size(); }

    public int count(OutcomeKind kind) {
        return counts.get(kind);
    }

    /** Counts for every kind, including zero counts, in declaration order. */
    public Map<OutcomeKind, Integer> getCounts() {
        return Collections.unmodifiableMap(counts);
    }

    /** Counts for the kinds that occurred at least once. */
    public Map<OutcomeKind, Integer> getNonZeroCounts() {
        Map<OutcomeKind, Integer> nonZero = new EnumMap<>(OutcomeKind.class);
        counts.forEach((kind, n) -> {
            if (n > 0) nonZero.put(kind, n);
        });
        return nonZero;
    }

    public boolean isOk() {
        return count(OutcomeKind.FAILED) == 0 && count(OutcomeKind.ERRORED) == 0;
    }

    /** FAILED and ERRORED results, in execution order. */
    public List<LeafResult> failures() {
        return results.stream()
            .filter(r -> r.kind().isProblem())
            .toList();
    }

    /** 0 when OK, 1 otherwise. */
    public int exitCode() {
        return isOk() ? 0 : 1;
    }

    /** e.g. {@code "3 test(s): PASSED=1, FAILED=1, SKIPPED=1"} */
    public String countsSummary() {
        String byKind = getNonZeroCounts().entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
        return results.size() + " test(s)" + (byKind.isEmpty() ? "" : ": " + byKind);
    }

    @Override
    public String toString() {
        return String.format("RunReport{%s, ok=%b, wallClock=%dms}",
            countsSummary(), isOk(), wallClock.toMillis());
    }
}
