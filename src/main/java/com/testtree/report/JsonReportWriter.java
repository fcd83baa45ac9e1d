package com.testtree.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.testtree.executor.RunListener;
import com.testtree.model.LeafResult;
import com.testtree.model.OutcomeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Writes a machine-readable JSON report of a run.
 *
 * <pre>
 * {
 *   "startedAt" : "2026-10-18T09:12:44.120Z",
 *   "host" : "build-agent-7",
 *   "ok" : false,
 *   "wallClockMillis" : 12,
 *   "counts" : { "PASSED" : 1, "FAILED" : 1, ... },
 *   "tests" : [ { "path" : "suite:0:b:1", "labelPath" : "suite:b", "kind" : "FAILED",
 *                 "message" : "expected 1 but got 2", "location" : "SuiteTest.java:31",
 *                 "durationMillis" : 0.41 }, ... ]
 * }
 * </pre>
 *
 * Used as a {@link RunListener} the report is written when the run finishes; a write
 * failure is logged and never changes the run's verdict.
 */
public class JsonReportWriter implements RunListener {

    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

    private final Path         target;
    private final ObjectMapper mapper;

    public JsonReportWriter(Path target) {
        this.target = target;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TestEntry(String path, String labelPath, OutcomeKind kind, String message,
                            String location, String note, double durationMillis) {}

    public record ReportDocument(Instant startedAt, String host, boolean ok, long wallClockMillis,
                                 Map<OutcomeKind, Integer> counts, List<TestEntry> tests) {}

    // ── Primary API ───────────────────────────────────────────────────────────

    @Override
    public void onRunFinished(RunReport report) {
        try {
            write(report);
        } catch (UncheckedIOException e) {
            log.error("JsonReportWriter: could not write report to {}: {}", target, e.getMessage());
        }
    }

    /**
     * Writes {@code report} to the target file, creating parent directories as needed.
     *
     * @throws UncheckedIOException when the file cannot be written
     */
    public void write(RunReport report) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            mapper.writeValue(target.toFile(), toDocument(report));
            log.info("JsonReportWriter: wrote {} result(s) to {}", report.size(), target.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write JSON report to " + target, e);
        }
    }

    public String toJson(RunReport report) {
        try {
            return mapper.writeValueAsString(toDocument(report));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    ReportDocument toDocument(RunReport report) {
        List<TestEntry> tests = report.getResults().stream()
            .map(JsonReportWriter::toEntry)
            .toList();
        return new ReportDocument(report.getStartedAt(), hostName(), report.isOk(),
            report.getWallClock().toMillis(), report.getCounts(), tests);
    }

    private static TestEntry toEntry(LeafResult r) {
        var outcome = r.outcome();
        return new TestEntry(
            r.path().render(),
            r.path().labelPath(),
            r.kind(),
            outcome.getMessage(),
            outcome.getLocation().map(Object::toString).orElse(null),
            outcome.getNote().orElse(null),
            r.duration().toNanos() / 1_000_000.0);
    }

    static String hostName() {
        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (IOException e) {
            log.debug("JsonReportWriter: host name unavailable: {}", e.getMessage());
            return "localhost";
        }
    }
}
