package com.testtree.report;

import com.testtree.model.LeafResult;
import com.testtree.model.Outcome;
import com.testtree.model.SourceLocation;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.testtree.report.RunReportTest.result;
import static org.assertj.core.api.Assertions.assertThat;

public class ConsoleReporterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private RunReport replay(ConsoleReporter reporter, List<LeafResult> results) {
        RunReport report = new RunReport(Instant.now());
        reporter.onRunStarted(results.size());
        for (LeafResult r : results) {
            report.record(r);
            reporter.onLeafFinished(r);
        }
        report.finish(Duration.ofMillis(1500));
        reporter.onRunFinished(report);
        return report;
    }

    @Test
    public void progress_printsOneSymbolPerKind() {
        ConsoleReporter reporter = new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), true);

        replay(reporter, List.of(
            result("a", 0, Outcome.passed(), 1),
            result("b", 1, Outcome.failed("bad", null, null), 1),
            result("c", 2, Outcome.errored("IOException: gone", null, null), 1),
            result("d", 3, Outcome.skipped("later"), 1),
            result("e", 4, Outcome.todo("wip"), 1)));

        assertThat(output()).startsWith(".FEST" + System.lineSeparator());
    }

    @Test
    public void summary_listsFailuresWithPathMessageAndLocation() {
        ConsoleReporter reporter = new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), true);

        replay(reporter, List.of(
            result("a", 0, Outcome.passed(), 1),
            result("b", 1, Outcome.failed("expected 1 but got 2", new SourceLocation("SuiteTest.java", 31), null), 1),
            result("c", 2, Outcome.errored("IOException: gone", null, null).withNote("Resource release failed: x"), 1),
            result("d", 3, Outcome.skipped("no docker"), 1)));

        String out = output();
        assertThat(out)
            .contains("Failure: suite:0:b:1")
            .contains("SuiteTest.java:31: expected 1 but got 2")
            .contains("Error: suite:0:c:2")
            .contains("IOException: gone")
            .contains("Note: Resource release failed: x")
            .contains("SKIPPED suite:0:d:3: no docker")
            .contains("Ran 4 test(s) in 1.500 seconds.")
            .contains("Passed: 1, Failed: 1, Errors: 1, Skipped: 1, Todo: 0")
            .endsWith("FAILED" + System.lineSeparator());
        assertThat(out).doesNotContain("suite:0:a:0");
    }

    @Test
    public void displayOff_printsOnlyTheSummary() {
        ConsoleReporter reporter = new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), false);

        replay(reporter, List.of(result("a", 0, Outcome.passed(), 1)));

        assertThat(output()).startsWith("Ran 1 test(s)").endsWith("OK" + System.lineSeparator());
    }
}
