package com.testtree.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testtree.model.Outcome;
import com.testtree.model.SourceLocation;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static com.testtree.report.RunReportTest.result;
import static org.assertj.core.api.Assertions.assertThat;

public class JsonReportWriterTest {

    private static RunReport sampleReport() {
        RunReport report = new RunReport(Instant.parse("2026-10-18T09:12:44Z"));
        report.record(result("a", 0, Outcome.passed(), 2));
        report.record(result("b", 1, Outcome.failed("expected 1 but got 2", new SourceLocation("B.java", 9), null), 3));
        report.record(result("c", 2, Outcome.skipped("no docker"), 0));
        report.finish(Duration.ofMillis(12));
        return report;
    }

    @Test
    public void write_producesParsableDocument() throws Exception {
        Path dir = Files.createTempDirectory("testtree-json");
        Path target = dir.resolve("nested/report.json");

        new JsonReportWriter(target).onRunFinished(sampleReport());

        JsonNode root = new ObjectMapper().readTree(target.toFile());
        assertThat(root.get("startedAt").asText()).isEqualTo("2026-10-18T09:12:44Z");
        assertThat(root.get("ok").asBoolean()).isFalse();
        assertThat(root.get("wallClockMillis").asLong()).isEqualTo(12);
        assertThat(root.get("host").asText()).isNotBlank();
        assertThat(root.get("counts").get("PASSED").asInt()).isEqualTo(1);
        assertThat(root.get("counts").get("TODO").asInt()).isZero();

        JsonNode tests = root.get("tests");
        assertThat(tests.size()).isEqualTo(3);
        assertThat(tests.get(1).get("path").asText()).isEqualTo("suite:0:b:1");
        assertThat(tests.get(1).get("labelPath").asText()).isEqualTo("suite:b");
        assertThat(tests.get(1).get("kind").asText()).isEqualTo("FAILED");
        assertThat(tests.get(1).get("location").asText()).isEqualTo("B.java:9");
        assertThat(tests.get(2).get("message").asText()).isEqualTo("no docker");
        assertThat(tests.get(0).has("message")).isFalse();
    }

    @Test
    public void writeFailure_isLoggedNotThrown() throws Exception {
        Path blocker = Files.createTempFile("testtree", ".blocker");
        JsonReportWriter writer = new JsonReportWriter(blocker.resolve("report.json"));

        writer.onRunFinished(sampleReport());

        assertThat(Files.isRegularFile(blocker)).isTrue();
    }
}
