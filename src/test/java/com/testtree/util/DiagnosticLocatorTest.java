package com.testtree.util;

import com.testtree.model.SourceLocation;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Pure text parsing -- no runner involved.
 */
public class DiagnosticLocatorTest {

    // ════════════════════════════════════════════════════════════════════════
    // Backtrace records
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void raisedAt_yieldsFileAndLine() {
        List<Optional<SourceLocation>> result =
            DiagnosticLocator.locate("Raised at file \"foo.ml\", line 12, characters 3-9").toList();

        assertThat(result).containsExactly(Optional.of(new SourceLocation("foo.ml", 12)));
    }

    @Test
    public void unknownLocation_yieldsEmpty() {
        List<Optional<SourceLocation>> result =
            DiagnosticLocator.locate("Raised at unknown location").toList();

        assertThat(result).containsExactly(Optional.empty());
    }

    @Test
    public void emptyInput_yieldsEmptySequence() {
        assertThat(DiagnosticLocator.locate("")).isEmpty();
        assertThat(DiagnosticLocator.locate(null)).isEmpty();
    }

    @Test
    public void everyPrefix_isRecognised() {
        for (String prefix : DiagnosticLocator.BACKTRACE_PREFIXES) {
            Optional<SourceLocation> loc =
                DiagnosticLocator.locateLine(prefix + "file \"src/a.ml\", line 7, characters 0-1");
            assertThat(loc).as(prefix).contains(new SourceLocation("src/a.ml", 7));
        }
    }

    @Test
    public void multiLine_yieldsOneElementPerLineInOrder() {
        String text = String.join("\n",
            "Fatal error: exception Failure(\"boom\")",
            "Raised at file \"stdlib.ml\", line 29, characters 22-33",
            "Called from unknown location",
            "Called from file \"test.ml\", line 4, characters 2-10");

        List<Optional<SourceLocation>> result = DiagnosticLocator.locate(text).toList();

        assertThat(result).containsExactly(
            Optional.empty(),
            Optional.of(new SourceLocation("stdlib.ml", 29)),
            Optional.empty(),
            Optional.of(new SourceLocation("test.ml", 4)));
        assertThat(DiagnosticLocator.firstLocation(text)).contains(new SourceLocation("stdlib.ml", 29));
    }

    @Test
    public void trailingLineBreak_yieldsFinalEmptyElement() {
        List<Optional<SourceLocation>> result =
            DiagnosticLocator.locate("Raised at file \"foo.ml\", line 12, characters 3-9\n").toList();

        assertThat(result).containsExactly(Optional.of(new SourceLocation("foo.ml", 12)), Optional.empty());
        assertThat(DiagnosticLocator.locate("\n\n")).hasSize(3);
    }

    @Test
    public void malformedRecord_yieldsEmpty() {
        assertThat(DiagnosticLocator.locateLine("Raised at file \"foo.ml\", line twelve, characters 3-9")).isEmpty();
        assertThat(DiagnosticLocator.locateLine("Raised at file \"foo.ml\", line 12")).isEmpty();
        assertThat(DiagnosticLocator.locateLine("Raised at")).isEmpty();
        assertThat(DiagnosticLocator.locateLine("raised at file \"foo.ml\", line 12, characters 3-9")).isEmpty();
    }

    @Test
    public void lineNumberOverflow_yieldsEmptyInsteadOfThrowing() {
        assertThat(DiagnosticLocator.locateLine(
            "Raised at file \"foo.ml\", line 99999999999999999999, characters 3-9")).isEmpty();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Java stack frames
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void javaFrame_yieldsFileAndLine() {
        assertThat(DiagnosticLocator.locateLine("\tat com.example.MathTest.lambda$suite$0(MathTest.java:42)"))
            .contains(new SourceLocation("MathTest.java", 42));
        assertThat(DiagnosticLocator.locateLine("at java.base/java.lang.Thread.run(Thread.java:833)"))
            .contains(new SourceLocation("Thread.java", 833));
    }

    @Test
    public void javaFrameWithoutLine_yieldsEmpty() {
        assertThat(DiagnosticLocator.locateLine("\tat jdk.internal.Foo.bar(Native Method)")).isEmpty();
        assertThat(DiagnosticLocator.locateLine("\tat com.example.Gen.run(Unknown Source)")).isEmpty();
        assertThat(DiagnosticLocator.locateLine("java.lang.IllegalStateException: at (x.java:1) nowhere")).isEmpty();
    }

    @Test
    public void firstLocation_fromRenderedThrowable() {
        IllegalStateException error = new IllegalStateException("boom");

        Optional<SourceLocation> loc = DiagnosticLocator.firstLocation(StackTraceRenderer.render(error));

        assertThat(loc).isPresent();
        assertThat(loc.get().file()).isEqualTo("DiagnosticLocatorTest.java");
        assertThat(loc.get().line()).isPositive();
    }
}
