package com.testtree.util;

import com.testtree.model.SourceLocation;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Recovers source locations from free-form diagnostic text such as a rendered stack trace.
 *
 * Two record shapes are recognised:
 *
 *   Backtrace records, introduced by one of {@link #BACKTRACE_PREFIXES}:
 *     Raised at file "foo.ml", line 12, characters 3-9
 *     Called from unknown location
 *
 *   Java stack frames:
 *     at com.example.MathTest.lambda$suite$0(MathTest.java:42)
 *
 * Every input line yields exactly one element -- the location when the line is a
 * recognised record that carries one, empty otherwise. Nothing here throws: a
 * malformed line, or a line number that does not fit in an int, yields empty.
 */
public final class DiagnosticLocator {

    /** Checked in this order; the first prefix a line starts with decides how it is parsed. */
    public static final List<String> BACKTRACE_PREFIXES = List.of(
        "Raised at ",
        "Re-raised at ",
        "Raised by primitive operation at ",
        "Called from "
    );

    static final String UNKNOWN_LOCATION = "unknown location";

    private static final Pattern BACKTRACE_RECORD =
        Pattern.compile("file \"([^\"]*)\", line (\\d+), characters (\\d+)-(\\d+)");

    // Optional "module@version/" or "loader//" prefix before the class name
    private static final Pattern JAVA_FRAME =
        Pattern.compile("\\s*at (?:\\S+/)?[^\\s(]+\\(([^():]+):(\\d+)\\)\\s*");

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private DiagnosticLocator() {}

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Parses {@code text} line by line, one element per line-break-separated segment, so
     * a trailing line break contributes a final empty element. Empty or null text yields
     * an empty stream. Each call starts a fresh pass over the text.
     */
    public static Stream<Optional<SourceLocation>> locate(String text) {
        if (text == null || text.isEmpty()) {
            return Stream.empty();
        }
        return Arrays.stream(LINE_BREAK.split(text, -1)).map(DiagnosticLocator::locateLine);
    }

    /** The first location found in {@code text}, if any. */
    public static Optional<SourceLocation> firstLocation(String text) {
        return locate(text)
            .flatMap(Optional::stream)
            .findFirst();
    }

    /** Parses a single line. */
    public static Optional<SourceLocation> locateLine(String line) {
        for (String prefix : BACKTRACE_PREFIXES) {
            if (line.startsWith(prefix)) {
                return parseBacktraceRecord(line.substring(prefix.length()));
            }
        }
        return parseJavaFrame(line);
    }

    // ── Parsing ───────────────────────────────────────────────────────────────

    private static Optional<SourceLocation> parseBacktraceRecord(String remainder) {
        if (UNKNOWN_LOCATION.equals(remainder)) {
            return Optional.empty();
        }
        Matcher m = BACKTRACE_RECORD.matcher(remainder);
        if (!m.matches()) {
            return Optional.empty();
        }
        return toLocation(m.group(1), m.group(2));
    }

    private static Optional<SourceLocation> parseJavaFrame(String line) {
        Matcher m = JAVA_FRAME.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }
        return toLocation(m.group(1), m.group(2));
    }

    private static Optional<SourceLocation> toLocation(String file, String lineDigits) {
        try {
            return Optional.of(new SourceLocation(file, Integer.parseInt(lineDigits)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
