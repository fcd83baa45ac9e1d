package com.testtree.util;

import java.util.List;

/**
 * Renders a {@link Throwable} into the diagnostic text read by {@link DiagnosticLocator}.
 *
 * The first line is the throwable's {@code toString()}; each following line is one
 * {@code at ...} frame. Frames of the JDK, of assertion libraries and of this
 * framework's own assertion helpers are left out so that the first frame with a
 * location is the line of the test that failed.
 */
public final class StackTraceRenderer {

    static final List<String> HIDDEN_FRAME_PREFIXES = List.of(
        "java.",
        "javax.",
        "jdk.",
        "sun.",
        "org.assertj.",
        "org.testng.",
        "org.junit.",
        "com.testtree.assertion."
    );

    private StackTraceRenderer() {}

    public static String render(Throwable error) {
        StringBuilder sb = new StringBuilder(String.valueOf(error));
        for (StackTraceElement frame : error.getStackTrace()) {
            if (isHidden(frame)) continue;
            sb.append('\n').append("\tat ").append(frame);
        }
        return sb.toString();
    }

    /** {@code SimpleName: message}, or just the simple name when there is no message. */
    public static String describe(Throwable error) {
        String name = error.getClass().getSimpleName();
        if (name.isEmpty()) name = error.getClass().getName();
        String message = error.getMessage();
        return message == null || message.isBlank() ? name : name + ": " + message;
    }

    static boolean isHidden(StackTraceElement frame) {
        String cls = frame.getClassName();
        for (String prefix : HIDDEN_FRAME_PREFIXES) {
            if (cls.startsWith(prefix)) return true;
        }
        return false;
    }
}
