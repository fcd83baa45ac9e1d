package com.testtree.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The classified result of executing one leaf.
 *
 * <p>Immutable -- use the static factories. {@link #withNote} attaches a secondary
 * remark (for example a resource release that failed after the outcome was already
 * decided) without changing the kind.
 *
 * <pre>
 *   Outcome.passed()
 *   Outcome.failed("expected 3 but got 4", new SourceLocation("MathTest.java", 42), error)
 *   Outcome.skipped("no network in this environment")
 * </pre>
 */
public final class Outcome {

    private static final Outcome PASSED = new Outcome(OutcomeKind.PASSED, null, null, null, null);

    private final OutcomeKind    kind;
    private final String         message;   // FAILED/ERRORED: what went wrong; SKIPPED/TODO: the reason
    private final SourceLocation location;  // FAILED/ERRORED only; null when none could be recovered
    private final Throwable      error;     // the fault that decided the outcome, if any
    private final String         note;      // secondary remark that did not decide the outcome

    private Outcome(OutcomeKind kind, String message, SourceLocation location,
                    Throwable error, String note) {
        this.kind     = kind;
        this.message  = message;
        this.location = location;
        this.error    = error;
        this.note     = note;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static Outcome passed() {
        return PASSED;
    }

    public static Outcome failed(String message, SourceLocation location, Throwable error) {
        return new Outcome(OutcomeKind.FAILED, message, location, error, null);
    }

    public static Outcome errored(String message, SourceLocation location, Throwable error) {
        return new Outcome(OutcomeKind.ERRORED, message, location, error, null);
    }

    public static Outcome skipped(String reason) {
        return new Outcome(OutcomeKind.SKIPPED, reason, null, null, null);
    }

    public static Outcome todo(String reason) {
        return new Outcome(OutcomeKind.TODO, reason, null, null, null);
    }

    /**
     * Returns a copy carrying the given secondary note. The kind, message and
     * location are unchanged.
     */
    public Outcome withNote(String note) {
        return new Outcome(kind, message, location, error, note);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public OutcomeKind              getKind()     { return kind; }
    public String                   getMessage()  { return message; }
    public Optional<SourceLocation> getLocation() { return Optional.ofNullable(location); }
    public Optional<Throwable>      getError()    { return Optional.ofNullable(error); }
    public Optional<String>         getNote()     { return Optional.ofNullable(note); }

    /** The skip or todo reason; same field as the message. */
    public String getReason() { return message; }

    public boolean isPassed()  { return kind == OutcomeKind.PASSED; }
    public boolean isFailed()  { return kind == OutcomeKind.FAILED; }
    public boolean isErrored() { return kind == OutcomeKind.ERRORED; }
    public boolean isSkipped() { return kind == OutcomeKind.SKIPPED; }
    public boolean isTodo()    { return kind == OutcomeKind.TODO; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Outcome other)) return false;
        return kind == other.kind
            && Objects.equals(message, other.message)
            && Objects.equals(location, other.location)
            && Objects.equals(note, other.note);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, location, note);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Outcome{").append(kind);
        if (message != null)  sb.append(", message='").append(message).append('\'');
        if (location != null) sb.append(", at=").append(location);
        if (note != null)     sb.append(", note='").append(note).append('\'');
        return sb.append('}').toString();
    }
}
