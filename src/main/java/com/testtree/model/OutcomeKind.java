package com.testtree.model;

/**
 * The five ways a leaf can finish.
 *
 *   PASSED   -- the body returned normally
 *   FAILED   -- the body raised an assertion mismatch
 *   ERRORED  -- the body (or a resource release) raised any other fault
 *   SKIPPED  -- the body declared that it could not run meaningfully here
 *   TODO     -- the body declared itself unfinished; faults inside it are downgraded
 */
public enum OutcomeKind {
    PASSED('.'),
    FAILED('F'),
    ERRORED('E'),
    SKIPPED('S'),
    TODO('T');

    private final char symbol;

    OutcomeKind(char symbol) {
        this.symbol = symbol;
    }

    /** The progress symbol printed for one completed leaf of this kind. */
    public char symbol() {
        return symbol;
    }

    /** FAILED and ERRORED make a run not OK; the other kinds never do. */
    public boolean isProblem() {
        return this == FAILED || this == ERRORED;
    }
}
