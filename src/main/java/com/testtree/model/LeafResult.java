package com.testtree.model;

import java.time.Duration;

/**
 * One event of a run: which leaf ran, how it finished, and how long its body took.
 */
public record LeafResult(TestPath path, Outcome outcome, Duration duration) {

    public OutcomeKind kind() {
        return outcome.getKind();
    }
}
