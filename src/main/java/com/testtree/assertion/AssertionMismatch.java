package com.testtree.assertion;

/**
 * An expectation written by a test author did not hold. Reported as a failure, not
 * an error.
 */
public class AssertionMismatch extends AssertionError {

    public AssertionMismatch(String message) {
        super(message);
    }
}
