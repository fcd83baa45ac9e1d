package com.testtree.executor;

/**
 * The runnable part of a leaf.
 *
 * Throw (or let escape) a {@link AssertionError} to report a failed expectation; any
 * other exception is reported as an error. Use {@link TestContext#skip} or
 * {@link TestContext#todo} to report the leaf as skipped or unfinished.
 */
@FunctionalInterface
public interface TestBody {
    void run(TestContext context) throws Exception;
}
