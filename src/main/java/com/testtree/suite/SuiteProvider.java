package com.testtree.suite;

import com.testtree.core.ConfigRegistry;
import com.testtree.model.TestNode;

/**
 * Supplies one top-level test tree.
 *
 * Implementations must be annotated with {@link RegisterSuite} and have a no-arg
 * constructor so the {@link SuiteRegistry} can find and create them.
 */
public interface SuiteProvider {

    /** Builds the suite. Called once, before the run starts. */
    TestNode suite();

    /**
     * Declares the options this suite's tests read. Called before configuration is
     * resolved, so each option is reachable from the command line, the environment and
     * the config file.
     */
    default void declareOptions(ConfigRegistry registry) {}
}
