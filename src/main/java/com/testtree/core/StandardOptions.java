package com.testtree.core;

/**
 * Options the framework itself reads. Declared by {@link com.testtree.cli.TestMain}
 * before any suite declares its own.
 */
public final class StandardOptions {

    public static final String DISPLAY          = "display";
    public static final String VERBOSE          = "verbose";
    public static final String OUTPUT_JSON_FILE = "output-json-file";

    private StandardOptions() {}

    public static void declareAll(ConfigRegistry registry) {
        registry.declare(DISPLAY, "true", "Print one progress symbol per finished test.");
        registry.declare(VERBOSE, "false", "Log every test start and result.");
        registry.declare(OUTPUT_JSON_FILE, "", "Write a JSON report of the run to this file.");
    }
}
