package com.testtree.core;

/**
 * Signals a broken configuration surface: a duplicate option declaration, a lookup of
 * an option nobody declared, a malformed config-file line, or a value that cannot be
 * converted to the type its option requires.
 *
 * These are programmer or setup errors, never per-test outcomes -- they abort the run.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
