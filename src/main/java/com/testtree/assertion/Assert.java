package com.testtree.assertion;

import java.util.Objects;

/**
 * The few assertions test bodies need without pulling in an assertion library.
 * Every failed check throws {@link AssertionMismatch}.
 *
 * Bodies may equally use AssertJ, TestNG or JUnit assertions; anything extending
 * {@link AssertionError} is reported as a failure.
 */
public final class Assert {

    public static final double DEFAULT_EPSILON = 0.00001;

    private Assert() {}

    public static void fail(String message) {
        throw new AssertionMismatch(message);
    }

    public static void assertTrue(boolean condition, String message) {
        if (!condition) fail(message);
    }

    public static void assertTrue(boolean condition) {
        assertTrue(condition, "expected true but got false");
    }

    public static void assertFalse(boolean condition, String message) {
        if (condition) fail(message);
    }

    public static void assertFalse(boolean condition) {
        assertFalse(condition, "expected false but got true");
    }

    public static void assertEquals(Object expected, Object actual) {
        if (!Objects.equals(expected, actual)) {
            fail("expected " + expected + " but got " + actual);
        }
    }

    public static void assertEquals(Object expected, Object actual, String message) {
        if (!Objects.equals(expected, actual)) {
            fail(message + ": expected " + expected + " but got " + actual);
        }
    }

    public static void assertFloatEquals(double expected, double actual) {
        assertFloatEquals(expected, actual, DEFAULT_EPSILON);
    }

    public static void assertFloatEquals(double expected, double actual, double epsilon) {
        if (!cmpFloat(expected, actual, epsilon)) {
            fail("expected " + expected + " but got " + actual + " (relative epsilon " + epsilon + ")");
        }
    }

    /**
     * True when {@code a} and {@code b} differ by at most {@code epsilon} relative to
     * either of them.
     */
    public static boolean cmpFloat(double a, double b, double epsilon) {
        double diff = Math.abs(a - b);
        return diff <= epsilon * Math.abs(a) || diff <= epsilon * Math.abs(b);
    }

    public static boolean cmpFloat(double a, double b) {
        return cmpFloat(a, b, DEFAULT_EPSILON);
    }
}
