package com.testtree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The address of a node in a test tree: an ordered sequence of (label, ordinal) steps
 * from the outermost node down to the node itself.
 *
 * Ordinals are zero-based positions among siblings, so two siblings that share a label
 * still have distinct paths. Labels are what users type on the command line; ordinals
 * are what make the address unique.
 *
 * Immutable -- {@link #append} returns a new, longer path.
 */
public final class TestPath {

    /** One step of a path: the node's label and its position among its siblings. */
    public record Step(String label, int ordinal) {
        public Step {
            Objects.requireNonNull(label, "label");
            if (ordinal < 0) {
                throw new IllegalArgumentException("ordinal must be >= 0, was " + ordinal);
            }
        }

        @Override
        public String toString() {
            return label + SEPARATOR + ordinal;
        }
    }

    public static final String SEPARATOR = ":";

    private static final TestPath ROOT = new TestPath(List.of());

    private final List<Step> steps;

    private TestPath(List<Step> steps) {
        this.steps = steps;
    }

    /** The empty path, above every top-level node. */
    public static TestPath root() {
        return ROOT;
    }

    public static TestPath of(Step... steps) {
        TestPath path = ROOT;
        for (Step step : steps) {
            path = path.append(step);
        }
        return path;
    }

    // ── Operations ────────────────────────────────────────────────────────────

    public TestPath append(Step step) {
        Objects.requireNonNull(step, "step");
        List<Step> longer = new ArrayList<>(steps.size() + 1);
        longer.addAll(steps);
        longer.add(step);
        return new TestPath(Collections.unmodifiableList(longer));
    }

    public TestPath append(String label, int ordinal) {
        return append(new Step(label, ordinal));
    }

    /**
     * Renders the path as a colon-joined chain, e.g. {@code suite:0:comparator:1}.
     */
    public String render() {
        return steps.stream().map(Step::toString).collect(Collectors.joining(SEPARATOR));
    }

    /** True when this path's steps are the leading steps of {@code other} (or equal to them). */
    public boolean isPrefixOf(TestPath other) {
        if (other.steps.size() < steps.size()) return false;
        return other.steps.subList(0, steps.size()).equals(steps);
    }

    /** The label sequence without ordinals, as matched by selection filters. */
    public List<String> labels() {
        return steps.stream().map(Step::label).toList();
    }

    /** Labels joined by {@link #SEPARATOR}, e.g. {@code suite:comparator}. */
    public String labelPath() {
        return String.join(SEPARATOR, labels());
    }

    /**
     * True when this path's label sequence starts with {@code selection}.
     * An empty selection matches every path.
     */
    public boolean matchesLabels(List<String> selection) {
        if (selection.size() > steps.size()) return false;
        for (int i = 0; i < selection.size(); i++) {
            if (!steps.get(i).label().equals(selection.get(i))) return false;
        }
        return true;
    }

    public List<Step> getSteps() { return steps; }
    public int        size()     { return steps.size(); }
    public boolean    isEmpty()  { return steps.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestPath other)) return false;
        return steps.equals(other.steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
