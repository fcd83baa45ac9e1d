package com.testtree.executor;

import com.testtree.core.ResolvedConfig;
import com.testtree.core.StandardOptions;
import com.testtree.model.LeafResult;
import com.testtree.model.ListedTest;
import com.testtree.model.Outcome;
import com.testtree.model.SourceLocation;
import com.testtree.model.TestNode;
import com.testtree.model.TestPath;
import com.testtree.report.RunReport;
import com.testtree.util.DiagnosticLocator;
import com.testtree.util.StackTraceRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs a test tree.
 *
 * ## Execution model
 *
 *   1. The tree is walked depth-first, left to right. Each node gets a {@link TestPath}
 *      whose last ordinal is its position among its siblings; top-level nodes are
 *      siblings of each other.
 *   2. Leaves are selected before anything runs. With no selection every leaf runs;
 *      otherwise a leaf runs iff its label sequence starts with one of the selection
 *      entries.
 *   3. Each selected leaf runs to completion, one at a time, with a fresh
 *      {@link TestContext}. Its outcome is classified:
 *        todo declared            -> TODO     (a fault after the declaration is downgraded)
 *        skip declared            -> SKIPPED
 *        returned normally        -> PASSED
 *        threw an AssertionError  -> FAILED
 *        threw anything else      -> ERRORED
 *   4. Scoped resources are released after the body. A release failure turns PASSED or
 *      SKIPPED into ERRORED; any other outcome keeps its kind and records a note.
 *
 * Faults inside a leaf or its releases never stop the run; only {@link #isFatal fatal}
 * JVM errors such as OutOfMemoryError propagate. The runner never exits the process --
 * callers decide what to do with {@link RunReport#isOk()}.
 */
public class TestRunner {

    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    private final ResolvedConfig    config;
    private final List<RunListener> listeners;
    private final boolean           verbose;

    public TestRunner(ResolvedConfig config, List<RunListener> listeners) {
        this.config    = config;
        this.listeners = List.copyOf(listeners);
        this.verbose   = config.has(StandardOptions.VERBOSE) && config.getBoolean(StandardOptions.VERBOSE);
    }

    public TestRunner(ResolvedConfig config) {
        this(config, List.of());
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public RunReport run(TestNode root, List<List<String>> selection) {
        return run(List.of(root), selection);
    }

    /**
     * Runs every selected leaf of {@code roots}.
     *
     * @param roots     top-level nodes, in order
     * @param selection label sequences; empty runs everything
     * @return the full report, in execution order
     */
    public RunReport run(List<TestNode> roots, List<List<String>> selection) {
        List<SelectedLeaf> selected = select(roots, selection);
        log.info("TestRunner: {} of {} test(s) selected{}", selected.size(), countLeaves(roots),
            selection.isEmpty() ? "" : " by " + selection.size() + " filter(s)");

        RunReport report = new RunReport(Instant.now());
        notifyListeners(l -> l.onRunStarted(selected.size()));

        long runStart = System.nanoTime();
        for (SelectedLeaf leaf : selected) {
            notifyListeners(l -> l.onLeafStarted(leaf.path()));
            LeafResult result = execute(leaf.node(), leaf.path());
            report.record(result);
            notifyListeners(l -> l.onLeafFinished(result));
        }
        report.finish(Duration.ofNanos(System.nanoTime() - runStart));

        log.info("TestRunner: run finished -- {}", report.countsSummary());
        notifyListeners(l -> l.onRunFinished(report));
        return report;
    }

    /**
     * Every leaf of {@code roots} with its path and label path. Nothing is executed.
     */
    public static List<ListedTest> listTests(List<TestNode> roots) {
        List<ListedTest> listed = new ArrayList<>();
        walk(roots, TestPath.root(), (node, path) -> listed.add(new ListedTest(path, path.labelPath())));
        return listed;
    }

    /**
     * The selected leaves of {@code roots}, in execution order. Pure -- used by
     * {@link #run} before anything executes.
     */
    public static List<SelectedLeaf> select(List<TestNode> roots, List<List<String>> selection) {
        List<SelectedLeaf> selected = new ArrayList<>();
        walk(roots, TestPath.root(), (node, path) -> {
            if (isSelected(path, selection)) {
                selected.add(new SelectedLeaf(node, path));
            }
        });
        return selected;
    }

    /** A leaf chosen for execution and the path it was visited at. */
    public record SelectedLeaf(TestNode node, TestPath path) {}

    static boolean isSelected(TestPath path, List<List<String>> selection) {
        if (selection.isEmpty()) return true;
        for (List<String> labels : selection) {
            if (path.matchesLabels(labels)) return true;
        }
        return false;
    }

    // ── Traversal ─────────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface LeafVisitor {
        void visit(TestNode leaf, TestPath path);
    }

    private static void walk(List<TestNode> siblings, TestPath parent, LeafVisitor visitor) {
        for (int ordinal = 0; ordinal < siblings.size(); ordinal++) {
            TestNode node = siblings.get(ordinal);
            TestPath path = parent.append(node.getName(), ordinal);
            if (node.isLeaf()) {
                visitor.visit(node, path);
            } else {
                walk(node.getChildren(), path, visitor);
            }
        }
    }

    private static int countLeaves(List<TestNode> roots) {
        return roots.stream().mapToInt(TestNode::leafCount).sum();
    }

    // ── Execution ─────────────────────────────────────────────────────────────

    LeafResult execute(TestNode leaf, TestPath path) {
        TestContext ctx = new TestContext(path, config);
        if (verbose) {
            log.info("TestRunner: starting {}", path);
        }

        Throwable fault = null;
        long start = System.nanoTime();
        try {
            leaf.getBody().run(ctx);
        } catch (Throwable t) {
            if (isFatal(t)) {
                ctx.releaseAll();
                throw (VirtualMachineError) t;
            }
            fault = t;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        List<Throwable> releaseFaults = ctx.releaseAll();
        for (Throwable releaseFault : releaseFaults) {
            if (isFatal(releaseFault)) {
                throw (VirtualMachineError) releaseFault;
            }
        }
        Outcome outcome = applyReleaseFaults(classify(ctx, fault), releaseFaults);

        if (verbose) {
            log.info("TestRunner: {} -> {} in {} ms", path, outcome, elapsed.toMillis());
        } else {
            log.debug("TestRunner: {} -> {} in {} ms", path, outcome, elapsed.toMillis());
        }
        return new LeafResult(path, outcome, elapsed);
    }

    /**
     * A JVM failure the run cannot survive. A stack overflow unwinds cleanly at the
     * catch site, so it is reported against its leaf like any other fault.
     */
    static boolean isFatal(Throwable t) {
        return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
    }

    static Outcome classify(TestContext ctx, Throwable fault) {
        if (ctx.isTodo()) {
            if (fault != null) {
                log.debug("TestRunner: todo test {} raised {} -- downgraded",
                    ctx.getPath(), StackTraceRenderer.describe(fault));
            }
            return Outcome.todo(ctx.getPendingReason());
        }
        if (ctx.isSkipRequested()) {
            if (fault != null) {
                log.debug("TestRunner: skipped test {} raised {} after skipping -- ignored",
                    ctx.getPath(), StackTraceRenderer.describe(fault));
            }
            return Outcome.skipped(ctx.getPendingReason());
        }
        if (fault == null) {
            return Outcome.passed();
        }

        SourceLocation location = locate(fault);
        if (fault instanceof AssertionError) {
            String message = fault.getMessage() != null ? fault.getMessage() : "Assertion failed";
            return Outcome.failed(message, location, fault);
        }
        return Outcome.errored(StackTraceRenderer.describe(fault), location, fault);
    }

    static Outcome applyReleaseFaults(Outcome outcome, List<Throwable> releaseFaults) {
        if (releaseFaults.isEmpty()) {
            return outcome;
        }
        Throwable first = releaseFaults.get(0);
        String description = "Resource release failed: " + StackTraceRenderer.describe(first)
            + (releaseFaults.size() > 1 ? " (and " + (releaseFaults.size() - 1) + " more)" : "");

        if (outcome.isPassed() || outcome.isSkipped()) {
            return Outcome.errored(description, locate(first), first);
        }
        return outcome.withNote(description);
    }

    private static SourceLocation locate(Throwable fault) {
        return DiagnosticLocator.firstLocation(StackTraceRenderer.render(fault)).orElse(null);
    }

    private void notifyListeners(Consumer<RunListener> event) {
        for (RunListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("TestRunner: listener {} failed: {}", listener.getClass().getSimpleName(), e.toString());
            }
        }
    }
}
