package com.testtree.executor;

import com.testtree.core.ResolvedConfig;
import com.testtree.model.TestPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Passed to every {@link TestBody} when it runs. One instance per leaf execution,
 * never shared.
 *
 * Carries:
 *   - the leaf's {@link TestPath}
 *   - the resolved configuration (read-only)
 *   - the skip/todo flag, which a body may set once
 *   - a stack of scoped resources, released in reverse order of registration when
 *     the body finishes, however it finishes
 *
 * <pre>
 *   TestNode.leaf("reads fixture", ctx -> {
 *       if (ctx.skipIf(!Files.exists(FIXTURE), "fixture not generated")) return;
 *       Path work = ctx.createTempDirectory();
 *       ...
 *   });
 * </pre>
 */
public class TestContext {

    private static final Logger log = LoggerFactory.getLogger(TestContext.class);

    /** What the body declared about itself before finishing. */
    public enum Pending { NONE, SKIP, TODO }

    private record Release(String description, AutoCloseable action) {}

    private final TestPath       path;
    private final ResolvedConfig config;
    private final Deque<Release> releases = new ArrayDeque<>();

    private Pending pending = Pending.NONE;
    private String  pendingReason;
    private boolean finished;

    public TestContext(TestPath path, ResolvedConfig config) {
        this.path   = Objects.requireNonNull(path, "path");
        this.config = Objects.requireNonNull(config, "config");
    }

    // ── Skip / todo ───────────────────────────────────────────────────────────

    /**
     * Marks this leaf as skipped. The body should return right after; whatever it does
     * afterwards, the leaf is reported as skipped.
     *
     * @throws IllegalStateException when skip or todo was already declared
     */
    public void skip(String reason) {
        declare(Pending.SKIP, reason);
    }

    /**
     * Skips when {@code condition} holds.
     *
     * @return {@code condition}, so a body can write {@code if (ctx.skipIf(...)) return;}
     */
    public boolean skipIf(boolean condition, String reason) {
        if (condition) {
            skip(reason);
        }
        return condition;
    }

    /**
     * Marks this leaf as unfinished. The leaf is reported as todo, and the first fault
     * that ends the body is not escalated to a failure or error.
     *
     * @throws IllegalStateException when skip or todo was already declared
     */
    public void todo(String reason) {
        declare(Pending.TODO, reason);
    }

    private void declare(Pending kind, String reason) {
        if (pending != Pending.NONE) {
            throw new IllegalStateException(
                "Test " + path + " already declared " + pending + " (" + pendingReason +
                "); cannot also declare " + kind);
        }
        this.pending       = kind;
        this.pendingReason = reason != null ? reason : "";
        log.debug("TestContext: {} declared {} -- {}", path, kind, pendingReason);
    }

    public Pending getPending()       { return pending; }
    public String  getPendingReason() { return pendingReason; }
    public boolean isSkipRequested()  { return pending == Pending.SKIP; }
    public boolean isTodo()           { return pending == Pending.TODO; }

    // ── Configuration ─────────────────────────────────────────────────────────

    public TestPath       getPath()   { return path; }
    public ResolvedConfig getConfig() { return config; }

    /** Shorthand for {@code getConfig().get(name)}. */
    public String option(String name) {
        return config.get(name);
    }

    // ── Scoped resources ──────────────────────────────────────────────────────

    /**
     * Registers a release action to run when the leaf finishes.
     */
    public void defer(String description, AutoCloseable action) {
        Objects.requireNonNull(action, "action");
        if (finished) {
            throw new IllegalStateException("Test " + path + " already finished; cannot register " + description);
        }
        releases.push(new Release(description, action));
    }

    /**
     * Registers {@code resource} to be closed when the leaf finishes and returns it.
     */
    public <T extends AutoCloseable> T register(T resource) {
        defer(resource.toString(), resource);
        return resource;
    }

    /** A fresh temporary directory, deleted with its contents when the leaf finishes. */
    public Path createTempDirectory() throws IOException {
        Path dir = Files.createTempDirectory("testtree-");
        defer("temp directory " + dir, () -> deleteRecursively(dir));
        return dir;
    }

    /** A fresh temporary file, deleted when the leaf finishes. */
    public Path createTempFile(String prefix, String suffix) throws IOException {
        Path file = Files.createTempFile(prefix, suffix);
        defer("temp file " + file, () -> Files.deleteIfExists(file));
        return file;
    }

    /**
     * Runs every registered release action, most recent first. Every action runs even
     * when an earlier one fails, whatever it throws; the runner decides what is fatal.
     *
     * @return the failures, in the order they happened; empty when all succeeded
     */
    List<Throwable> releaseAll() {
        finished = true;
        List<Throwable> failures = new ArrayList<>();
        while (!releases.isEmpty()) {
            Release release = releases.pop();
            try {
                release.action().close();
            } catch (Throwable t) {
                log.warn("TestContext: releasing {} for {} failed: {}",
                    release.description(), path, t.toString());
                failures.add(t);
            }
        }
        return failures;
    }

    int pendingReleases() {
        return releases.size();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) return;
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }
}
