package com.testtree.executor;

import com.testtree.core.ResolvedConfig;
import com.testtree.model.TestPath;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestContextTest {

    private TestContext ctx;

    @BeforeMethod
    public void setUp() {
        ctx = new TestContext(TestPath.root().append("suite", 0).append("leaf", 0), ResolvedConfig.empty());
    }

    @Test
    public void skip_setsFlagAndReason() {
        assertThat(ctx.getPending()).isEqualTo(TestContext.Pending.NONE);

        ctx.skip("no network");

        assertThat(ctx.isSkipRequested()).isTrue();
        assertThat(ctx.isTodo()).isFalse();
        assertThat(ctx.getPendingReason()).isEqualTo("no network");
    }

    @Test
    public void skipIf_onlySkipsWhenConditionHolds() {
        assertThat(ctx.skipIf(false, "not now")).isFalse();
        assertThat(ctx.getPending()).isEqualTo(TestContext.Pending.NONE);

        assertThat(ctx.skipIf(true, "now")).isTrue();
        assertThat(ctx.isSkipRequested()).isTrue();
    }

    @Test
    public void flag_canBeSetOnlyOnce() {
        ctx.todo("later");

        assertThatThrownBy(() -> ctx.skip("also"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("TODO");
        assertThat(ctx.isTodo()).isTrue();
        assertThat(ctx.getPendingReason()).isEqualTo("later");
    }

    @Test
    public void releaseAll_runsInReverseOrderAndContinuesPastFailures() {
        List<String> order = new ArrayList<>();
        ctx.defer("first",  () -> order.add("first"));
        ctx.defer("second", () -> { order.add("second"); throw new IllegalStateException("stuck"); });
        ctx.defer("third",  () -> order.add("third"));

        List<Throwable> failures = ctx.releaseAll();

        assertThat(order).containsExactly("third", "second", "first");
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0)).hasMessage("stuck");
        assertThat(ctx.pendingReleases()).isZero();
    }

    @Test
    public void defer_afterFinishIsRejected() {
        ctx.releaseAll();

        assertThatThrownBy(() -> ctx.defer("late", () -> {}))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void tempDirectory_isDeletedWithContentsOnRelease() throws Exception {
        Path dir = ctx.createTempDirectory();
        Files.writeString(dir.resolve("nested.txt"), "data");
        Files.createDirectories(dir.resolve("a/b"));
        Path file = ctx.createTempFile("testtree", ".tmp");

        assertThat(dir).isDirectory();
        assertThat(file).exists();

        assertThat(ctx.releaseAll()).isEmpty();

        assertThat(dir).doesNotExist();
        assertThat(file).doesNotExist();
    }
}
