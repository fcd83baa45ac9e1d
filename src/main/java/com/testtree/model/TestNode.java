package com.testtree.model;

import com.testtree.executor.TestBody;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A node of a test tree: either a leaf (a runnable body bound to a name) or a group
 * (a name plus an ordered list of children).
 *
 * Trees are built once, before a run starts, and never change afterwards. Sibling
 * names may repeat; the ordinal assigned during traversal tells them apart.
 *
 * <pre>
 *   TestNode suite = TestNode.group("comparator",
 *       TestNode.leaf("equal", ctx -> Assert.assertEquals(0, cmp.compare(a, a))),
 *       TestNode.leaf("less",  ctx -> Assert.assertTrue(cmp.compare(a, b) &lt; 0)));
 * </pre>
 */
public final class TestNode {

    public enum Kind { LEAF, GROUP }

    private final Kind           kind;
    private final String         name;
    private final TestBody       body;      // LEAF only
    private final List<TestNode> children;  // GROUP only; empty for leaves

    private TestNode(Kind kind, String name, TestBody body, List<TestNode> children) {
        this.kind     = kind;
        this.name     = name;
        this.body     = body;
        this.children = children;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static TestNode leaf(String name, TestBody body) {
        Objects.requireNonNull(name, "leaf name");
        Objects.requireNonNull(body, "body of leaf '" + name + "'");
        return new TestNode(Kind.LEAF, name, body, List.of());
    }

    public static TestNode group(String name, TestNode... children) {
        return group(name, Arrays.asList(children));
    }

    public static TestNode group(String name, List<TestNode> children) {
        Objects.requireNonNull(name, "group name");
        Objects.requireNonNull(children, "children of group '" + name + "'");
        // List.copyOf rejects null children
        return new TestNode(Kind.GROUP, name, null, List.copyOf(children));
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Kind           getKind()     { return kind; }
    public String         getName()     { return name; }
    public List<TestNode> getChildren() { return children; }

    public boolean isLeaf()  { return kind == Kind.LEAF; }
    public boolean isGroup() { return kind == Kind.GROUP; }

    /**
     * The leaf's body.
     *
     * @throws IllegalStateException when called on a group
     */
    public TestBody getBody() {
        if (kind != Kind.LEAF) {
            throw new IllegalStateException("Group '" + name + "' has no body");
        }
        return body;
    }

    /** Number of leaves in this subtree. */
    public int leafCount() {
        if (kind == Kind.LEAF) return 1;
        int count = 0;
        for (TestNode child : children) {
            count += child.leafCount();
        }
        return count;
    }

    @Override
    public String toString() {
        return kind == Kind.LEAF
            ? "Leaf{" + name + "}"
            : "Group{" + name + ", " + children.size() + " child(ren)}";
    }
}
