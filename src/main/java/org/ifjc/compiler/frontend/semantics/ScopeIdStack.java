package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.diagnostics.SemanticException;

/**
 * Produces hierarchical scope labels ("1", "1.2", "1.2.3") in document order.
 * <p>
 * Each frame remembers how many children it has opened, so siblings are numbered
 * 1, 2, 3, ... Root frames are numbered the same way across the whole program, which keeps
 * labels unique when a program has several classes.
 * <p>
 * Only {@link ScopeStack} drives this stack, so both stay the same depth.
 */
public final class ScopeIdStack {

    /** Label reported when no scope is open. */
    public static final String GLOBAL = "global";

    private final String[] paths;
    private final int[] childCounts;
    private int depth = -1;
    private int rootCount;

    /**
     * @param maxDepth Maximum nesting depth; opening a deeper scope is an internal error.
     */
    public ScopeIdStack(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum scope depth must be positive: " + maxDepth);
        }
        this.paths = new String[maxDepth];
        this.childCounts = new int[maxDepth];
    }

    /**
     * Opens a root scope. The first root is "1", the next one "2".
     * @return The new label.
     */
    public String enterRoot() {
        if (depth >= 0) {
            throw SemanticException.internal("Root scope opened inside scope " + current() + ".");
        }
        depth = 0;
        paths[0] = Integer.toString(++rootCount);
        childCounts[0] = 0;
        return paths[0];
    }

    /**
     * Opens a child of the current scope, or a root scope if none is open.
     * @return The new label, {@code <parent>.<n>}.
     */
    public String enterChild() {
        if (depth < 0) {
            return enterRoot();
        }
        if (depth + 1 >= paths.length) {
            throw SemanticException.internal("Scope nesting exceeds the maximum depth of " + paths.length + ".");
        }
        int index = ++childCounts[depth];
        String path = paths[depth] + "." + index;
        depth++;
        paths[depth] = path;
        childCounts[depth] = 0;
        return path;
    }

    /**
     * Closes the current scope.
     */
    public void leave() {
        if (depth < 0) {
            throw SemanticException.internal("Scope-ID stack underflow.");
        }
        depth--;
    }

    /**
     * @return The label of the current scope, or {@link #GLOBAL} when none is open.
     */
    public String current() {
        return depth < 0 ? GLOBAL : paths[depth];
    }

    /**
     * @return The number of open scopes.
     */
    public int depth() {
        return depth + 1;
    }

    public int maxDepth() {
        return paths.length;
    }
}
