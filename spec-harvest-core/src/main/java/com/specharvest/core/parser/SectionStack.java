package com.specharvest.core.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Path from the root to the innermost open section, keyed by heading level.
 *
 * <p>The root sits at the bottom with level 0 and is never popped, so every heading finds
 * a parent. Entering a heading pops every entry whose level is greater than or equal to
 * the new level: a repeated level becomes a sibling, and a skipped level (1 then 3) nests
 * under the nearest shallower section.
 */
public final class SectionStack {

    private final TreeBuilder builder;
    private final Deque<TreeBuilder.Container> stack = new ArrayDeque<>();

    /**
     * Creates a stack whose bottom is the builder's root.
     *
     * @param builder tree under construction
     */
    public SectionStack(TreeBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        stack.push(builder.root());
    }

    /**
     * Opens a section for a heading.
     *
     * @param level heading level (at least 1)
     * @param title heading text
     * @return the new section, which is now the insertion point
     */
    public TreeBuilder.Container enter(int level, String title) {
        if (level < 1) {
            throw new IllegalArgumentException("level must be positive: " + level);
        }
        TreeBuilder.Container parent = popToParent(level);
        TreeBuilder.Container section = builder.addSection(parent, title, level);
        stack.push(section);
        return section;
    }

    /**
     * Pops every entry at or below the given level and returns the new top.
     *
     * @param level incoming heading level
     * @return the container a section of that level nests under
     */
    TreeBuilder.Container popToParent(int level) {
        while (stack.size() > 1 && stack.peek().level() >= level) {
            stack.pop();
        }
        return stack.peek();
    }

    /**
     * Returns the innermost open section, or the root before the first heading.
     *
     * @return current insertion point
     */
    public TreeBuilder.Container current() {
        return stack.peek();
    }

    /**
     * Returns the number of open sections, excluding the root.
     *
     * @return nesting depth
     */
    public int depth() {
        return stack.size() - 1;
    }
}
