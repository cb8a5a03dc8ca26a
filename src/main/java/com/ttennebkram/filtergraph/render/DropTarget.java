package com.ttennebkram.filtergraph.render;

import com.ttennebkram.filtergraph.document.NodeHandle;

import java.util.Objects;

/**
 * Where a dragged connection was released.
 */
public final class DropTarget {

    public enum Type {
        /** One of the standard source label columns. */
        STANDARD_SOURCE,
        /** A primitive's row, left of the label columns. */
        NODE_ROW,
        /** Not over the list at all. */
        OUTSIDE
    }

    private static final DropTarget OUTSIDE = new DropTarget(Type.OUTSIDE, -1, null);

    private final Type type;
    private final int sourceIndex;
    private final NodeHandle node;

    private DropTarget(Type type, int sourceIndex, NodeHandle node) {
        this.type = type;
        this.sourceIndex = sourceIndex;
        this.node = node;
    }

    public static DropTarget standardSource(int index) {
        return new DropTarget(Type.STANDARD_SOURCE, index, null);
    }

    public static DropTarget nodeRow(NodeHandle node) {
        return new DropTarget(Type.NODE_ROW, -1, Objects.requireNonNull(node, "node"));
    }

    public static DropTarget outside() {
        return OUTSIDE;
    }

    public Type getType() {
        return type;
    }

    public int getSourceIndex() {
        return sourceIndex;
    }

    public NodeHandle getNode() {
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DropTarget)) return false;
        DropTarget other = (DropTarget) o;
        return type == other.type && sourceIndex == other.sourceIndex && Objects.equals(node, other.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, sourceIndex, node);
    }

    @Override
    public String toString() {
        switch (type) {
            case STANDARD_SOURCE:
                return "DropTarget(source " + sourceIndex + ")";
            case NODE_ROW:
                return "DropTarget(row " + node + ")";
            default:
                return "DropTarget(outside)";
        }
    }
}
