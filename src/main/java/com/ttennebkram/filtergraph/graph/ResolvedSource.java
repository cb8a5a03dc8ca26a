package com.ttennebkram.filtergraph.graph;

import java.util.Objects;

/**
 * What an input slot actually reads from after resolution.
 */
public final class ResolvedSource {

    public enum Type {
        /** Explicit reference to an earlier primitive's named result. */
        PRODUCER,
        /** Explicit reference to a standard source. */
        STANDARD,
        /** Unset slot falling back to the previous primitive (or the base source at position 0). */
        IMPLICIT_PREVIOUS,
        /** Dangling or unset reference with no fallback. */
        UNRESOLVED
    }

    private static final ResolvedSource UNRESOLVED = new ResolvedSource(Type.UNRESOLVED, null, -1);

    private final Type type;
    private final PrimitiveNode node;
    private final int sourceIndex;

    private ResolvedSource(Type type, PrimitiveNode node, int sourceIndex) {
        this.type = type;
        this.node = node;
        this.sourceIndex = sourceIndex;
    }

    public static ResolvedSource producer(PrimitiveNode node) {
        return new ResolvedSource(Type.PRODUCER, Objects.requireNonNull(node, "node"), -1);
    }

    public static ResolvedSource standard(int sourceIndex) {
        return new ResolvedSource(Type.STANDARD, null, sourceIndex);
    }

    /**
     * @param previous the preceding primitive, or null at position 0
     */
    public static ResolvedSource implicitPrevious(PrimitiveNode previous) {
        return new ResolvedSource(Type.IMPLICIT_PREVIOUS, previous, -1);
    }

    public static ResolvedSource unresolved() {
        return UNRESOLVED;
    }

    public Type getType() {
        return type;
    }

    /**
     * Producing node for PRODUCER and IMPLICIT_PREVIOUS; null otherwise, and
     * null for an implicit reference at the head of the list.
     */
    public PrimitiveNode getNode() {
        return node;
    }

    /**
     * Standard source index for STANDARD, -1 otherwise.
     */
    public int getSourceIndex() {
        return sourceIndex;
    }

    public boolean isResolved() {
        return type != Type.UNRESOLVED;
    }

    public boolean isImplicit() {
        return type == Type.IMPLICIT_PREVIOUS;
    }

    /**
     * True if the slot reads a standard source, either explicitly or through
     * the implicit fallback at the head of the list.
     */
    public boolean readsStandardSource() {
        return type == Type.STANDARD || (type == Type.IMPLICIT_PREVIOUS && node == null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedSource)) return false;
        ResolvedSource other = (ResolvedSource) o;
        return type == other.type
            && sourceIndex == other.sourceIndex
            && Objects.equals(handleOf(node), handleOf(other.node));
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, sourceIndex, handleOf(node));
    }

    private static Object handleOf(PrimitiveNode n) {
        return n != null ? n.getHandle() : null;
    }

    @Override
    public String toString() {
        switch (type) {
            case PRODUCER:
                return "Producer(" + node.getHandle() + ")";
            case STANDARD:
                return "Standard(" + sourceIndex + ")";
            case IMPLICIT_PREVIOUS:
                return "ImplicitPrevious(" + (node != null ? node.getHandle() : "none") + ")";
            default:
                return "Unresolved";
        }
    }
}
