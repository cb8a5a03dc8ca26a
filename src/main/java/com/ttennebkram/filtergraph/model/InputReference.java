package com.ttennebkram.filtergraph.model;

import java.util.Objects;

/**
 * Value stored in one input slot of a filter primitive.
 *
 * A reference is one of:
 * - Unspecified: nothing set, the slot falls back to its implicit rule
 * - StandardSource: one of the fixed {@link StandardSource} inputs
 * - NamedResult: the declared output id of some other primitive
 *
 * Instances are immutable and compare by value.
 */
public final class InputReference {

    public enum Type {
        UNSPECIFIED,
        STANDARD_SOURCE,
        NAMED_RESULT
    }

    private static final InputReference UNSPECIFIED = new InputReference(Type.UNSPECIFIED, 0);

    private final Type type;
    private final int value;

    private InputReference(Type type, int value) {
        this.type = type;
        this.value = value;
    }

    public static InputReference unspecified() {
        return UNSPECIFIED;
    }

    public static InputReference standardSource(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Standard source index must be non-negative: " + index);
        }
        return new InputReference(Type.STANDARD_SOURCE, index);
    }

    public static InputReference standardSource(StandardSource source) {
        return standardSource(source.getIndex());
    }

    public static InputReference namedResult(int outputId) {
        if (outputId < 0) {
            throw new IllegalArgumentException("Output id must be non-negative: " + outputId);
        }
        return new InputReference(Type.NAMED_RESULT, outputId);
    }

    public Type getType() {
        return type;
    }

    public boolean isUnspecified() {
        return type == Type.UNSPECIFIED;
    }

    public boolean isStandardSource() {
        return type == Type.STANDARD_SOURCE;
    }

    public boolean isNamedResult() {
        return type == Type.NAMED_RESULT;
    }

    /**
     * Index of the standard source. Only meaningful for STANDARD_SOURCE.
     */
    public int getSourceIndex() {
        if (type != Type.STANDARD_SOURCE) {
            throw new IllegalStateException("Not a standard source reference: " + this);
        }
        return value;
    }

    /**
     * Referenced output id. Only meaningful for NAMED_RESULT.
     */
    public int getOutputId() {
        if (type != Type.NAMED_RESULT) {
            throw new IllegalStateException("Not a named result reference: " + this);
        }
        return value;
    }

    /**
     * True if this reference names the given output id.
     */
    public boolean refersTo(int outputId) {
        return type == Type.NAMED_RESULT && value == outputId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InputReference)) return false;
        InputReference other = (InputReference) o;
        return type == other.type && value == other.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case STANDARD_SOURCE:
                return "StandardSource(" + value + ")";
            case NAMED_RESULT:
                return "NamedResult(" + value + ")";
            default:
                return "Unspecified";
        }
    }
}
