package com.ttennebkram.filtergraph.document;

/**
 * Opaque reference to an element held by a {@link DocumentStore}.
 * Handles stay valid for the life of the element, across reorders and
 * undo/redo; they are never reused for a different element.
 */
public final class NodeHandle {
    private final int id;

    public NodeHandle(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeHandle)) return false;
        return id == ((NodeHandle) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "#" + id;
    }
}
