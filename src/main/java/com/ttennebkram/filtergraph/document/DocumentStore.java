package com.ttennebkram.filtergraph.document;

import java.util.List;
import java.util.Map;

/**
 * Persistent home of filter documents. The editor reads primitives and
 * their attributes through this interface and writes back only through
 * attribute sets and structural edits; it never keeps its own copy of
 * persistent state.
 *
 * Every mutation is undoable and notifies subscribers synchronously.
 * Mutations grouped by {@link #runAction} form one undo step.
 */
public interface DocumentStore {

    /** All filters in document order. */
    List<NodeHandle> getFilters();

    /** Filter with the given "id" attribute, or null. */
    NodeHandle findFilter(String id);

    /** Primitives of a filter in document order. */
    List<NodeHandle> getOrderedPrimitives(NodeHandle filter);

    /** Child elements of a primitive (merge sub-nodes, light sources). */
    List<NodeHandle> getChildren(NodeHandle node);

    /** Element name of a node, e.g. "feBlend" or "feMergeNode". */
    String getKind(NodeHandle node);

    String getAttribute(NodeHandle node, String name);

    /** Snapshot of all attributes in insertion order. */
    Map<String, String> getAttributes(NodeHandle node);

    boolean contains(NodeHandle node);

    /**
     * Set an attribute; a null value removes it.
     *
     * @throws DocumentStoreException if the store refuses the write
     */
    void setAttribute(NodeHandle node, String name, String value);

    /**
     * Insert a new element into a filter directly after the given position
     * (-1 inserts at the front).
     */
    NodeHandle insertNode(NodeHandle filter, int afterPosition, String kind);

    /** Append a new child element to a node. */
    NodeHandle appendChild(NodeHandle parent, String kind);

    /** Remove a node (and its children) from its parent. */
    void removeNode(NodeHandle node);

    /** Move a node to the given index among its siblings. */
    void setPosition(NodeHandle node, int index);

    /**
     * Run the mutation as one undoable action. Subscribers are notified
     * once, after the mutation finished. If the mutation throws, everything
     * it already changed is rolled back and the exception propagates.
     */
    void runAction(String description, Runnable mutation);

    Subscription subscribe(DocumentListener listener);
}
