package com.ttennebkram.filtergraph.graph;

import com.ttennebkram.filtergraph.codec.ReferenceCodec;
import com.ttennebkram.filtergraph.document.DocumentStore;
import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.document.Subscription;
import com.ttennebkram.filtergraph.model.PrimitiveKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Owner of the primitive graph for one filter.
 *
 * The model subscribes to the document store when created and rebuilds the
 * graph wholesale after every change notification, whatever its origin
 * (list commands, connection edits, undo/redo, external edits). Closing the
 * model removes the subscription.
 *
 * List commands run as single undoable actions and restore the graph
 * invariants before the action ends.
 */
public class PrimitiveListModel implements AutoCloseable {

    private final DocumentStore store;
    private final NodeHandle filter;
    private final ReorderSanitizer sanitizer;
    private final Subscription subscription;
    private final List<Runnable> changeListeners = new ArrayList<>();

    private PrimitiveGraph graph;

    public PrimitiveListModel(DocumentStore store, NodeHandle filter) {
        this.store = store;
        this.filter = filter;
        this.sanitizer = new ReorderSanitizer(store);
        this.graph = PrimitiveGraph.build(store, filter);
        this.subscription = store.subscribe(description -> rebuild());
    }

    public DocumentStore getStore() {
        return store;
    }

    public NodeHandle getFilter() {
        return filter;
    }

    /**
     * Current snapshot. Replaced, never modified, on each rebuild.
     */
    public PrimitiveGraph graph() {
        return graph;
    }

    public ReorderSanitizer getSanitizer() {
        return sanitizer;
    }

    public void addChangeListener(Runnable listener) {
        changeListeners.add(listener);
    }

    public void removeChangeListener(Runnable listener) {
        changeListeners.remove(listener);
    }

    public boolean isClosed() {
        return !subscription.isActive();
    }

    /**
     * Rebuild the snapshot from the store and tell listeners.
     */
    public void rebuild() {
        graph = PrimitiveGraph.build(store, filter);
        for (Runnable listener : new ArrayList<>(changeListeners)) {
            listener.run();
        }
    }

    // ========== List commands ==========

    /**
     * Move a primitive to a new index and drop references the move made illegal.
     */
    public void reorder(NodeHandle node, int newIndex) {
        requirePrimitive(node);
        if (newIndex < 0 || newIndex >= graph.size()) {
            throw new IllegalArgumentException("Index " + newIndex + " out of range for " + graph.size() + " primitives");
        }
        store.runAction("Reorder filter primitive", () -> {
            store.setPosition(node, newIndex);
            restoreInvariants(node);
        });
    }

    /**
     * Insert a new primitive after the given position (-1 for the front).
     * A merge starts out with one empty sub-node.
     */
    public NodeHandle insertPrimitive(int afterPosition, PrimitiveKind kind) {
        if (kind == PrimitiveKind.UNKNOWN) {
            throw new IllegalArgumentException("Cannot insert a primitive of unknown kind");
        }
        NodeHandle[] created = new NodeHandle[1];
        store.runAction("Add filter primitive", () -> {
            created[0] = store.insertNode(filter, afterPosition, kind.getElementName());
            if (kind.isMerge()) {
                store.appendChild(created[0], PrimitiveKind.MERGE_NODE_ELEMENT);
            }
            restoreInvariants(created[0]);
        });
        return created[0];
    }

    /**
     * Remove a primitive. Slots that read its result become unresolved.
     */
    public void removePrimitive(NodeHandle node) {
        requirePrimitive(node);
        store.runAction("Remove filter primitive", () -> {
            store.removeNode(node);
            sanitizer.repairDuplicateOutputs(PrimitiveGraph.build(store, filter));
        });
    }

    /**
     * Insert a copy of a primitive directly after it. The copy keeps the
     * inputs but not the named result, so output ids stay unique.
     */
    public NodeHandle duplicatePrimitive(NodeHandle node) {
        PrimitiveNode original = requirePrimitive(node);
        NodeHandle[] created = new NodeHandle[1];
        store.runAction("Duplicate filter primitive", () -> {
            created[0] = store.insertNode(filter, original.getPosition(), store.getKind(node));
            copyAttributes(node, created[0], true);
            for (NodeHandle child : store.getChildren(node)) {
                copySubtree(child, created[0]);
            }
            restoreInvariants(created[0]);
        });
        return created[0];
    }

    // ========== Output ids ==========

    /**
     * Declare a specific output id on a primitive. Ids already declared by
     * another primitive are rejected.
     */
    public void setOutputId(NodeHandle node, int outputId) {
        requirePrimitive(node);
        if (outputId < 0) {
            throw new IllegalArgumentException("Output id must be non-negative: " + outputId);
        }
        PrimitiveNode other = graph.findDeclaringNode(outputId, node);
        if (other != null) {
            throw new IllegalArgumentException("Output id " + outputId + " is already declared by " + other.getHandle());
        }
        store.setAttribute(node, PrimitiveNode.ATTR_RESULT, ReferenceCodec.formatOutputId(outputId));
    }

    /**
     * Return the primitive's output id, declaring the smallest free one if it
     * has none yet. Reads the store directly so it is safe inside an action.
     */
    public int ensureOutputId(NodeHandle node) {
        PrimitiveGraph current = PrimitiveGraph.build(store, filter);
        PrimitiveNode target = current.find(node);
        if (target == null) {
            throw new IllegalArgumentException("Not a primitive of this filter: " + node);
        }
        if (target.hasOutput()) {
            return target.getOutputId();
        }
        int outputId = current.nextFreeOutputId();
        store.setAttribute(node, PrimitiveNode.ATTR_RESULT, ReferenceCodec.formatOutputId(outputId));
        return outputId;
    }

    @Override
    public void close() {
        subscription.close();
        changeListeners.clear();
    }

    // ========== Internals ==========

    private void restoreInvariants(NodeHandle changed) {
        sanitizer.repairDuplicateOutputs(PrimitiveGraph.build(store, filter));
        sanitizer.sanitize(PrimitiveGraph.build(store, filter), changed);
    }

    private PrimitiveNode requirePrimitive(NodeHandle node) {
        PrimitiveNode found = graph.find(node);
        if (found == null) {
            throw new IllegalArgumentException("Not a primitive of this filter: " + node);
        }
        return found;
    }

    private void copyAttributes(NodeHandle from, NodeHandle to, boolean skipResult) {
        for (Map.Entry<String, String> attr : store.getAttributes(from).entrySet()) {
            if (skipResult && PrimitiveNode.ATTR_RESULT.equals(attr.getKey())) {
                continue;
            }
            store.setAttribute(to, attr.getKey(), attr.getValue());
        }
    }

    private void copySubtree(NodeHandle from, NodeHandle newParent) {
        NodeHandle copy = store.appendChild(newParent, store.getKind(from));
        copyAttributes(from, copy, false);
        for (NodeHandle child : store.getChildren(from)) {
            copySubtree(child, copy);
        }
    }
}
