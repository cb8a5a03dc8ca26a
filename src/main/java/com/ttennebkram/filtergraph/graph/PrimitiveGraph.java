package com.ttennebkram.filtergraph.graph;

import com.ttennebkram.filtergraph.codec.ReferenceCodec;
import com.ttennebkram.filtergraph.document.DocumentStore;
import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.model.InputReference;
import com.ttennebkram.filtergraph.model.PrimitiveKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered sequence of the primitives of one filter, with the rules for
 * resolving what each input slot reads from.
 *
 * A graph is an immutable snapshot. Callers rebuild it from the document
 * store whenever the document changes instead of patching it.
 */
public class PrimitiveGraph {

    private final NodeHandle filter;
    private final List<PrimitiveNode> nodes;
    private final Map<NodeHandle, PrimitiveNode> byHandle;

    public PrimitiveGraph(NodeHandle filter, List<PrimitiveNode> orderedNodes) {
        this.filter = filter;
        List<PrimitiveNode> placed = new ArrayList<>(orderedNodes.size());
        Map<NodeHandle, PrimitiveNode> index = new HashMap<>();
        for (int i = 0; i < orderedNodes.size(); i++) {
            PrimitiveNode node = orderedNodes.get(i).withPosition(i);
            if (index.put(node.getHandle(), node) != null) {
                throw new IllegalArgumentException("Node " + node.getHandle() + " appears twice");
            }
            placed.add(node);
        }
        this.nodes = Collections.unmodifiableList(placed);
        this.byHandle = index;
    }

    public static PrimitiveGraph empty(NodeHandle filter) {
        return new PrimitiveGraph(filter, Collections.emptyList());
    }

    /**
     * Build a fresh snapshot of a filter's primitives from the store.
     */
    public static PrimitiveGraph build(DocumentStore store, NodeHandle filter) {
        if (filter == null || !store.contains(filter)) {
            return empty(filter);
        }
        List<PrimitiveNode> result = new ArrayList<>();
        for (NodeHandle handle : store.getOrderedPrimitives(filter)) {
            result.add(readNode(store, handle));
        }
        return new PrimitiveGraph(filter, result);
    }

    private static PrimitiveNode readNode(DocumentStore store, NodeHandle handle) {
        PrimitiveKind kind = PrimitiveKind.fromElementName(store.getKind(handle));
        Integer outputId = ReferenceCodec.parseOutputId(store.getAttribute(handle, PrimitiveNode.ATTR_RESULT));

        if (kind.isMerge()) {
            List<NodeHandle> subNodes = new ArrayList<>();
            List<InputReference> inputs = new ArrayList<>();
            for (NodeHandle child : store.getChildren(handle)) {
                if (PrimitiveKind.MERGE_NODE_ELEMENT.equals(store.getKind(child))) {
                    subNodes.add(child);
                    inputs.add(ReferenceCodec.fromAttribute(store.getAttribute(child, PrimitiveNode.ATTR_IN)));
                }
            }
            return PrimitiveNode.createMerge(handle, outputId, subNodes, inputs);
        }

        InputReference in = ReferenceCodec.fromAttribute(store.getAttribute(handle, PrimitiveNode.ATTR_IN));
        if (kind.hasSecondInput()) {
            InputReference in2 = ReferenceCodec.fromAttribute(store.getAttribute(handle, PrimitiveNode.ATTR_IN2));
            return PrimitiveNode.create(handle, kind, outputId, in, in2);
        }
        return PrimitiveNode.create(handle, kind, outputId, in);
    }

    // ========== Lookup ==========

    public NodeHandle getFilter() {
        return filter;
    }

    public List<PrimitiveNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public PrimitiveNode get(int position) {
        return nodes.get(position);
    }

    /**
     * Node for a handle, or null if the handle is not a primitive of this graph.
     */
    public PrimitiveNode find(NodeHandle handle) {
        return handle != null ? byHandle.get(handle) : null;
    }

    /**
     * Linear position of a node in the sequence, or -1 if absent.
     */
    public int findIndex(PrimitiveNode node) {
        return node != null ? findIndex(node.getHandle()) : -1;
    }

    public int findIndex(NodeHandle handle) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getHandle().equals(handle)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * True if {@code a} sits strictly before {@code b}.
     */
    public boolean isBefore(PrimitiveNode a, PrimitiveNode b) {
        int ia = findIndex(a);
        int ib = findIndex(b);
        return ia >= 0 && ib >= 0 && ia < ib;
    }

    // ========== Slots ==========

    /**
     * Number of slots currently carrying data: 2 for blend, composite and
     * displacement map, one per sub-node for merge, 1 otherwise, 0 for null.
     */
    public int inputCount(PrimitiveNode node) {
        if (node == null) {
            return 0;
        }
        return node.getInputCount();
    }

    /**
     * Slots drawn for a node. A merge offers one extra trailing slot for
     * adding a new input.
     */
    public int renderSlotCount(PrimitiveNode node) {
        if (node == null) {
            return 0;
        }
        return node.isMerge() ? node.getInputCount() + 1 : node.getInputCount();
    }

    // ========== Resolution ==========

    /**
     * Resolve what a slot reads from. Never throws: dangling references and
     * unknown slots come back as {@link ResolvedSource#unresolved()}.
     */
    public ResolvedSource resolve(PrimitiveNode node, int slot) {
        int position = findIndex(node);
        if (position < 0) {
            return ResolvedSource.unresolved();
        }
        PrimitiveNode current = nodes.get(position);
        if (slot < 0 || slot >= current.getInputCount()) {
            return ResolvedSource.unresolved();
        }

        InputReference reference = current.getInput(slot);
        switch (reference.getType()) {
            case STANDARD_SOURCE:
                return ResolvedSource.standard(reference.getSourceIndex());
            case NAMED_RESULT: {
                PrimitiveNode producer = findProducer(reference.getOutputId(), position);
                return producer != null ? ResolvedSource.producer(producer) : ResolvedSource.unresolved();
            }
            default:
                if (current.isMerge()) {
                    return ResolvedSource.unresolved();
                }
                // Both "in" and "in2" fall back to the previous primitive
                return ResolvedSource.implicitPrevious(position > 0 ? nodes.get(position - 1) : null);
        }
    }

    /**
     * Closest node before {@code beforePosition} declaring the output id, or null.
     */
    public PrimitiveNode findProducer(int outputId, int beforePosition) {
        PrimitiveNode found = null;
        int limit = Math.min(beforePosition, nodes.size());
        for (int i = 0; i < limit; i++) {
            PrimitiveNode candidate = nodes.get(i);
            if (candidate.hasOutput() && candidate.getOutputId() == outputId) {
                found = candidate;
            }
        }
        return found;
    }

    // ========== Output ids ==========

    public Set<Integer> declaredOutputIds() {
        Set<Integer> ids = new TreeSet<>();
        for (PrimitiveNode node : nodes) {
            if (node.hasOutput()) {
                ids.add(node.getOutputId());
            }
        }
        return ids;
    }

    /**
     * Output ids declared by more than one node, in first-seen order.
     */
    public Set<Integer> duplicateOutputIds() {
        Set<Integer> seen = new TreeSet<>();
        Set<Integer> duplicates = new LinkedHashSet<>();
        for (PrimitiveNode node : nodes) {
            if (node.hasOutput() && !seen.add(node.getOutputId())) {
                duplicates.add(node.getOutputId());
            }
        }
        return duplicates;
    }

    /**
     * Node declaring the output id other than {@code except}, or null.
     */
    public PrimitiveNode findDeclaringNode(int outputId, NodeHandle except) {
        for (PrimitiveNode node : nodes) {
            if (node.hasOutput() && node.getOutputId() == outputId && !node.getHandle().equals(except)) {
                return node;
            }
        }
        return null;
    }

    /**
     * Smallest non-negative integer not declared as an output.
     */
    public int nextFreeOutputId() {
        return smallestUnused(declaredOutputIds());
    }

    static int smallestUnused(Set<Integer> used) {
        int candidate = 0;
        while (used.contains(candidate)) {
            candidate++;
        }
        return candidate;
    }

    @Override
    public String toString() {
        return "PrimitiveGraph" + nodes;
    }
}
