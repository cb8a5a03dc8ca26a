package com.ttennebkram.filtergraph.graph;

import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.model.InputReference;
import com.ttennebkram.filtergraph.model.PrimitiveKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only projection of one filter primitive, rebuilt from the document
 * store on every change. Nodes refer to each other only through output ids,
 * never directly.
 *
 * For ordinary kinds slot 0 is stored in "in" and slot 1 in "in2" of the
 * primitive itself. For merge, slot i is the "in" attribute of the i-th
 * merge sub-node.
 */
public final class PrimitiveNode {

    public static final String ATTR_IN = "in";
    public static final String ATTR_IN2 = "in2";
    public static final String ATTR_RESULT = "result";

    private final NodeHandle handle;
    private final PrimitiveKind kind;
    private final int position;
    private final List<InputReference> inputs;
    private final Integer outputId;
    private final List<NodeHandle> mergeInputs;

    PrimitiveNode(NodeHandle handle, PrimitiveKind kind, int position,
                  List<InputReference> inputs, Integer outputId, List<NodeHandle> mergeInputs) {
        if (kind.isMerge() && mergeInputs.size() != inputs.size()) {
            throw new IllegalArgumentException("Merge needs one sub-node per input");
        }
        if (!kind.isMerge() && inputs.size() != kind.getFixedInputCount()) {
            throw new IllegalArgumentException(kind + " takes " + kind.getFixedInputCount()
                + " inputs, got " + inputs.size());
        }
        this.handle = handle;
        this.kind = kind;
        this.position = position;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputId = outputId;
        this.mergeInputs = Collections.unmodifiableList(new ArrayList<>(mergeInputs));
    }

    /**
     * Create an ordinary (non-merge) node. Missing trailing inputs are unspecified.
     */
    public static PrimitiveNode create(NodeHandle handle, PrimitiveKind kind, Integer outputId,
                                       InputReference... inputs) {
        if (kind.isMerge()) {
            throw new IllegalArgumentException("Use createMerge for merge primitives");
        }
        List<InputReference> slots = new ArrayList<>();
        for (int i = 0; i < kind.getFixedInputCount(); i++) {
            slots.add(i < inputs.length && inputs[i] != null ? inputs[i] : InputReference.unspecified());
        }
        return new PrimitiveNode(handle, kind, -1, slots, outputId, Collections.emptyList());
    }

    /**
     * Create a merge node with one input per sub-node handle.
     */
    public static PrimitiveNode createMerge(NodeHandle handle, Integer outputId,
                                            List<NodeHandle> subNodes, List<InputReference> inputs) {
        return new PrimitiveNode(handle, PrimitiveKind.MERGE, -1, inputs, outputId, subNodes);
    }

    PrimitiveNode withPosition(int newPosition) {
        if (newPosition == position) {
            return this;
        }
        return new PrimitiveNode(handle, kind, newPosition, inputs, outputId, mergeInputs);
    }

    public NodeHandle getHandle() {
        return handle;
    }

    public PrimitiveKind getKind() {
        return kind;
    }

    public boolean isMerge() {
        return kind.isMerge();
    }

    /**
     * Index in the owning graph, or -1 for a node not yet placed in a graph.
     */
    public int getPosition() {
        return position;
    }

    /**
     * Number of slots that currently carry data.
     */
    public int getInputCount() {
        return inputs.size();
    }

    /**
     * Reference stored in a slot; unspecified for slots that do not exist.
     */
    public InputReference getInput(int slot) {
        if (slot < 0 || slot >= inputs.size()) {
            return InputReference.unspecified();
        }
        return inputs.get(slot);
    }

    public List<InputReference> getInputs() {
        return inputs;
    }

    public boolean hasOutput() {
        return outputId != null;
    }

    /**
     * Declared output id, or null when the node has no named result.
     */
    public Integer getOutputId() {
        return outputId;
    }

    /**
     * Sub-node handles of a merge, one per slot; empty for other kinds.
     */
    public List<NodeHandle> getMergeInputs() {
        return mergeInputs;
    }

    /**
     * Element whose attribute stores the given slot.
     */
    public NodeHandle getSlotOwner(int slot) {
        if (kind.isMerge()) {
            return slot >= 0 && slot < mergeInputs.size() ? mergeInputs.get(slot) : null;
        }
        return slot >= 0 && slot < inputs.size() ? handle : null;
    }

    /**
     * Attribute name that stores the given slot on its owner.
     */
    public String getSlotAttribute(int slot) {
        if (kind.isMerge() || slot == 0) {
            return ATTR_IN;
        }
        return ATTR_IN2;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.getLabel()).append(handle);
        if (outputId != null) {
            sb.append(" out=").append(outputId);
        }
        sb.append(" ").append(inputs);
        return sb.toString();
    }
}
