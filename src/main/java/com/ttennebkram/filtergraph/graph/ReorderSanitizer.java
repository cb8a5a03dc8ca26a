package com.ttennebkram.filtergraph.graph;

import com.ttennebkram.filtergraph.codec.ReferenceCodec;
import com.ttennebkram.filtergraph.document.DocumentStore;
import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.model.InputReference;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Repairs references that a reorder, insert or duplicate made illegal.
 *
 * References must point strictly backwards. Moving a primitive can turn a
 * reference to it (or from it) into a forward one; {@link #sanitize} clears
 * those slots back to unspecified. {@link #repairDuplicateOutputs} renames
 * shadowing output declarations so ids stay unique.
 *
 * Both passes write through the document store. Callers wrap them in the
 * same store action as the change that made them necessary.
 */
public class ReorderSanitizer {

    private final DocumentStore store;

    public ReorderSanitizer(DocumentStore store) {
        this.store = store;
    }

    /**
     * Clear every reference between {@code moved} and the other primitives
     * that now points forward.
     *
     * @return number of slots cleared
     */
    public int sanitize(PrimitiveGraph graph, NodeHandle moved) {
        int position = graph.findIndex(moved);
        if (position < 0) {
            return 0;
        }
        PrimitiveNode movedNode = graph.get(position);

        int cleared = 0;
        Set<Integer> laterOutputs = new HashSet<>();
        for (PrimitiveNode other : graph.nodes()) {
            if (other.getPosition() < position) {
                // Earlier nodes may no longer read the moved node's result
                if (movedNode.hasOutput()) {
                    cleared += clearReferences(other, movedNode.getOutputId());
                }
            } else if (other.getPosition() > position && other.hasOutput()) {
                laterOutputs.add(other.getOutputId());
            }
        }

        // The moved node may no longer read results of nodes now after it
        for (Integer outputId : laterOutputs) {
            cleared += clearReferences(movedNode, outputId);
        }
        return cleared;
    }

    /**
     * Give every shadowing output declaration a fresh id and point the slots
     * that resolved to it at the new id, so each slot keeps reading the same
     * primitive.
     *
     * @return number of declarations renamed
     */
    public int repairDuplicateOutputs(PrimitiveGraph graph) {
        if (graph.duplicateOutputIds().isEmpty()) {
            return 0;
        }

        Set<Integer> used = new HashSet<>(graph.declaredOutputIds());
        Set<Integer> seen = new HashSet<>();
        List<PrimitiveNode> nodes = graph.nodes();
        int renamed = 0;

        for (PrimitiveNode node : nodes) {
            if (!node.hasOutput() || seen.add(node.getOutputId())) {
                continue;
            }

            int fresh = PrimitiveGraph.smallestUnused(used);
            used.add(fresh);
            store.setAttribute(node.getHandle(), PrimitiveNode.ATTR_RESULT, ReferenceCodec.formatOutputId(fresh));

            String newValue = ReferenceCodec.toAttribute(InputReference.namedResult(fresh));
            for (int i = node.getPosition() + 1; i < nodes.size(); i++) {
                PrimitiveNode later = nodes.get(i);
                for (int slot = 0; slot < later.getInputCount(); slot++) {
                    if (!later.getInput(slot).isNamedResult()) {
                        continue;
                    }
                    ResolvedSource source = graph.resolve(later, slot);
                    if (source.getType() == ResolvedSource.Type.PRODUCER
                            && source.getNode().getHandle().equals(node.getHandle())) {
                        store.setAttribute(later.getSlotOwner(slot), later.getSlotAttribute(slot), newValue);
                    }
                }
            }
            renamed++;
        }
        return renamed;
    }

    private int clearReferences(PrimitiveNode node, int outputId) {
        int cleared = 0;
        for (int slot = 0; slot < node.getInputCount(); slot++) {
            if (node.getInput(slot).refersTo(outputId)) {
                store.setAttribute(node.getSlotOwner(slot), node.getSlotAttribute(slot), null);
                cleared++;
            }
        }
        return cleared;
    }
}
