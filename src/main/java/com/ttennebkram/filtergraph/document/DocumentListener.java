package com.ttennebkram.filtergraph.document;

/**
 * Receives synchronous change notifications from a {@link DocumentStore}.
 */
@FunctionalInterface
public interface DocumentListener {

    /**
     * Called after the document changed. Mutations issued inside one action
     * produce a single call once the action completes.
     *
     * @param description what changed, e.g. "Reorder filter primitive" or "Undo"
     */
    void documentChanged(String description);
}
