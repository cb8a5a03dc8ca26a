package com.ttennebkram.filtergraph.document;

/**
 * Registration of a {@link DocumentListener}. Closing it detaches the
 * listener; closing twice is harmless.
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
