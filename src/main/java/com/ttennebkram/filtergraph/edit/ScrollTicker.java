package com.ttennebkram.filtergraph.edit;

/**
 * Source of the periodic callback that drives autoscroll while a
 * connection is dragged. Implementations call back on the UI thread.
 */
public interface ScrollTicker {

    /**
     * Handle of a running ticker.
     */
    interface Ticket {
        /** Stop the callbacks. No tick is delivered after this returns. */
        void cancel();
    }

    /**
     * Start calling {@code tick} every {@code intervalMillis} until cancelled.
     */
    Ticket start(long intervalMillis, Runnable tick);
}
