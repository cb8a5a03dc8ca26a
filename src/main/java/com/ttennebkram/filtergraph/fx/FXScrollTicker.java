package com.ttennebkram.filtergraph.fx;

import com.ttennebkram.filtergraph.edit.ScrollTicker;

import javafx.animation.AnimationTimer;

/**
 * Ticker driven by a JavaFX {@link AnimationTimer}, so ticks arrive on the
 * FX application thread between pulses.
 */
public class FXScrollTicker implements ScrollTicker {

    @Override
    public Ticket start(long intervalMillis, Runnable tick) {
        final long intervalNanos = intervalMillis * 1_000_000L;

        AnimationTimer timer = new AnimationTimer() {
            private long lastUpdate = 0;
            private boolean stopped = false;

            @Override
            public void handle(long now) {
                if (stopped) {
                    return;
                }
                if (lastUpdate == 0) {
                    lastUpdate = now;
                } else if (now - lastUpdate >= intervalNanos) {
                    tick.run();
                    lastUpdate = now;
                }
            }

            @Override
            public void stop() {
                stopped = true;
                super.stop();
            }
        };
        timer.start();
        return timer::stop;
    }
}
