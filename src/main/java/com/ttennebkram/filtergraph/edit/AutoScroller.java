package com.ttennebkram.filtergraph.edit;

import com.ttennebkram.filtergraph.render.EditorSettings;

/**
 * Scroll speed while dragging a connection near or past the edges of the
 * visible part of the list.
 */
public class AutoScroller {

    private final EditorSettings settings;

    public AutoScroller(EditorSettings settings) {
        this.settings = settings;
    }

    /**
     * Pixels to scroll per tick for a pointer at {@code pointerY}. Negative
     * scrolls up. Inside the edge bands the speed is constant; past the
     * edges it grows with the distance.
     */
    public int velocityFor(double pointerY, double visibleTop, double visibleHeight) {
        int speed = settings.getAutoscrollSpeed();
        int edge = settings.getAutoscrollEdge();
        double bottom = visibleTop + visibleHeight;

        if (pointerY < visibleTop) {
            return -(int) (speed + (visibleTop - pointerY) / EditorSettings.AUTOSCROLL_DISTANCE_DIVISOR);
        } else if (pointerY < visibleTop + edge) {
            return -speed;
        } else if (pointerY > bottom) {
            return (int) (speed + (pointerY - bottom) / EditorSettings.AUTOSCROLL_DISTANCE_DIVISOR);
        } else if (pointerY > bottom - edge) {
            return speed;
        }
        return 0;
    }

    /**
     * New scroll offset after one tick, clamped to the scrollable range.
     */
    public double step(double offset, int velocity, double contentHeight, double pageHeight) {
        double next = offset + velocity;
        double max = Math.max(0, contentHeight - pageHeight);
        if (next > max) {
            next = max;
        }
        if (next < 0) {
            next = 0;
        }
        return next;
    }
}
