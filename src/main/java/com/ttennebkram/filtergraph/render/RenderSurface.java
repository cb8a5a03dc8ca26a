package com.ttennebkram.filtergraph.render;

import java.util.List;

/**
 * Scrollable area the primitive list is painted on.
 */
public interface RenderSurface {

    /**
     * Replace the current picture with the given commands, in order.
     */
    void draw(List<DrawCommand> commands);

    /** Content-space y of the top visible pixel (the scroll offset). */
    double getVisibleTop();

    double getVisibleHeight();

    /**
     * Scroll so that content-space y {@code offset} is at the top.
     */
    void setScrollOffset(double offset);
}
