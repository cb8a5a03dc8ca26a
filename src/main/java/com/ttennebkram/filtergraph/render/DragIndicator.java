package com.ttennebkram.filtergraph.render;

import com.ttennebkram.filtergraph.document.NodeHandle;

/**
 * Connection drag in progress, as far as drawing is concerned.
 */
public interface DragIndicator {

    NodeHandle getOriginNode();

    int getOriginSlot();

    double getPointerX();

    double getPointerY();
}
