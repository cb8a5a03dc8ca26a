package com.ttennebkram.filtergraph.edit;

import com.ttennebkram.filtergraph.codec.ReferenceCodec;
import com.ttennebkram.filtergraph.document.DocumentStore;
import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.graph.PrimitiveGraph;
import com.ttennebkram.filtergraph.graph.PrimitiveListModel;
import com.ttennebkram.filtergraph.graph.PrimitiveNode;
import com.ttennebkram.filtergraph.model.InputReference;
import com.ttennebkram.filtergraph.model.PrimitiveKind;
import com.ttennebkram.filtergraph.render.DragIndicator;
import com.ttennebkram.filtergraph.render.DropTarget;
import com.ttennebkram.filtergraph.render.GraphRenderAdapter;
import com.ttennebkram.filtergraph.render.RenderSurface;
import com.ttennebkram.filtergraph.render.SlotHit;

/**
 * Drag-to-connect interaction for input slots.
 *
 * <pre>
 * IDLE --press on slot--> DRAGGING --move--> DRAGGING
 * DRAGGING --release over a target--> COMMITTING --> IDLE
 * DRAGGING --release outside / cancel--> IDLE
 * </pre>
 *
 * Everything that only makes sense during a drag (origin slot, pointer,
 * autoscroll velocity, ticker) lives in one {@link Drag} that exists only
 * in the DRAGGING state. A completed drag mutates the document at most
 * once, as a single undoable action.
 */
public class ConnectionEditSession {

    public enum State {
        IDLE,
        DRAGGING,
        COMMITTING
    }

    /**
     * What a release did to the document.
     */
    public enum Outcome {
        /** No drag was in progress. */
        NONE,
        /** Released outside the list, or the origin is gone; nothing changed. */
        CANCELLED,
        /** Slot now references a standard source or a named result. */
        CONNECTED,
        /** Slot reference cleared. */
        DISCONNECTED,
        /** New merge sub-node created for the trailing slot. */
        INPUT_ADDED,
        /** Merge sub-node removed. */
        INPUT_REMOVED,
        /** Dropped "nothing" on the trailing merge slot; nothing to do. */
        UNCHANGED
    }

    /**
     * A drag in progress.
     */
    public static final class Drag implements DragIndicator {
        private final NodeHandle originNode;
        private final int originSlot;
        private double pointerX;
        private double pointerY;
        private int velocity;
        private ScrollTicker.Ticket ticket;

        private Drag(NodeHandle originNode, int originSlot, double pointerX, double pointerY) {
            this.originNode = originNode;
            this.originSlot = originSlot;
            this.pointerX = pointerX;
            this.pointerY = pointerY;
        }

        @Override
        public NodeHandle getOriginNode() {
            return originNode;
        }

        @Override
        public int getOriginSlot() {
            return originSlot;
        }

        @Override
        public double getPointerX() {
            return pointerX;
        }

        @Override
        public double getPointerY() {
            return pointerY;
        }

        /** Current autoscroll speed in pixels per tick, negative for up. */
        public int getVelocity() {
            return velocity;
        }
    }

    private final PrimitiveListModel model;
    private final GraphRenderAdapter adapter;
    private final RenderSurface surface;
    private final ScrollTicker ticker;
    private final AutoScroller autoScroller;

    private State state = State.IDLE;
    private Drag drag = null;
    private Runnable onRepaint = () -> { };

    public ConnectionEditSession(PrimitiveListModel model, GraphRenderAdapter adapter,
                                 RenderSurface surface, ScrollTicker ticker) {
        this.model = model;
        this.adapter = adapter;
        this.surface = surface;
        this.ticker = ticker;
        this.autoScroller = new AutoScroller(adapter.getSettings());
    }

    public void setOnRepaint(Runnable onRepaint) {
        this.onRepaint = onRepaint != null ? onRepaint : () -> { };
    }

    public State getState() {
        return state;
    }

    /**
     * The drag in progress, or null when idle.
     */
    public Drag getDrag() {
        return drag;
    }

    public boolean isDragging() {
        return state == State.DRAGGING;
    }

    // ========== Pointer events ==========

    /**
     * Start a drag if the press hits a slot marker.
     *
     * @return true if the press was consumed; false leaves it to row selection
     */
    public boolean press(double x, double y) {
        if (state == State.DRAGGING) {
            cancel();
        }
        SlotHit hit = adapter.hitTest(model.graph(), x, y);
        if (hit == null) {
            return false;
        }

        drag = new Drag(hit.getNode(), hit.getSlot(), x, y);
        state = State.DRAGGING;
        drag.ticket = ticker.start(adapter.getSettings().getAutoscrollIntervalMillis(), this::onScrollTick);
        onRepaint.run();
        return true;
    }

    /**
     * Follow the pointer. Never touches the document.
     */
    public void move(double x, double y) {
        if (state != State.DRAGGING) {
            return;
        }
        drag.pointerX = x;
        drag.pointerY = y;
        drag.velocity = autoScroller.velocityFor(y, surface.getVisibleTop(), surface.getVisibleHeight());
        onRepaint.run();
    }

    /**
     * Finish the drag at the given point and commit whatever it connects to.
     * Store failures propagate after the session is back to idle; the
     * document is left as it was.
     */
    public Outcome release(double x, double y) {
        if (state != State.DRAGGING) {
            return Outcome.NONE;
        }
        Drag finished = drag;
        stopTicker();

        PrimitiveGraph graph = model.graph();
        DropTarget target = adapter.dropTargetAt(graph, x, y);
        PrimitiveNode origin = graph.find(finished.getOriginNode());
        if (target.getType() == DropTarget.Type.OUTSIDE || origin == null) {
            reset();
            return Outcome.CANCELLED;
        }

        state = State.COMMITTING;
        try {
            return commit(graph, origin, finished.getOriginSlot(), target);
        } finally {
            reset();
        }
    }

    /**
     * Abandon the drag without touching the document.
     */
    public void cancel() {
        if (state == State.IDLE) {
            return;
        }
        stopTicker();
        reset();
    }

    // ========== Commit ==========

    private Outcome commit(PrimitiveGraph graph, PrimitiveNode origin, int slot, DropTarget target) {
        DocumentStore store = model.getStore();
        PrimitiveNode producer = null;
        InputReference reference;

        switch (target.getType()) {
            case STANDARD_SOURCE:
                reference = InputReference.standardSource(target.getSourceIndex());
                break;
            case NODE_ROW: {
                PrimitiveNode row = graph.find(target.getNode());
                if (row != null && graph.isBefore(row, origin)) {
                    producer = row;
                    reference = row.hasOutput()
                        ? InputReference.namedResult(row.getOutputId())
                        : null;
                } else {
                    // Own row or a later one: drop means disconnect
                    reference = InputReference.unspecified();
                }
                break;
            }
            default:
                return Outcome.CANCELLED;
        }

        boolean disconnect = producer == null && reference.isUnspecified();
        NodeHandle allocateOn = producer != null && reference == null ? producer.getHandle() : null;
        InputReference known = reference;

        if (!origin.isMerge()) {
            if (slot >= origin.getInputCount()) {
                return Outcome.CANCELLED;
            }
            store.runAction("Set filter primitive input", () ->
                store.setAttribute(origin.getHandle(), origin.getSlotAttribute(slot),
                    ReferenceCodec.toAttribute(resolveReference(known, allocateOn))));
            return disconnect ? Outcome.DISCONNECTED : Outcome.CONNECTED;
        }

        int count = origin.getInputCount();
        if (slot < count) {
            NodeHandle subNode = origin.getMergeInputs().get(slot);
            if (disconnect) {
                store.runAction("Remove merge node", () -> store.removeNode(subNode));
                return Outcome.INPUT_REMOVED;
            }
            store.runAction("Set filter primitive input", () ->
                store.setAttribute(subNode, PrimitiveNode.ATTR_IN,
                    ReferenceCodec.toAttribute(resolveReference(known, allocateOn))));
            return Outcome.CONNECTED;
        }

        if (slot == count && !disconnect) {
            store.runAction("Add merge node", () -> {
                InputReference value = resolveReference(known, allocateOn);
                NodeHandle subNode = store.appendChild(origin.getHandle(), PrimitiveKind.MERGE_NODE_ELEMENT);
                store.setAttribute(subNode, PrimitiveNode.ATTR_IN, ReferenceCodec.toAttribute(value));
            });
            return Outcome.INPUT_ADDED;
        }
        return Outcome.UNCHANGED;
    }

    /**
     * Final reference for a commit, declaring the producer's output id first
     * when it has none. Runs inside the store action.
     */
    private InputReference resolveReference(InputReference known, NodeHandle allocateOn) {
        if (allocateOn == null) {
            return known;
        }
        return InputReference.namedResult(model.ensureOutputId(allocateOn));
    }

    // ========== Autoscroll ==========

    private void onScrollTick() {
        Drag current = drag;
        if (state != State.DRAGGING || current == null || current.velocity == 0) {
            return;
        }
        double offset = autoScroller.step(surface.getVisibleTop(), current.velocity,
            adapter.contentHeight(model.graph()), surface.getVisibleHeight());
        surface.setScrollOffset(offset);
        onRepaint.run();
    }

    private void stopTicker() {
        if (drag != null && drag.ticket != null) {
            drag.ticket.cancel();
            drag.ticket = null;
        }
    }

    private void reset() {
        drag = null;
        state = State.IDLE;
        onRepaint.run();
    }
}
