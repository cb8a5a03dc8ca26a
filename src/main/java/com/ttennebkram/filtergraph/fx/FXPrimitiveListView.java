package com.ttennebkram.filtergraph.fx;

import com.ttennebkram.filtergraph.document.DocumentStoreException;
import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.edit.ConnectionEditSession;
import com.ttennebkram.filtergraph.graph.PrimitiveGraph;
import com.ttennebkram.filtergraph.graph.PrimitiveListModel;
import com.ttennebkram.filtergraph.render.EditorSettings;
import com.ttennebkram.filtergraph.render.GraphRenderAdapter;

import javafx.scene.canvas.Canvas;
import javafx.scene.control.ScrollPane;
import javafx.scene.input.KeyCode;
import javafx.scene.input.KeyEvent;
import javafx.scene.input.MouseButton;
import javafx.scene.input.MouseEvent;

import java.util.function.Consumer;

/**
 * The primitive list widget: rows with their input slots and connectors,
 * row selection, and drag-to-connect.
 */
public class FXPrimitiveListView {

    private final PrimitiveListModel model;
    private final GraphRenderAdapter adapter;
    private final FXRenderSurface surface;
    private final ConnectionEditSession session;
    private final Runnable modelListener = this::onModelChanged;

    private NodeHandle selected = null;
    private Consumer<String> onStatus = message -> { };

    public FXPrimitiveListView(PrimitiveListModel model, EditorSettings settings) {
        this.model = model;
        this.adapter = new GraphRenderAdapter(settings);
        this.surface = new FXRenderSurface();
        this.session = new ConnectionEditSession(model, adapter, surface, new FXScrollTicker());
        this.session.setOnRepaint(this::paint);

        Canvas canvas = surface.getCanvas();
        canvas.setOnMousePressed(this::handleMousePressed);
        canvas.setOnMouseDragged(this::handleMouseDragged);
        canvas.setOnMouseReleased(this::handleMouseReleased);
        canvas.setFocusTraversable(true);
        canvas.setOnKeyPressed(this::handleKeyPressed);

        surface.getScrollPane().vvalueProperty().addListener((obs, oldVal, newVal) -> paint());
        surface.getScrollPane().viewportBoundsProperty().addListener((obs, oldVal, newVal) -> onModelChanged());

        model.addChangeListener(modelListener);
        onModelChanged();
    }

    public ScrollPane getNode() {
        return surface.getScrollPane();
    }

    public PrimitiveListModel getModel() {
        return model;
    }

    /**
     * Selected primitive, or null.
     */
    public NodeHandle getSelected() {
        return selected;
    }

    public void setSelected(NodeHandle node) {
        this.selected = node;
        paint();
    }

    /**
     * Receives short messages for the status bar.
     */
    public void setOnStatus(Consumer<String> onStatus) {
        this.onStatus = onStatus != null ? onStatus : message -> { };
    }

    public void paint() {
        adapter.paint(surface, model.graph(), selected, session.getDrag());
    }

    /**
     * Stop listening to the model and abandon any drag.
     */
    public void dispose() {
        session.cancel();
        model.removeChangeListener(modelListener);
    }

    // ========== Commands ==========

    public void deleteSelected() {
        if (selected == null || model.graph().find(selected) == null) {
            return;
        }
        NodeHandle removing = selected;
        PrimitiveGraph graph = model.graph();
        int index = graph.findIndex(removing);
        runCommand(() -> model.removePrimitive(removing));

        // Keep a neighbour selected
        PrimitiveGraph after = model.graph();
        if (after.isEmpty()) {
            selected = null;
        } else {
            selected = after.get(Math.min(index, after.size() - 1)).getHandle();
        }
        paint();
    }

    public void moveSelected(int delta) {
        if (selected == null) {
            return;
        }
        int index = model.graph().findIndex(selected);
        int target = index + delta;
        if (index < 0 || target < 0 || target >= model.graph().size()) {
            return;
        }
        NodeHandle moving = selected;
        runCommand(() -> model.reorder(moving, target));
    }

    // ========== Mouse handlers ==========

    private void handleMousePressed(MouseEvent e) {
        surface.getCanvas().requestFocus();
        if (e.getButton() != MouseButton.PRIMARY) {
            return;
        }
        try {
            if (session.press(e.getX(), e.getY())) {
                return;
            }
        } catch (RuntimeException ex) {
            report("Could not start connection", ex);
            return;
        }

        int row = adapter.rowAt(model.graph(), e.getY());
        setSelected(row >= 0 ? model.graph().get(row).getHandle() : null);
    }

    private void handleMouseDragged(MouseEvent e) {
        session.move(e.getX(), e.getY());
    }

    private void handleMouseReleased(MouseEvent e) {
        if (!session.isDragging()) {
            return;
        }
        try {
            ConnectionEditSession.Outcome outcome = session.release(e.getX(), e.getY());
            onStatus.accept(describe(outcome));
        } catch (DocumentStoreException | IllegalArgumentException ex) {
            report("Connection not changed", ex);
        }
    }

    private void handleKeyPressed(KeyEvent e) {
        if (e.getCode() == KeyCode.ESCAPE && session.isDragging()) {
            session.cancel();
            e.consume();
        } else if (e.getCode() == KeyCode.DELETE || e.getCode() == KeyCode.BACK_SPACE) {
            deleteSelected();
            e.consume();
        } else if (e.isAltDown() && e.getCode() == KeyCode.UP) {
            moveSelected(-1);
            e.consume();
        } else if (e.isAltDown() && e.getCode() == KeyCode.DOWN) {
            moveSelected(1);
            e.consume();
        }
    }

    // ========== Internals ==========

    private void onModelChanged() {
        PrimitiveGraph graph = model.graph();
        if (selected != null && graph.find(selected) == null) {
            selected = null;
        }
        surface.setContentSize(adapter.contentWidth(graph), adapter.contentHeight(graph));
        paint();
    }

    private void runCommand(Runnable command) {
        try {
            command.run();
        } catch (DocumentStoreException | IllegalArgumentException ex) {
            report("Edit failed", ex);
        }
    }

    private void report(String what, RuntimeException ex) {
        System.err.println(what + ": " + ex.getMessage());
        onStatus.accept(what + ": " + ex.getMessage());
        paint();
    }

    private static String describe(ConnectionEditSession.Outcome outcome) {
        switch (outcome) {
            case CONNECTED:
                return "Input connected";
            case DISCONNECTED:
                return "Input disconnected";
            case INPUT_ADDED:
                return "Merge input added";
            case INPUT_REMOVED:
                return "Merge input removed";
            case CANCELLED:
                return "Connection cancelled";
            default:
                return "Ready";
        }
    }
}
