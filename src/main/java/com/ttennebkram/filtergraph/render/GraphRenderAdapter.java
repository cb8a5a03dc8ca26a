package com.ttennebkram.filtergraph.render;

import com.ttennebkram.filtergraph.document.NodeHandle;
import com.ttennebkram.filtergraph.graph.PrimitiveGraph;
import com.ttennebkram.filtergraph.graph.PrimitiveNode;
import com.ttennebkram.filtergraph.graph.ResolvedSource;
import com.ttennebkram.filtergraph.model.StandardSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out the primitive list and turns graph state into draw commands.
 *
 * Layout, left to right:
 * <pre>
 * | name column | connector lanes ...        | spare | SourceGraphic | SourceAlpha | ... |
 *               ^ connectionX                        ^ sourcesStartX
 * </pre>
 * Rows are stacked top to bottom, one slot tall per input. Row {@code i}
 * of {@code n} owns the lanes up to {@code connectionX + cellSize * (n - i)},
 * so earlier rows have narrower lanes and wires from later rows can reach
 * back over them without overlapping.
 *
 * The same geometry answers pointer queries: which slot marker is under the
 * pointer, and what a drag released at a point would connect to.
 */
public class GraphRenderAdapter {

    private static final float MARKER_SCALE = 0.35f;
    private static final int END_MARKER_SIZE = 5;
    private static final int LABEL_INSET = 4;
    private static final int LABEL_BASELINE = 15;

    private final EditorSettings settings;

    public GraphRenderAdapter(EditorSettings settings) {
        this.settings = settings;
    }

    public EditorSettings getSettings() {
        return settings;
    }

    // ========== Geometry ==========

    public int connectionX() {
        return settings.getLabelColumnWidth();
    }

    public int rowHeight(PrimitiveGraph graph, int position) {
        return settings.getCellSize() * Math.max(1, graph.renderSlotCount(graph.get(position)));
    }

    public int rowTop(PrimitiveGraph graph, int position) {
        return rowTops(graph)[position];
    }

    public int contentHeight(PrimitiveGraph graph) {
        return rowTops(graph)[graph.size()];
    }

    public int contentWidth(PrimitiveGraph graph) {
        return connectionX() + settings.getCellSize() * graph.size()
            + settings.getTextWidth() * (StandardSource.count() + 1);
    }

    /**
     * Right edge of a row's connector lane, where its slot markers sit.
     */
    public int laneRight(PrimitiveGraph graph, int position) {
        return connectionX() + settings.getCellSize() * (graph.size() - position);
    }

    /**
     * Left edge of a standard source label column.
     */
    public int sourceColumnX(PrimitiveGraph graph, int sourceIndex) {
        return connectionX() + settings.getCellSize() * graph.size()
            + settings.getTextWidth() * (sourceIndex + 1);
    }

    public int sourcesStartX(PrimitiveGraph graph) {
        return sourceColumnX(graph, 0);
    }

    /**
     * Triangle of a slot marker as {x0, y0, x1, y1, x2, y2}; the third
     * point is the tip where connectors start.
     */
    public double[] slotMarker(PrimitiveGraph graph, int position, int slot) {
        return slotMarker(graph, rowTops(graph), position, slot);
    }

    private double[] slotMarker(PrimitiveGraph graph, int[] tops, int position, int slot) {
        int slots = Math.max(1, graph.renderSlotCount(graph.get(position)));
        double h = (double) (tops[position + 1] - tops[position]) / slots;
        int x = laneRight(graph, position);
        int conW = (int) (settings.getCellSize() * MARKER_SCALE);
        int conY = (int) (tops[position] + h / 2 - conW + slot * h);
        return new double[]{x, conY, x, conY + conW * 2, x - conW, conY + conW};
    }

    private int[] rowTops(PrimitiveGraph graph) {
        int[] tops = new int[graph.size() + 1];
        for (int i = 0; i < graph.size(); i++) {
            tops[i + 1] = tops[i] + rowHeight(graph, i);
        }
        return tops;
    }

    // ========== Pointer queries ==========

    /**
     * Slot marker under the pointer, or null. A marker's hit region extends
     * one slot height to the left of its base.
     */
    public SlotHit hitTest(PrimitiveGraph graph, double px, double py) {
        int[] tops = rowTops(graph);
        for (int p = 0; p < graph.size(); p++) {
            if (py < tops[p] || py > tops[p + 1]) {
                continue;
            }
            PrimitiveNode node = graph.get(p);
            int slots = graph.renderSlotCount(node);
            double h = (double) (tops[p + 1] - tops[p]) / Math.max(1, slots);
            for (int s = 0; s < slots; s++) {
                double[] pts = slotMarker(graph, tops, p, s);
                double x = pts[0];
                if (px >= x - h && py >= pts[1] && px <= x && py <= pts[3]) {
                    return new SlotHit(node.getHandle(), p, s);
                }
            }
        }
        return null;
    }

    /**
     * Row under the given y, or -1.
     */
    public int rowAt(PrimitiveGraph graph, double py) {
        int[] tops = rowTops(graph);
        for (int p = 0; p < graph.size(); p++) {
            if (py >= tops[p] && py < tops[p + 1]) {
                return p;
            }
        }
        return -1;
    }

    /**
     * What a connection released at the point would connect to. The label
     * columns map to standard sources (clamped to the last column); the rest
     * of a row maps to that row's primitive.
     */
    public DropTarget dropTargetAt(PrimitiveGraph graph, double px, double py) {
        int row = rowAt(graph, py);
        if (row < 0 || px < 0 || px >= contentWidth(graph)) {
            return DropTarget.outside();
        }
        int sourcesX = sourcesStartX(graph);
        if (px >= sourcesX) {
            int column = (int) ((px - sourcesX) / settings.getTextWidth());
            column = Math.max(0, Math.min(StandardSource.count() - 1, column));
            return DropTarget.standardSource(column);
        }
        return DropTarget.nodeRow(graph.get(row).getHandle());
    }

    // ========== Drawing ==========

    public void paint(RenderSurface surface, PrimitiveGraph graph, NodeHandle selected, DragIndicator drag) {
        surface.draw(render(graph, selected, drag, surface.getVisibleTop(), surface.getVisibleHeight()));
    }

    /**
     * Draw commands for the whole list.
     *
     * @param selected      highlighted row, or null
     * @param drag          drag in progress, or null
     * @param visibleTop    content-space y of the viewport top; source labels stick to it
     * @param visibleHeight viewport height
     */
    public List<DrawCommand> render(PrimitiveGraph graph, NodeHandle selected, DragIndicator drag,
                                    double visibleTop, double visibleHeight) {
        List<DrawCommand> out = new ArrayList<>();
        int[] tops = rowTops(graph);
        int width = contentWidth(graph);

        // Selection highlight
        int selectedRow = graph.findIndex(selected);
        if (selectedRow >= 0) {
            out.add(DrawCommand.rect(DrawCommand.Style.SELECTION, 0, tops[selectedRow],
                width, tops[selectedRow + 1] - tops[selectedRow], true));
        }

        // Standard source label columns
        for (StandardSource source : StandardSource.values()) {
            int x = sourceColumnX(graph, source.getIndex());
            out.add(DrawCommand.rect(DrawCommand.Style.BACKGROUND, x, visibleTop,
                settings.getTextWidth(), visibleHeight, true));
            out.add(DrawCommand.text(DrawCommand.Style.TEXT, source.getLabel(), x + 1, visibleTop, true));
            out.add(DrawCommand.line(DrawCommand.Style.OUTLINE, x, visibleTop, x, visibleTop + visibleHeight));
        }

        for (int p = 0; p < graph.size(); p++) {
            PrimitiveNode node = graph.get(p);
            int y = tops[p];
            int h = tops[p + 1] - tops[p];
            int outlineX = laneRight(graph, p);

            out.add(DrawCommand.text(DrawCommand.Style.TEXT, node.getKind().getLabel(),
                LABEL_INSET, y + LABEL_BASELINE, false));

            // Bottom and side outline of the connector area
            out.add(DrawCommand.line(DrawCommand.Style.OUTLINE, connectionX(), y + h, outlineX, y + h));
            out.add(DrawCommand.line(DrawCommand.Style.OUTLINE, outlineX, y - 1, outlineX, y + h));

            boolean dragRow = drag != null && node.getHandle().equals(drag.getOriginNode());
            double dragY = -1;
            int slots = graph.renderSlotCount(node);
            for (int s = 0; s < slots; s++) {
                double[] marker = slotMarker(graph, tops, p, s);
                boolean dragging = dragRow && drag.getOriginSlot() == s;
                out.add(DrawCommand.polygon(dragging ? DrawCommand.Style.MARKER_ACTIVE : DrawCommand.Style.MARKER,
                    marker, dragging).forSlot(node.getHandle(), s));

                double tipY = marker[5];
                if (dragging) {
                    dragY = tipY;
                } else {
                    addConnection(out, graph, tops, node, s, outlineX, tipY);
                }
            }

            if (dragRow && dragY >= 0) {
                double mx = drag.getPointerX();
                double my = drag.getPointerY();
                out.add(DrawCommand.line(DrawCommand.Style.DRAG, outlineX, dragY, mx, dragY)
                    .forSlot(node.getHandle(), drag.getOriginSlot()));
                out.add(DrawCommand.line(DrawCommand.Style.DRAG, mx, dragY, mx, my)
                    .forSlot(node.getHandle(), drag.getOriginSlot()));
            }
        }
        return out;
    }

    private void addConnection(List<DrawCommand> out, PrimitiveGraph graph, int[] tops,
                               PrimitiveNode node, int slot, double x1, double y1) {
        ResolvedSource source = graph.resolve(node, slot);
        switch (source.getType()) {
            case STANDARD:
                if (StandardSource.fromIndex(source.getSourceIndex()) != null) {
                    addStraight(out, graph, node, slot, source.getSourceIndex(), DrawCommand.Style.EXPLICIT, x1, y1);
                }
                break;
            case IMPLICIT_PREVIOUS:
                if (source.getNode() == null) {
                    // Head of the list reads the source graphic
                    addStraight(out, graph, node, slot, StandardSource.SOURCE_GRAPHIC.getIndex(),
                        DrawCommand.Style.IMPLICIT, x1, y1);
                } else {
                    addElbow(out, graph, tops, node, slot, source.getNode(), DrawCommand.Style.IMPLICIT, x1, y1);
                }
                break;
            case PRODUCER:
                addElbow(out, graph, tops, node, slot, source.getNode(), DrawCommand.Style.EXPLICIT, x1, y1);
                break;
            default:
                break;
        }
    }

    private void addStraight(List<DrawCommand> out, PrimitiveGraph graph, PrimitiveNode node, int slot,
                             int sourceIndex, DrawCommand.Style style, double x1, double y1) {
        int tw = settings.getTextWidth();
        double endX = sourceColumnX(graph, sourceIndex) + (int) (tw * 0.5f) + 1;
        out.add(DrawCommand.rect(style, endX - 2, y1 - 2, END_MARKER_SIZE, END_MARKER_SIZE, true)
            .forSlot(node.getHandle(), slot));
        out.add(DrawCommand.line(style, x1, y1, endX, y1).forSlot(node.getHandle(), slot));
    }

    /**
     * Bevelled "L": across to the producer's lane, then up to the bottom of its row.
     */
    private void addElbow(List<DrawCommand> out, PrimitiveGraph graph, int[] tops, PrimitiveNode node, int slot,
                          PrimitiveNode producer, DrawCommand.Style style, double x1, double y1) {
        int q = graph.findIndex(producer);
        if (q < 0) {
            return;
        }
        int cell = settings.getCellSize();
        double x2 = laneRight(graph, q) - cell / 2;
        double y2 = tops[q + 1];
        double bevel = cell / 4;
        NodeHandle owner = node.getHandle();
        out.add(DrawCommand.line(style, x1, y1, x2 - bevel, y1).forSlot(owner, slot));
        out.add(DrawCommand.line(style, x2 - bevel, y1, x2, y1 - bevel).forSlot(owner, slot));
        out.add(DrawCommand.line(style, x2, y1 - bevel, x2, y2).forSlot(owner, slot));
    }
}
