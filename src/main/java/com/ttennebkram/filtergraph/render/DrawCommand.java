package com.ttennebkram.filtergraph.render;

import com.ttennebkram.filtergraph.document.NodeHandle;

import java.util.Arrays;

/**
 * One drawing primitive for a {@link RenderSurface}.
 *
 * Coordinates are in content space (before scrolling):
 * RECT is {x, y, width, height}, LINE is {x1, y1, x2, y2}, POLYGON is
 * interleaved {x0, y0, x1, y1, ...} and TEXT is {x, y}.
 *
 * Connector commands carry the node and slot they belong to so callers can
 * tell which wire a command is part of.
 */
public final class DrawCommand {

    public enum Type {
        RECT,
        LINE,
        POLYGON,
        TEXT
    }

    public enum Style {
        /** Row and column outlines. */
        OUTLINE,
        /** Standard source column background. */
        BACKGROUND,
        /** Highlight of the selected row. */
        SELECTION,
        /** Labels. */
        TEXT,
        /** Idle slot marker. */
        MARKER,
        /** Marker of the slot being dragged. */
        MARKER_ACTIVE,
        /** Authored connection. */
        EXPLICIT,
        /** Inferred connection to the default source. */
        IMPLICIT,
        /** Rubber band following the pointer. */
        DRAG
    }

    private final Type type;
    private final Style style;
    private final double[] coords;
    private final boolean filled;
    private final String text;
    private final boolean vertical;
    private final NodeHandle node;
    private final int slot;

    private DrawCommand(Type type, Style style, double[] coords, boolean filled,
                        String text, boolean vertical, NodeHandle node, int slot) {
        this.type = type;
        this.style = style;
        this.coords = coords;
        this.filled = filled;
        this.text = text;
        this.vertical = vertical;
        this.node = node;
        this.slot = slot;
    }

    public static DrawCommand rect(Style style, double x, double y, double w, double h, boolean filled) {
        return new DrawCommand(Type.RECT, style, new double[]{x, y, w, h}, filled, null, false, null, -1);
    }

    public static DrawCommand line(Style style, double x1, double y1, double x2, double y2) {
        return new DrawCommand(Type.LINE, style, new double[]{x1, y1, x2, y2}, false, null, false, null, -1);
    }

    public static DrawCommand polygon(Style style, double[] points, boolean filled) {
        if (points.length < 6 || points.length % 2 != 0) {
            throw new IllegalArgumentException("Polygon needs at least three x/y pairs");
        }
        return new DrawCommand(Type.POLYGON, style, points.clone(), filled, null, false, null, -1);
    }

    public static DrawCommand text(Style style, String text, double x, double y, boolean vertical) {
        return new DrawCommand(Type.TEXT, style, new double[]{x, y}, true, text, vertical, null, -1);
    }

    /**
     * Same command tagged with the slot it belongs to.
     */
    public DrawCommand forSlot(NodeHandle owner, int slotIndex) {
        return new DrawCommand(type, style, coords, filled, text, vertical, owner, slotIndex);
    }

    public Type getType() {
        return type;
    }

    public Style getStyle() {
        return style;
    }

    public double[] getCoords() {
        return coords.clone();
    }

    public double coord(int index) {
        return coords[index];
    }

    public boolean isFilled() {
        return filled;
    }

    public String getText() {
        return text;
    }

    public boolean isVertical() {
        return vertical;
    }

    /** Node whose slot this command draws, or null. */
    public NodeHandle getNode() {
        return node;
    }

    /** Slot index this command draws, or -1. */
    public int getSlot() {
        return slot;
    }

    public boolean belongsTo(NodeHandle owner, int slotIndex) {
        return node != null && node.equals(owner) && slot == slotIndex;
    }

    @Override
    public String toString() {
        return type + "(" + style + ")" + Arrays.toString(coords)
            + (text != null ? " '" + text + "'" : "")
            + (node != null ? " " + node + ":" + slot : "");
    }
}
