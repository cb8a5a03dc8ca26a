package com.ttennebkram.filtergraph.render;

import java.util.prefs.Preferences;

/**
 * Layout and interaction constants for the primitive list.
 */
public final class EditorSettings {

    // Preference keys
    public static final String PREF_CELL_SIZE = "cellSize";
    public static final String PREF_TEXT_WIDTH = "textWidth";
    public static final String PREF_LABEL_COLUMN_WIDTH = "labelColumnWidth";
    public static final String PREF_AUTOSCROLL_SPEED = "autoscrollSpeed";
    public static final String PREF_AUTOSCROLL_EDGE = "autoscrollEdge";
    public static final String PREF_AUTOSCROLL_INTERVAL = "autoscrollIntervalMillis";

    // Defaults
    public static final int DEFAULT_CELL_SIZE = 24;
    public static final int DEFAULT_TEXT_WIDTH = 16;
    public static final int DEFAULT_LABEL_COLUMN_WIDTH = 140;
    public static final int DEFAULT_AUTOSCROLL_SPEED = 10;
    public static final int DEFAULT_AUTOSCROLL_EDGE = 15;
    public static final long DEFAULT_AUTOSCROLL_INTERVAL = 150;

    /** Distance past the edge that adds one unit of autoscroll speed. */
    public static final int AUTOSCROLL_DISTANCE_DIVISOR = 5;

    private static final EditorSettings DEFAULTS = new EditorSettings(
        DEFAULT_CELL_SIZE, DEFAULT_TEXT_WIDTH, DEFAULT_LABEL_COLUMN_WIDTH,
        DEFAULT_AUTOSCROLL_SPEED, DEFAULT_AUTOSCROLL_EDGE, DEFAULT_AUTOSCROLL_INTERVAL);

    private final int cellSize;
    private final int textWidth;
    private final int labelColumnWidth;
    private final int autoscrollSpeed;
    private final int autoscrollEdge;
    private final long autoscrollIntervalMillis;

    public EditorSettings(int cellSize, int textWidth, int labelColumnWidth,
                          int autoscrollSpeed, int autoscrollEdge, long autoscrollIntervalMillis) {
        if (cellSize <= 0 || textWidth <= 0 || labelColumnWidth < 0) {
            throw new IllegalArgumentException("Layout sizes must be positive");
        }
        if (autoscrollIntervalMillis <= 0) {
            throw new IllegalArgumentException("Autoscroll interval must be positive");
        }
        this.cellSize = cellSize;
        this.textWidth = textWidth;
        this.labelColumnWidth = labelColumnWidth;
        this.autoscrollSpeed = autoscrollSpeed;
        this.autoscrollEdge = autoscrollEdge;
        this.autoscrollIntervalMillis = autoscrollIntervalMillis;
    }

    public static EditorSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Read settings from preferences, falling back to defaults for missing
     * or invalid values.
     */
    public static EditorSettings fromPreferences(Preferences prefs) {
        try {
            return new EditorSettings(
                prefs.getInt(PREF_CELL_SIZE, DEFAULT_CELL_SIZE),
                prefs.getInt(PREF_TEXT_WIDTH, DEFAULT_TEXT_WIDTH),
                prefs.getInt(PREF_LABEL_COLUMN_WIDTH, DEFAULT_LABEL_COLUMN_WIDTH),
                prefs.getInt(PREF_AUTOSCROLL_SPEED, DEFAULT_AUTOSCROLL_SPEED),
                prefs.getInt(PREF_AUTOSCROLL_EDGE, DEFAULT_AUTOSCROLL_EDGE),
                prefs.getLong(PREF_AUTOSCROLL_INTERVAL, DEFAULT_AUTOSCROLL_INTERVAL));
        } catch (IllegalArgumentException e) {
            System.err.println("Ignoring invalid editor preferences: " + e.getMessage());
            return DEFAULTS;
        }
    }

    public void saveTo(Preferences prefs) {
        prefs.putInt(PREF_CELL_SIZE, cellSize);
        prefs.putInt(PREF_TEXT_WIDTH, textWidth);
        prefs.putInt(PREF_LABEL_COLUMN_WIDTH, labelColumnWidth);
        prefs.putInt(PREF_AUTOSCROLL_SPEED, autoscrollSpeed);
        prefs.putInt(PREF_AUTOSCROLL_EDGE, autoscrollEdge);
        prefs.putLong(PREF_AUTOSCROLL_INTERVAL, autoscrollIntervalMillis);
    }

    public EditorSettings withCellSize(int newCellSize) {
        return new EditorSettings(newCellSize, textWidth, labelColumnWidth,
            autoscrollSpeed, autoscrollEdge, autoscrollIntervalMillis);
    }

    /** Height of one slot, and width of one connector lane. */
    public int getCellSize() {
        return cellSize;
    }

    /** Width of one standard source label column. */
    public int getTextWidth() {
        return textWidth;
    }

    /** Width of the primitive name column left of the connectors. */
    public int getLabelColumnWidth() {
        return labelColumnWidth;
    }

    public int getAutoscrollSpeed() {
        return autoscrollSpeed;
    }

    /** Height of the band inside each edge where slow autoscroll starts. */
    public int getAutoscrollEdge() {
        return autoscrollEdge;
    }

    public long getAutoscrollIntervalMillis() {
        return autoscrollIntervalMillis;
    }
}
