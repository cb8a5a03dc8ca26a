package com.ttennebkram.filtergraph.model;

/**
 * The fixed set of non-primitive inputs a filter primitive can read from.
 * Order matters: the index of each constant is what gets encoded into raw
 * reference values and which label column the list draws it in.
 */
public enum StandardSource {
    SOURCE_GRAPHIC("SourceGraphic", "Source Graphic"),
    SOURCE_ALPHA("SourceAlpha", "Source Alpha"),
    BACKGROUND_IMAGE("BackgroundImage", "Background Image"),
    BACKGROUND_ALPHA("BackgroundAlpha", "Background Alpha"),
    FILL_PAINT("FillPaint", "Fill Paint"),
    STROKE_PAINT("StrokePaint", "Stroke Paint");

    private final String key;
    private final String label;

    StandardSource(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /**
     * Attribute value stored in the document for this source.
     */
    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public int getIndex() {
        return ordinal();
    }

    /**
     * Number of standard sources (columns in the source label area).
     */
    public static int count() {
        return values().length;
    }

    /**
     * Look up by index, or null if out of range.
     */
    public static StandardSource fromIndex(int index) {
        StandardSource[] all = values();
        if (index < 0 || index >= all.length) {
            return null;
        }
        return all[index];
    }

    /**
     * Look up by persisted key, or null if the key is not a standard source.
     */
    public static StandardSource fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (StandardSource source : values()) {
            if (source.key.equals(key)) {
                return source;
            }
        }
        return null;
    }
}
