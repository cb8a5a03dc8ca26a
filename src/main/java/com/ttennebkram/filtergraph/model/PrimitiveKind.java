package com.ttennebkram.filtergraph.model;

/**
 * Filter primitive element types known to the editor.
 *
 * Each kind declares how many input slots it carries. Merge is the one
 * dynamic kind: it has one slot per merge sub-node, so its count comes from
 * the document rather than from this enum.
 */
public enum PrimitiveKind {
    BLEND("feBlend", "Blend", 2),
    COLOR_MATRIX("feColorMatrix", "Color Matrix", 1),
    COMPONENT_TRANSFER("feComponentTransfer", "Component Transfer", 1),
    COMPOSITE("feComposite", "Composite", 2),
    CONVOLVE_MATRIX("feConvolveMatrix", "Convolve Matrix", 1),
    DIFFUSE_LIGHTING("feDiffuseLighting", "Diffuse Lighting", 1),
    DISPLACEMENT_MAP("feDisplacementMap", "Displacement Map", 2),
    FLOOD("feFlood", "Flood", 1),
    GAUSSIAN_BLUR("feGaussianBlur", "Gaussian Blur", 1),
    IMAGE("feImage", "Image", 1),
    MERGE("feMerge", "Merge", -1),
    MORPHOLOGY("feMorphology", "Morphology", 1),
    OFFSET("feOffset", "Offset", 1),
    SPECULAR_LIGHTING("feSpecularLighting", "Specular Lighting", 1),
    TILE("feTile", "Tile", 1),
    TURBULENCE("feTurbulence", "Turbulence", 1),
    UNKNOWN("", "Unknown", 1);

    /** Element name of the children that carry a merge's inputs. */
    public static final String MERGE_NODE_ELEMENT = "feMergeNode";

    private final String elementName;
    private final String label;
    private final int fixedInputCount;

    PrimitiveKind(String elementName, String label, int fixedInputCount) {
        this.elementName = elementName;
        this.label = label;
        this.fixedInputCount = fixedInputCount;
    }

    public String getElementName() {
        return elementName;
    }

    public String getLabel() {
        return label;
    }

    public boolean isMerge() {
        return this == MERGE;
    }

    /**
     * Whether this kind reads a second input from the "in2" attribute.
     */
    public boolean hasSecondInput() {
        return fixedInputCount == 2;
    }

    /**
     * Slot count for ordinary kinds. Merge returns -1; ask the graph instead.
     */
    public int getFixedInputCount() {
        return fixedInputCount;
    }

    /**
     * Map a document element name to a kind. Unrecognised names map to
     * UNKNOWN so the primitive still shows up in the list.
     */
    public static PrimitiveKind fromElementName(String elementName) {
        if (elementName != null && !elementName.isEmpty()) {
            for (PrimitiveKind kind : values()) {
                if (kind.elementName.equals(elementName)) {
                    return kind;
                }
            }
        }
        return UNKNOWN;
    }
}
