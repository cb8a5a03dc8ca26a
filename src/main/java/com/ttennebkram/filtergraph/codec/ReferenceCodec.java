package com.ttennebkram.filtergraph.codec;

import com.ttennebkram.filtergraph.model.InputReference;
import com.ttennebkram.filtergraph.model.StandardSource;

/**
 * Converts input references to and from their stored forms.
 *
 * Two layers are handled here:
 * <ul>
 *   <li>raw values: {@code null} for unspecified, {@code >= 0} for a named
 *       result, {@code < -1} for standard source {@code -(raw + 2)};
 *       {@code -1} is reserved and reads as unspecified</li>
 *   <li>attribute strings: a standard source key such as
 *       {@code "SourceGraphic"}, or a result name {@code "result<N>"}</li>
 * </ul>
 *
 * Every method is total: malformed input decodes to unspecified rather than
 * throwing, so a damaged document can still be opened and repaired.
 */
public final class ReferenceCodec {

    /** Prefix of canonical result names stored in the "result" attribute. */
    public static final String RESULT_PREFIX = "result";

    private static final int RESERVED_RAW = -1;

    private ReferenceCodec() {
    }

    // ========== Raw values ==========

    public static InputReference decode(Integer raw) {
        if (raw == null || raw == RESERVED_RAW) {
            return InputReference.unspecified();
        }
        if (raw >= 0) {
            return InputReference.namedResult(raw);
        }
        return InputReference.standardSource(-(raw + 2));
    }

    public static Integer encode(InputReference reference) {
        if (reference == null) {
            return null;
        }
        switch (reference.getType()) {
            case NAMED_RESULT:
                return reference.getOutputId();
            case STANDARD_SOURCE:
                return -reference.getSourceIndex() - 2;
            default:
                return null;
        }
    }

    // ========== Attribute strings ==========

    /**
     * Parse an input attribute value into a raw value, or null when the
     * attribute is absent or cannot be understood.
     */
    public static Integer parseAttribute(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        StandardSource source = StandardSource.fromKey(trimmed);
        if (source != null) {
            return -source.getIndex() - 2;
        }

        Integer outputId = parseOutputId(trimmed);
        if (outputId != null) {
            return outputId;
        }

        // Plain numbers are accepted when they fall in the legal raw domain
        Integer number = parseInteger(trimmed);
        if (number != null && number != RESERVED_RAW) {
            return number;
        }
        return null;
    }

    /**
     * Format a raw value as an input attribute, or null to remove the attribute.
     */
    public static String formatAttribute(Integer raw) {
        if (raw == null || raw == RESERVED_RAW) {
            return null;
        }
        if (raw >= 0) {
            return formatOutputId(raw);
        }
        StandardSource source = StandardSource.fromIndex(-(raw + 2));
        return source != null ? source.getKey() : Integer.toString(raw);
    }

    public static InputReference fromAttribute(String value) {
        return decode(parseAttribute(value));
    }

    public static String toAttribute(InputReference reference) {
        return formatAttribute(encode(reference));
    }

    // ========== Result names ==========

    /**
     * Parse a canonical result name ("result7") into its output id.
     * Returns null for anything else.
     */
    public static Integer parseOutputId(String resultName) {
        if (resultName == null) {
            return null;
        }
        String trimmed = resultName.trim();
        if (!trimmed.startsWith(RESULT_PREFIX) || trimmed.length() == RESULT_PREFIX.length()) {
            return null;
        }
        String digits = trimmed.substring(RESULT_PREFIX.length());
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return null;
            }
        }
        return parseInteger(digits);
    }

    public static String formatOutputId(int outputId) {
        if (outputId < 0) {
            throw new IllegalArgumentException("Output id must be non-negative: " + outputId);
        }
        return RESULT_PREFIX + outputId;
    }

    private static Integer parseInteger(String text) {
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
