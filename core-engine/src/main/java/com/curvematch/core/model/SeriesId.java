package com.curvematch.core.model;

import java.util.Locale;

/**
 * Identity of the four measured series.
 *
 * <p>
 * Results are keyed by this enum, never by list position, so a series index
 * cannot be confused with a candidate index.
 * </p>
 *
 * @since 1.0.0
 */
public enum SeriesId {
    Y1,
    Y2,
    Y3,
    Y4;

    /**
     * @return lowercase column label, e.g. {@code "y1"}
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a column label such as {@code "y3"} (case-insensitive).
     *
     * @param label the label
     * @return the matching series
     * @throws IllegalArgumentException if no series has this label
     */
    public static SeriesId fromLabel(String label) {
        for (SeriesId id : values()) {
            if (id.label().equalsIgnoreCase(label)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown series label: '" + label
                + "'. Supported: y1, y2, y3, y4");
    }
}
