package com.curvematch.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exactly one {@link SelectionRecord} per {@link SeriesId}.
 *
 * <p>
 * Construction fails unless all four series are present and each record is
 * filed under its own series. Iteration order is {@code Y1..Y4}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SelectionSet {

    private final EnumMap<SeriesId, SelectionRecord> records;

    public SelectionSet(Map<SeriesId, SelectionRecord> records) {
        Objects.requireNonNull(records, "Selection records must not be null");
        EnumMap<SeriesId, SelectionRecord> copy = new EnumMap<>(SeriesId.class);
        for (SeriesId id : SeriesId.values()) {
            SelectionRecord record = records.get(id);
            if (record == null) {
                throw new IllegalArgumentException("Missing selection record for series " + id.label());
            }
            if (record.getSeriesId() != id) {
                throw new IllegalArgumentException("Selection record for " + record.getSeriesId().label()
                        + " filed under " + id.label());
            }
            copy.put(id, record);
        }
        this.records = copy;
    }

    public SelectionRecord get(SeriesId id) {
        return records.get(Objects.requireNonNull(id, "Series id must not be null"));
    }

    /**
     * @return unmodifiable list of the records in {@code Y1..Y4} order
     */
    public List<SelectionRecord> records() {
        return List.copyOf(records.values());
    }

    /**
     * @return unmodifiable map view keyed by series
     */
    public Map<SeriesId, SelectionRecord> asMap() {
        return Collections.unmodifiableMap(records);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SelectionSet that))
            return false;
        return records.equals(that.records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "SelectionSet" + records.values();
    }
}
