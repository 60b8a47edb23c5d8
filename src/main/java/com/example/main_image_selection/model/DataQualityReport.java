package com.example.main_image_selection.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable anomaly counts collected while reading and assembling the inputs.
 */
public final class DataQualityReport {
    private static final DataQualityReport EMPTY = new DataQualityReport(new EnumMap<>(AnomalyType.class));

    private final Map<AnomalyType, Long> counts;

    private DataQualityReport(EnumMap<AnomalyType, Long> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    public static DataQualityReport empty() {
        return EMPTY;
    }

    public static DataQualityReport of(AnomalyType type, long count) {
        return empty().plus(type, count);
    }

    public DataQualityReport plus(AnomalyType type, long count) {
        if (count <= 0) {
            return this;
        }
        EnumMap<AnomalyType, Long> copy = copyCounts();
        copy.merge(type, count, Long::sum);
        return new DataQualityReport(copy);
    }

    public DataQualityReport merge(DataQualityReport other) {
        if (other == null || other.counts.isEmpty()) {
            return this;
        }
        EnumMap<AnomalyType, Long> copy = copyCounts();
        other.counts.forEach((type, count) -> copy.merge(type, count, Long::sum));
        return new DataQualityReport(copy);
    }

    public long count(AnomalyType type) {
        return counts.getOrDefault(type, 0L);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    /** Counts for every anomaly type, zeros included. */
    public Map<AnomalyType, Long> asMap() {
        EnumMap<AnomalyType, Long> all = new EnumMap<>(AnomalyType.class);
        for (AnomalyType type : AnomalyType.values()) {
            all.put(type, count(type));
        }
        return all;
    }

    private EnumMap<AnomalyType, Long> copyCounts() {
        EnumMap<AnomalyType, Long> copy = new EnumMap<>(AnomalyType.class);
        copy.putAll(counts);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataQualityReport that)) return false;
        return counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "DataQualityReport" + counts;
    }
}
