package com.example.main_image_selection.io;

import com.example.main_image_selection.model.AnomalyType;
import com.example.main_image_selection.model.DataQualityReport;

import java.util.EnumMap;
import java.util.Map;

/**
 * Mutable anomaly tally used while parsing a single input stream.
 */
public class AnomalyCounter {
    private final Map<AnomalyType, Long> counts = new EnumMap<>(AnomalyType.class);

    public void record(AnomalyType type) {
        counts.merge(type, 1L, Long::sum);
    }

    public long count(AnomalyType type) {
        return counts.getOrDefault(type, 0L);
    }

    public DataQualityReport toReport() {
        DataQualityReport report = DataQualityReport.empty();
        for (Map.Entry<AnomalyType, Long> entry : counts.entrySet()) {
            report = report.plus(entry.getKey(), entry.getValue());
        }
        return report;
    }
}
