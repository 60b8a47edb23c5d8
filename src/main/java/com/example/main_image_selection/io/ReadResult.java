package com.example.main_image_selection.io;

import com.example.main_image_selection.model.DataQualityReport;

import java.util.List;

/**
 * Records read from one stream plus the anomalies met on the way.
 */
public record ReadResult<T>(List<T> records, int lines, DataQualityReport report) {
}
