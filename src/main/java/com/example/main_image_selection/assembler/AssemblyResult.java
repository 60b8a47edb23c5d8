package com.example.main_image_selection.assembler;

import com.example.main_image_selection.model.DataQualityReport;
import com.example.main_image_selection.model.EnrichedImage;

import java.util.List;

/**
 * Output of the candidate assembly.
 *
 * @param candidates    one enriched image per accepted image record, in input order.
 * @param droppedImages image records rejected for missing join keys or duplicate ids.
 * @param report        anomalies found while joining.
 */
public record AssemblyResult(List<EnrichedImage> candidates, int droppedImages, DataQualityReport report) {
}
