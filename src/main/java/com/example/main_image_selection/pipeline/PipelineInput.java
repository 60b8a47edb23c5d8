package com.example.main_image_selection.pipeline;

import com.example.main_image_selection.model.DataQualityReport;
import com.example.main_image_selection.model.ImageRecord;
import com.example.main_image_selection.model.PriorAssignment;
import com.example.main_image_selection.model.TagRecord;

import java.util.List;

/**
 * The three input streams of a run, already materialised. A {@code null} stream reads as empty; {@code null}
 * records are rejected.
 *
 * @param images     image records.
 * @param tags       tag records.
 * @param prior      main images of the previous run.
 * @param readReport anomalies found while reading the streams.
 */
public record PipelineInput(List<ImageRecord> images,
                            List<TagRecord> tags,
                            List<PriorAssignment> prior,
                            DataQualityReport readReport) {

    public PipelineInput {
        images = images == null ? List.of() : List.copyOf(images);
        tags = tags == null ? List.of() : List.copyOf(tags);
        prior = prior == null ? List.of() : List.copyOf(prior);
        readReport = readReport == null ? DataQualityReport.empty() : readReport;
    }

    public static PipelineInput of(List<ImageRecord> images, List<TagRecord> tags, List<PriorAssignment> prior) {
        return new PipelineInput(images, tags, prior, DataQualityReport.empty());
    }
}
