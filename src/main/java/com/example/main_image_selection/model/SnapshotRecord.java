package com.example.main_image_selection.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Current main image of a hotel, as of a run.
 *
 * @param hotelId hotel identifier.
 * @param imageId selected image.
 * @param score   score of the selected image.
 * @param asOf    as-of instant of the run that produced the record.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SnapshotRecord(String hotelId,
                             String imageId,
                             double score,
                             @JsonFormat(shape = JsonFormat.Shape.STRING) Instant asOf) {
}
