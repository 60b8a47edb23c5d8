package com.example.main_image_selection.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * Run-level aggregates.
 *
 * @param runId                         identifier of the run.
 * @param asOf                          as-of instant of the run.
 * @param imagesProcessed               scored candidate images.
 * @param hotelsWithImages              distinct hotels among the candidates.
 * @param hotelsProcessed               distinct hotels among the candidates and the prior assignments.
 * @param hotelsWithoutSelection        processed hotels that ended without a selection.
 * @param selections                    number of selections.
 * @param changeCounts                  CDC events per change type, zeros included.
 * @param mainImageChanges              newly elected, updated and deleted main images.
 * @param changeRate                    share of CDC events that are not {@link ChangeType#UNCHANGED}.
 * @param scoreDistribution             distribution of selected scores, {@code null} without selections.
 * @param disqualifiedImages            candidates carrying a disqualifying tag.
 * @param disqualifiedOnlySelections    selections forced from disqualified-only candidates.
 * @param suppressedHotels              disqualified-only hotels left without a selection.
 * @param imagesWithDefaultedAttributes candidates scored with at least one default component.
 * @param anomalies                     data-quality anomalies per type, zeros included.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetricsRecord(String runId,
                            @JsonFormat(shape = JsonFormat.Shape.STRING) Instant asOf,
                            long imagesProcessed,
                            long hotelsWithImages,
                            long hotelsProcessed,
                            long hotelsWithoutSelection,
                            long selections,
                            Map<ChangeType, Long> changeCounts,
                            MainImageChanges mainImageChanges,
                            double changeRate,
                            ScoreDistribution scoreDistribution,
                            long disqualifiedImages,
                            long disqualifiedOnlySelections,
                            long suppressedHotels,
                            long imagesWithDefaultedAttributes,
                            Map<AnomalyType, Long> anomalies) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MainImageChanges(long newlyElected, long updated, long deleted) {
    }
}
