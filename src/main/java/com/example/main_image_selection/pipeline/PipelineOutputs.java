package com.example.main_image_selection.pipeline;

import com.example.main_image_selection.model.CdcEvent;
import com.example.main_image_selection.model.MetricsRecord;
import com.example.main_image_selection.model.ScoredImage;
import com.example.main_image_selection.model.SelectionSet;
import com.example.main_image_selection.model.SnapshotRecord;

import java.util.List;

/**
 * Consistent outputs of a completed run.
 *
 * @param selections selections per hotel.
 * @param cdc        change events, ordered by hotel id.
 * @param snapshot   snapshot rows, ordered by hotel id.
 * @param metrics    run metrics.
 * @param scored     every scored candidate, in input order.
 */
public record PipelineOutputs(SelectionSet selections,
                              List<CdcEvent> cdc,
                              List<SnapshotRecord> snapshot,
                              MetricsRecord metrics,
                              List<ScoredImage> scored) {
}
