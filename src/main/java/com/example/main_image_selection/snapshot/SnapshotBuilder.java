package com.example.main_image_selection.snapshot;

import com.example.main_image_selection.model.Selection;
import com.example.main_image_selection.model.SelectionSet;
import com.example.main_image_selection.model.SnapshotRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Projects the current selections into the full-state snapshot that becomes the next run's prior assignment.
 */
@Component
public class SnapshotBuilder {

    public List<SnapshotRecord> build(SelectionSet selections, Instant asOf) {
        return selections.asList().stream()
                .map(selection -> toRecord(selection, asOf))
                .toList();
    }

    private static SnapshotRecord toRecord(Selection selection, Instant asOf) {
        return new SnapshotRecord(selection.hotelId(), selection.imageId(), selection.score(), asOf);
    }
}
