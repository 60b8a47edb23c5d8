package com.example.main_image_selection.snapshot;

import com.example.main_image_selection.model.DecidedBy;
import com.example.main_image_selection.model.RankMetadata;
import com.example.main_image_selection.model.Selection;
import com.example.main_image_selection.model.SelectionSet;
import com.example.main_image_selection.model.SnapshotRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotBuilderTest {

    private static final Instant AS_OF = Instant.parse("2024-05-01T00:00:00Z");

    private final SnapshotBuilder builder = new SnapshotBuilder();

    @Test
    void oneRecordPerSelectionInHotelOrder() {
        SelectionSet selections = SelectionSet.of(List.of(selection("H2", "I3", 0.7), selection("H1", "I1", 0.9)));

        List<SnapshotRecord> snapshot = builder.build(selections, AS_OF);

        assertThat(snapshot).containsExactly(
                new SnapshotRecord("H1", "I1", 0.9, AS_OF),
                new SnapshotRecord("H2", "I3", 0.7, AS_OF));
    }

    @Test
    void emptySelectionGivesEmptySnapshot() {
        assertThat(builder.build(SelectionSet.empty(), AS_OF)).isEmpty();
    }

    private static Selection selection(String hotelId, String imageId, double score) {
        return new Selection(hotelId, imageId, score, new RankMetadata(1, 0, false, DecidedBy.SOLE_CANDIDATE, null));
    }
}
