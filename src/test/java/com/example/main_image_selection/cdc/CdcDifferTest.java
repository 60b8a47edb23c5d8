package com.example.main_image_selection.cdc;

import com.example.main_image_selection.exception.StructuralViolationException;
import com.example.main_image_selection.model.CdcEvent;
import com.example.main_image_selection.model.ChangeType;
import com.example.main_image_selection.model.DecidedBy;
import com.example.main_image_selection.model.PriorAssignment;
import com.example.main_image_selection.model.RankMetadata;
import com.example.main_image_selection.model.Selection;
import com.example.main_image_selection.model.SelectionSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CdcDifferTest {

    private final CdcDiffer differ = new CdcDiffer();

    @Test
    void classifiesUnchangedReassignedAndAssignedHotels() {
        List<PriorAssignment> prior = List.of(new PriorAssignment("H2", "I2"), new PriorAssignment("H1", "I1"));
        SelectionSet selections = SelectionSet.of(List.of(
                selection("H1", "I1", 0.9),
                selection("H2", "I3", 0.7),
                selection("H3", "I4", 0.5)));

        List<CdcEvent> events = differ.diff(prior, selections);

        assertThat(events).containsExactly(
                new CdcEvent("H1", ChangeType.UNCHANGED, "I1", "I1", 0.9),
                new CdcEvent("H2", ChangeType.REASSIGNED, "I2", "I3", 0.7),
                new CdcEvent("H3", ChangeType.ASSIGNED, null, "I4", 0.5));
    }

    @Test
    void hotelMissingFromCurrentSelectionIsRemoved() {
        List<CdcEvent> events = differ.diff(List.of(new PriorAssignment("H9", "I9")), SelectionSet.empty());

        assertThat(events).containsExactly(new CdcEvent("H9", ChangeType.REMOVED, "I9", null, null));
    }

    @Test
    void everyHotelOfEitherSideGetsExactlyOneEventInHotelOrder() {
        List<PriorAssignment> prior = new ArrayList<>();
        List<Selection> current = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            String hotel = String.format("H%02d", i);
            if (i % 3 != 0) {
                prior.add(new PriorAssignment(hotel, "P" + i));
            }
            if (i % 4 != 0) {
                current.add(selection(hotel, i % 2 == 0 ? "P" + i : "N" + i, i / 100.0));
            }
        }

        List<CdcEvent> events = differ.diff(prior, SelectionSet.of(current));

        List<String> hotels = events.stream().map(CdcEvent::hotelId).toList();
        assertThat(hotels).doesNotHaveDuplicates().isSorted();
        assertThat(hotels).hasSize(50 - countNeither());
        assertThat(events.stream().filter(e -> e.changeType() == ChangeType.REMOVED))
                .allSatisfy(e -> assertThat(e.newImageId()).isNull());
    }

    @Test
    void diffingASelectionAgainstItsOwnSnapshotIsAllUnchanged() {
        SelectionSet selections = SelectionSet.of(List.of(selection("H1", "I1", 0.4), selection("H2", "I7", 0.8)));
        List<PriorAssignment> asPrior = selections.asList().stream()
                .map(s -> new PriorAssignment(s.hotelId(), s.imageId()))
                .collect(Collectors.toList());

        assertThat(differ.diff(asPrior, selections))
                .extracting(CdcEvent::changeType)
                .containsOnly(ChangeType.UNCHANGED);
    }

    @Test
    void inputsAreNotModified() {
        List<PriorAssignment> prior = new ArrayList<>(List.of(new PriorAssignment("H1", "I1")));
        SelectionSet selections = SelectionSet.of(List.of(selection("H2", "I2", 0.1)));

        differ.diff(prior, selections);

        assertThat(prior).containsExactly(new PriorAssignment("H1", "I1"));
        assertThat(selections.hotelIds()).containsExactly("H2");
    }

    @Test
    void identicalDuplicatePriorRowsCollapse() {
        assertThat(CdcDiffer.indexPrior(List.of(new PriorAssignment("H1", "I1"), new PriorAssignment("H1", "I1"))))
                .hasSize(1);
    }

    @Test
    void conflictingPriorRowsAreAStructuralViolation() {
        List<PriorAssignment> prior = List.of(new PriorAssignment("H1", "I1"), new PriorAssignment("H1", "I2"));

        assertThatThrownBy(() -> differ.diff(prior, SelectionSet.empty()))
                .isInstanceOf(StructuralViolationException.class)
                .hasMessageContaining("H1");
    }

    private static int countNeither() {
        int neither = 0;
        for (int i = 0; i < 50; i++) {
            if (i % 3 == 0 && i % 4 == 0) {
                neither++;
            }
        }
        return neither;
    }

    private static Selection selection(String hotelId, String imageId, double score) {
        return new Selection(hotelId, imageId, score, new RankMetadata(1, 0, false, DecidedBy.SOLE_CANDIDATE, null));
    }
}
