package com.example.main_image_selection.cdc;

import com.example.main_image_selection.exception.StructuralViolationException;
import com.example.main_image_selection.model.CdcEvent;
import com.example.main_image_selection.model.PriorAssignment;
import com.example.main_image_selection.model.Selection;
import com.example.main_image_selection.model.SelectionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Classifies every hotel of the prior assignment and of the current selection.
 *
 * <pre>
 * prior  new   same image  change
 * no     yes   -           ASSIGNED
 * yes    yes   yes         UNCHANGED
 * yes    yes   no          REASSIGNED
 * yes    no    -           REMOVED
 * </pre>
 * Events come out in ascending hotel id order. Neither input is modified.
 */
@Component
public class CdcDiffer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CdcDiffer.class);

    public List<CdcEvent> diff(Collection<PriorAssignment> prior, SelectionSet selections) {
        return diff(indexPrior(prior), selections);
    }

    public List<CdcEvent> diff(SortedMap<String, PriorAssignment> priorByHotel, SelectionSet selections) {
        TreeSet<String> hotels = new TreeSet<>(priorByHotel.keySet());
        hotels.addAll(selections.hotelIds());

        List<CdcEvent> events = new ArrayList<>(hotels.size());
        for (String hotelId : hotels) {
            PriorAssignment before = priorByHotel.get(hotelId);
            Optional<Selection> after = selections.get(hotelId);
            events.add(classify(before, after.orElse(null)));
        }
        LOGGER.debug("cdc prior={} selected={} events={}", priorByHotel.size(), selections.size(), events.size());
        return Collections.unmodifiableList(events);
    }

    static CdcEvent classify(PriorAssignment before, Selection after) {
        if (before == null) {
            return CdcEvent.assigned(after);
        }
        if (after == null) {
            return CdcEvent.removed(before);
        }
        if (before.imageId().equals(after.imageId())) {
            return CdcEvent.unchanged(before, after);
        }
        return CdcEvent.reassigned(before, after);
    }

    /**
     * Indexes prior assignments by hotel id. Repeated identical rows collapse into one.
     *
     * @throws StructuralViolationException when a hotel has two different prior images.
     */
    public static SortedMap<String, PriorAssignment> indexPrior(Collection<PriorAssignment> prior) {
        TreeMap<String, PriorAssignment> byHotel = new TreeMap<>();
        for (PriorAssignment assignment : prior) {
            PriorAssignment existing = byHotel.putIfAbsent(assignment.hotelId(), assignment);
            if (existing != null && !existing.imageId().equals(assignment.imageId())) {
                throw new StructuralViolationException("Prior assignment lists hotel " + assignment.hotelId()
                        + " twice images=" + existing.imageId() + "," + assignment.imageId());
            }
        }
        return Collections.unmodifiableSortedMap(byHotel);
    }
}
