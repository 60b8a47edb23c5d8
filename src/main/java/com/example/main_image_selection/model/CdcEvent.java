package com.example.main_image_selection.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Change of a hotel's main image between the prior assignment and the current selection.
 *
 * @param hotelId         hotel identifier.
 * @param changeType      classification of the change.
 * @param previousImageId prior main image, {@code null} for {@link ChangeType#ASSIGNED}.
 * @param newImageId      current main image, {@code null} for {@link ChangeType#REMOVED}.
 * @param score           score of the current main image, {@code null} for {@link ChangeType#REMOVED}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CdcEvent(String hotelId,
                       ChangeType changeType,
                       String previousImageId,
                       String newImageId,
                       Double score) {

    public static CdcEvent assigned(Selection selection) {
        return new CdcEvent(selection.hotelId(), ChangeType.ASSIGNED, null, selection.imageId(), selection.score());
    }

    public static CdcEvent unchanged(PriorAssignment prior, Selection selection) {
        return new CdcEvent(selection.hotelId(), ChangeType.UNCHANGED, prior.imageId(), selection.imageId(), selection.score());
    }

    public static CdcEvent reassigned(PriorAssignment prior, Selection selection) {
        return new CdcEvent(selection.hotelId(), ChangeType.REASSIGNED, prior.imageId(), selection.imageId(), selection.score());
    }

    public static CdcEvent removed(PriorAssignment prior) {
        return new CdcEvent(prior.hotelId(), ChangeType.REMOVED, prior.imageId(), null, null);
    }
}
