package com.example.main_image_selection.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enriched image with its score and the named contributions that produced it.
 *
 * @param image               scored candidate.
 * @param score               total score; {@link #DISQUALIFIED_SCORE} when a disqualifying tag is present.
 * @param breakdown           weighted contribution per component, in registration order, plus the tag penalty.
 * @param disqualified        whether a disqualifying tag forced the sentinel score.
 * @param disqualifyingTags   tags that caused the disqualification, sorted.
 * @param defaultedComponents components that fell back to their default because an attribute was missing.
 */
public record ScoredImage(EnrichedImage image,
                          double score,
                          Map<String, Double> breakdown,
                          boolean disqualified,
                          List<String> disqualifyingTags,
                          Set<String> defaultedComponents) {

    /** Sentinel score of a disqualified candidate, below every regular score. */
    public static final double DISQUALIFIED_SCORE = -1.0;

    public String imageId() {
        return image.imageId();
    }

    public String hotelId() {
        return image.hotelId();
    }

    public Integer priorityRank() {
        return image.image().priorityRank();
    }
}
