package com.example.main_image_selection.io;

import com.example.main_image_selection.model.ScoredImage;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One line of the optional scores audit output.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScoredImageLine(String imageId,
                              String hotelId,
                              double score,
                              boolean disqualified,
                              List<String> disqualifyingTags,
                              Map<String, Double> breakdown,
                              Set<String> defaultedComponents,
                              Map<String, Double> tags) {

    public static ScoredImageLine from(ScoredImage scored) {
        return new ScoredImageLine(scored.imageId(), scored.hotelId(), scored.score(), scored.disqualified(),
                scored.disqualifyingTags(), scored.breakdown(), scored.defaultedComponents(), scored.image().tags());
    }
}
