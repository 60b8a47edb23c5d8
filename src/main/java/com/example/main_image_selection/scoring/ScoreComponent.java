package com.example.main_image_selection.scoring;

import com.example.main_image_selection.model.EnrichedImage;

/**
 * Independently testable part of an image's score.
 * <p>
 * Implementations must be pure: the result may only depend on the image and the context, never on other
 * candidates or the wall clock. Values outside {@code [0, 1]} are clamped by the {@link ScoreEngine}.
 */
public interface ScoreComponent {

    /**
     * Name used in weight configuration and in the score breakdown.
     */
    String name();

    /**
     * Evaluates the component for one image.
     *
     * @param image   candidate image.
     * @param context run-level inputs such as the as-of instant.
     * @return component value, flagged as defaulted when the needed attribute was missing.
     */
    ComponentScore evaluate(EnrichedImage image, ScoreContext context);
}
