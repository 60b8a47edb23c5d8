package com.example.main_image_selection.scoring;

import com.example.main_image_selection.model.EnrichedImage;

/**
 * Highest confidence among the image's counted, non-negative tags.
 */
public class TagPriorityScore implements ScoreComponent {
    public static final String NAME = "tag-priority";

    private final TagPolicy tagPolicy;

    public TagPriorityScore(TagPolicy tagPolicy) {
        this.tagPolicy = tagPolicy;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ComponentScore evaluate(EnrichedImage image, ScoreContext context) {
        double best = -1.0;
        for (String tag : image.tagNames()) {
            if (tagPolicy.isNegative(tag) || !tagPolicy.counts(image, tag)) {
                continue;
            }
            best = Math.max(best, tagPolicy.confidenceOf(image, tag));
        }
        return best < 0 ? ComponentScore.defaulted(0.0) : ComponentScore.of(best);
    }
}
