package com.example.main_image_selection.scoring;

import com.example.main_image_selection.model.EnrichedImage;

import java.time.Duration;
import java.time.Instant;

/**
 * Linear decay from 1 for an image taken at the as-of instant to 0 at the maximum age.
 * Images dated after the as-of instant score 1.
 */
public class FreshnessScore implements ScoreComponent {
    public static final String NAME = "freshness";

    private final double maxAgeSeconds;

    public FreshnessScore(int maxAgeDays) {
        if (maxAgeDays <= 0) {
            throw new IllegalArgumentException("maxAgeDays must be positive");
        }
        this.maxAgeSeconds = Duration.ofDays(maxAgeDays).getSeconds();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ComponentScore evaluate(EnrichedImage image, ScoreContext context) {
        Instant createdAt = image.image().createdAt();
        if (createdAt == null) {
            return ComponentScore.defaulted(0.0);
        }
        double ageSeconds = Duration.between(createdAt, context.asOf()).getSeconds();
        return ComponentScore.of(1.0 - ageSeconds / maxAgeSeconds);
    }
}
