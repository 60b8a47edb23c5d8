package com.example.main_image_selection.scoring;

import com.example.main_image_selection.model.EnrichedImage;
import com.example.main_image_selection.model.ImageRecord;

/**
 * Log-scaled pixel count between a minimum and a full-HD style maximum.
 */
public class ResolutionScore implements ScoreComponent {
    public static final String NAME = "resolution";

    private final double logMin;
    private final double logRange;

    public ResolutionScore(long minPixels, long maxPixels) {
        if (minPixels <= 0 || maxPixels <= minPixels) {
            throw new IllegalArgumentException("resolution bounds must satisfy 0 < min < max");
        }
        this.logMin = Math.log(minPixels);
        this.logRange = Math.log(maxPixels) - logMin;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ComponentScore evaluate(EnrichedImage image, ScoreContext context) {
        ImageRecord record = image.image();
        if (record.width() == null || record.height() == null) {
            return ComponentScore.defaulted(0.0);
        }
        long pixels = (long) record.width() * record.height();
        if (pixels <= 0) {
            return ComponentScore.of(0.0);
        }
        return ComponentScore.of((Math.log(pixels) - logMin) / logRange);
    }
}
