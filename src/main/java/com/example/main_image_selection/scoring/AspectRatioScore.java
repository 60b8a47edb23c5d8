package com.example.main_image_selection.scoring;

import com.example.main_image_selection.model.EnrichedImage;
import com.example.main_image_selection.model.ImageRecord;

/**
 * 1 when width / height lies inside the accepted band, 0 otherwise.
 */
public class AspectRatioScore implements ScoreComponent {
    public static final String NAME = "aspect-ratio";

    private final double minRatio;
    private final double maxRatio;

    public AspectRatioScore(double minRatio, double maxRatio) {
        if (minRatio <= 0 || maxRatio < minRatio) {
            throw new IllegalArgumentException("aspect ratio bounds must satisfy 0 < min <= max");
        }
        this.minRatio = minRatio;
        this.maxRatio = maxRatio;
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
        if (record.height() == 0) {
            return ComponentScore.of(0.0);
        }
        double ratio = record.width() / (double) record.height();
        return ComponentScore.of(ratio >= minRatio && ratio <= maxRatio ? 1.0 : 0.0);
    }
}
