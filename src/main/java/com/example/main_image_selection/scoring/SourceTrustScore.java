package com.example.main_image_selection.scoring;

import com.example.main_image_selection.model.EnrichedImage;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configured trust per image source. Unknown sources get the default trust without counting as defaulted;
 * a missing source does.
 */
public class SourceTrustScore implements ScoreComponent {
    public static final String NAME = "source-trust";

    private final Map<String, Double> trustBySource = new HashMap<>();
    private final double defaultTrust;

    public SourceTrustScore(Map<String, Double> trustBySource, double defaultTrust) {
        if (trustBySource != null) {
            trustBySource.forEach((source, trust) -> this.trustBySource.put(source.toLowerCase(Locale.ROOT), trust));
        }
        this.defaultTrust = defaultTrust;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ComponentScore evaluate(EnrichedImage image, ScoreContext context) {
        String source = image.image().source();
        if (source == null || source.isBlank()) {
            return ComponentScore.defaulted(defaultTrust);
        }
        return ComponentScore.of(trustBySource.getOrDefault(source.trim().toLowerCase(Locale.ROOT), defaultTrust));
    }
}
