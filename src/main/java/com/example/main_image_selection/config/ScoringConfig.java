package com.example.main_image_selection.config;

import com.example.main_image_selection.scoring.AspectRatioScore;
import com.example.main_image_selection.scoring.FreshnessScore;
import com.example.main_image_selection.scoring.ResolutionScore;
import com.example.main_image_selection.scoring.ScoreComponent;
import com.example.main_image_selection.scoring.ScoreEngine;
import com.example.main_image_selection.scoring.SourceTrustScore;
import com.example.main_image_selection.scoring.TagPolicy;
import com.example.main_image_selection.scoring.TagPriorityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Builds the {@link ScoreEngine} from {@link ScoringProperties}. Every configured weight must name a known
 * component.
 */
@Configuration
public class ScoringConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScoringConfig.class);

    @Bean
    public TagPolicy tagPolicy(ScoringProperties properties) {
        ScoringProperties.Tags tags = properties.getTags();
        return new TagPolicy(tags.getMinConfidence(), tags.getDefaultConfidence(), tags.getPenalties(), tags.getDisqualifying());
    }

    @Bean
    public ScoreEngine scoreEngine(ScoringProperties properties, TagPolicy tagPolicy) {
        ScoreEngine.Builder builder = ScoreEngine.builder().tagPolicy(tagPolicy);
        for (Map.Entry<String, Double> weight : properties.getWeights().entrySet()) {
            builder.component(component(weight.getKey(), properties, tagPolicy), weight.getValue());
        }
        ScoreEngine engine = builder.build();
        LOGGER.info("ScoreEngine components={} weights={} penalties={} disqualifying={}", engine.componentNames(),
                properties.getWeights(), properties.getTags().getPenalties(), properties.getTags().getDisqualifying());
        return engine;
    }

    static ScoreComponent component(String name, ScoringProperties properties, TagPolicy tagPolicy) {
        return switch (name) {
            case ResolutionScore.NAME -> new ResolutionScore(
                    properties.getResolution().getMinPixels(), properties.getResolution().getMaxPixels());
            case AspectRatioScore.NAME -> new AspectRatioScore(
                    properties.getAspectRatio().getMin(), properties.getAspectRatio().getMax());
            case FreshnessScore.NAME -> new FreshnessScore(properties.getFreshness().getMaxAgeDays());
            case TagPriorityScore.NAME -> new TagPriorityScore(tagPolicy);
            case SourceTrustScore.NAME -> new SourceTrustScore(
                    properties.getSourceTrust().getSources(), properties.getSourceTrust().getDefaultTrust());
            default -> throw new IllegalStateException("Unknown score component in scoring.weights: " + name);
        };
    }
}
