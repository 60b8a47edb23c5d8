package com.example.main_image_selection.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Weights and constants of the score components.
 */
@Validated
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    /** Component name to weight; the order decides the breakdown order. */
    @NotEmpty
    private Map<String, Double> weights = defaultWeights();

    @Valid
    private Resolution resolution = new Resolution();
    @Valid
    private AspectRatio aspectRatio = new AspectRatio();
    @Valid
    private Freshness freshness = new Freshness();
    @Valid
    private Tags tags = new Tags();
    @Valid
    private SourceTrust sourceTrust = new SourceTrust();

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("resolution", 6.0);
        weights.put("aspect-ratio", 2.0);
        weights.put("freshness", 2.0);
        weights.put("tag-priority", 3.0);
        weights.put("source-trust", 1.0);
        return weights;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public void setResolution(Resolution resolution) {
        this.resolution = resolution;
    }

    public AspectRatio getAspectRatio() {
        return aspectRatio;
    }

    public void setAspectRatio(AspectRatio aspectRatio) {
        this.aspectRatio = aspectRatio;
    }

    public Freshness getFreshness() {
        return freshness;
    }

    public void setFreshness(Freshness freshness) {
        this.freshness = freshness;
    }

    public Tags getTags() {
        return tags;
    }

    public void setTags(Tags tags) {
        this.tags = tags;
    }

    public SourceTrust getSourceTrust() {
        return sourceTrust;
    }

    public void setSourceTrust(SourceTrust sourceTrust) {
        this.sourceTrust = sourceTrust;
    }

    public static class Resolution {
        @Min(1)
        private long minPixels = 160_000;
        @Min(2)
        private long maxPixels = 2_073_600;

        public long getMinPixels() { return minPixels; }
        public void setMinPixels(long minPixels) { this.minPixels = minPixels; }

        public long getMaxPixels() { return maxPixels; }
        public void setMaxPixels(long maxPixels) { this.maxPixels = maxPixels; }
    }

    public static class AspectRatio {
        @DecimalMin(value = "0.0", inclusive = false)
        private double min = 0.3;
        @DecimalMin(value = "0.0", inclusive = false)
        private double max = 4.65;

        public double getMin() { return min; }
        public void setMin(double min) { this.min = min; }

        public double getMax() { return max; }
        public void setMax(double max) { this.max = max; }
    }

    public static class Freshness {
        @Min(1)
        private int maxAgeDays = 10 * 365;

        public int getMaxAgeDays() { return maxAgeDays; }
        public void setMaxAgeDays(int maxAgeDays) { this.maxAgeDays = maxAgeDays; }
    }

    public static class Tags {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.0;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double defaultConfidence = 1.0;
        /** Negative tag to penalty subtracted from the score. */
        private Map<String, Double> penalties = new LinkedHashMap<>();
        /** Tags that force the disqualification sentinel. */
        private Set<String> disqualifying = new LinkedHashSet<>();

        public double getMinConfidence() { return minConfidence; }
        public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }

        public double getDefaultConfidence() { return defaultConfidence; }
        public void setDefaultConfidence(double defaultConfidence) { this.defaultConfidence = defaultConfidence; }

        public Map<String, Double> getPenalties() { return penalties; }
        public void setPenalties(Map<String, Double> penalties) { this.penalties = penalties; }

        public Set<String> getDisqualifying() { return disqualifying; }
        public void setDisqualifying(Set<String> disqualifying) { this.disqualifying = disqualifying; }
    }

    public static class SourceTrust {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double defaultTrust = 0.5;
        private Map<String, Double> sources = new LinkedHashMap<>();

        public double getDefaultTrust() { return defaultTrust; }
        public void setDefaultTrust(double defaultTrust) { this.defaultTrust = defaultTrust; }

        public Map<String, Double> getSources() { return sources; }
        public void setSources(Map<String, Double> sources) { this.sources = sources; }
    }
}
