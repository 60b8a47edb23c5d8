package com.example.main_image_selection.scoring;

import com.example.main_image_selection.model.EnrichedImage;
import com.example.main_image_selection.model.ScoredImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Weighted sum of registered {@link ScoreComponent}s.
 * <p>
 * {@code score = Σ w_i · clamp(c_i) / Σ w_i - tagPenalty}, floored at 0. An image with a disqualifying tag gets
 * {@link ScoredImage#DISQUALIFIED_SCORE} but keeps its full breakdown.
 */
public final class ScoreEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScoreEngine.class);
    public static final String PENALTY = "penalty";

    private final List<WeightedComponent> components;
    private final double totalWeight;
    private final TagPolicy tagPolicy;

    private ScoreEngine(List<WeightedComponent> components, TagPolicy tagPolicy) {
        this.components = List.copyOf(components);
        this.totalWeight = components.stream().mapToDouble(WeightedComponent::weight).sum();
        this.tagPolicy = tagPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ScoredImage score(EnrichedImage image, ScoreContext context) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        Set<String> defaulted = new LinkedHashSet<>();
        double weighted = 0.0;
        for (WeightedComponent component : components) {
            ComponentScore raw = component.component().evaluate(image, context);
            double contribution = component.weight() * clamp(raw.value()) / totalWeight;
            breakdown.put(component.name(), contribution);
            if (raw.defaulted()) {
                defaulted.add(component.name());
            }
            weighted += contribution;
        }
        double penalty = tagPolicy.penalty(image);
        breakdown.put(PENALTY, -penalty);

        List<String> disqualifyingTags = tagPolicy.disqualifyingTags(image);
        boolean disqualified = !disqualifyingTags.isEmpty();
        double score = disqualified ? ScoredImage.DISQUALIFIED_SCORE : Math.max(0.0, weighted - penalty);

        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("score imageId={} hotelId={} score={} breakdown={} disqualifiedBy={}",
                    image.imageId(), image.hotelId(), String.format(Locale.ROOT, "%.4f", score), breakdown, disqualifyingTags);
        }
        return new ScoredImage(image, score, Collections.unmodifiableMap(breakdown), disqualified,
                List.copyOf(disqualifyingTags), Collections.unmodifiableSet(defaulted));
    }

    public List<ScoredImage> scoreAll(Collection<EnrichedImage> images, ScoreContext context) {
        List<ScoredImage> scored = new ArrayList<>(images.size());
        for (EnrichedImage image : images) {
            scored.add(score(image, context));
        }
        return scored;
    }

    /** Component names in registration order. */
    public List<String> componentNames() {
        return components.stream().map(WeightedComponent::name).toList();
    }

    public double weightOf(String componentName) {
        return components.stream()
                .filter(c -> c.name().equals(componentName))
                .mapToDouble(WeightedComponent::weight)
                .findFirst()
                .orElse(0.0);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        if (value < 0.0) {
            return 0.0;
        }
        if (value > 1.0) {
            return 1.0;
        }
        return value;
    }

    private record WeightedComponent(ScoreComponent component, double weight) {
        String name() {
            return component.name();
        }
    }

    public static final class Builder {
        private final Map<String, WeightedComponent> components = new LinkedHashMap<>();
        private TagPolicy tagPolicy = TagPolicy.permissive();

        private Builder() {
        }

        /**
         * Registers a component with its weight. Registering a name twice replaces the earlier entry.
         */
        public Builder component(ScoreComponent component, double weight) {
            Objects.requireNonNull(component, "component");
            if (weight < 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("weight for " + component.name() + " must be a finite non-negative number");
            }
            components.put(component.name(), new WeightedComponent(component, weight));
            return this;
        }

        public Builder tagPolicy(TagPolicy tagPolicy) {
            this.tagPolicy = Objects.requireNonNull(tagPolicy, "tagPolicy");
            return this;
        }

        public ScoreEngine build() {
            List<WeightedComponent> registered = new ArrayList<>(components.values());
            double total = registered.stream().mapToDouble(WeightedComponent::weight).sum();
            if (registered.isEmpty() || total <= 0) {
                throw new IllegalStateException("ScoreEngine needs at least one component with a positive weight");
            }
            return new ScoreEngine(registered, tagPolicy);
        }
    }
}
