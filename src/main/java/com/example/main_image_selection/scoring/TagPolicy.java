package com.example.main_image_selection.scoring;

import com.example.main_image_selection.model.EnrichedImage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Score-time interpretation of tags: which tags count, which are negative signals and how hard they hit.
 * <p>
 * Tags below {@code minConfidence} are ignored for scoring only; the join keeps them. A tag without a
 * confidence is read as {@code defaultConfidence}.
 */
public final class TagPolicy {
    private final double minConfidence;
    private final double defaultConfidence;
    private final Map<String, Double> penalties;
    private final Set<String> disqualifying;

    public TagPolicy(double minConfidence, double defaultConfidence, Map<String, Double> penalties, Set<String> disqualifying) {
        this.minConfidence = minConfidence;
        this.defaultConfidence = defaultConfidence;
        Map<String, Double> normalizedPenalties = new HashMap<>();
        if (penalties != null) {
            penalties.forEach((tag, penalty) -> normalizedPenalties.put(normalize(tag), penalty));
        }
        Set<String> normalizedDisqualifying = new HashSet<>();
        if (disqualifying != null) {
            disqualifying.forEach(tag -> normalizedDisqualifying.add(normalize(tag)));
        }
        this.penalties = Collections.unmodifiableMap(normalizedPenalties);
        this.disqualifying = Collections.unmodifiableSet(normalizedDisqualifying);
    }

    public static TagPolicy permissive() {
        return new TagPolicy(0.0, 1.0, Map.of(), Set.of());
    }

    public double confidenceOf(EnrichedImage image, String tag) {
        return image.confidence(tag).orElse(defaultConfidence);
    }

    public boolean counts(EnrichedImage image, String tag) {
        return confidenceOf(image, tag) >= minConfidence;
    }

    public boolean isNegative(String tag) {
        return penalties.containsKey(tag) || disqualifying.contains(tag);
    }

    /** Counted tags that force disqualification, sorted. */
    public List<String> disqualifyingTags(EnrichedImage image) {
        List<String> found = new ArrayList<>();
        for (String tag : image.tagNames()) {
            if (disqualifying.contains(tag) && counts(image, tag)) {
                found.add(tag);
            }
        }
        return found;
    }

    /** Sum of the penalties of all counted negative tags. */
    public double penalty(EnrichedImage image) {
        double total = 0.0;
        for (String tag : image.tagNames()) {
            Double penalty = penalties.get(tag);
            if (penalty != null && counts(image, tag)) {
                total += penalty;
            }
        }
        return total;
    }

    private static String normalize(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT);
    }
}
