package com.example.main_image_selection.scoring;

import com.example.main_image_selection.model.EnrichedImage;
import com.example.main_image_selection.model.ImageRecord;
import com.example.main_image_selection.model.ScoredImage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoreEngineTest {

    private static final Instant AS_OF = Instant.parse("2024-06-01T00:00:00Z");
    private static final ScoreContext CONTEXT = new ScoreContext(AS_OF);

    private final TagPolicy tagPolicy = new TagPolicy(0.0, 1.0, Map.of("blurry", 0.3), Set.of("watermarked", "duplicate"));
    private final ScoreEngine engine = ScoreEngine.builder()
            .component(new ResolutionScore(160_000, 2_073_600), 6)
            .component(new AspectRatioScore(0.3, 4.65), 2)
            .component(new FreshnessScore(3650), 2)
            .component(new TagPriorityScore(tagPolicy), 3)
            .tagPolicy(tagPolicy)
            .build();

    @Test
    void combinesComponentsWithNormalizedWeights() {
        ScoredImage scored = engine.score(fullHd(Map.of("pool", 0.9)), CONTEXT);

        assertThat(scored.score()).isCloseTo(12.7 / 13, within(1e-9));
        assertThat(scored.breakdown()).containsOnlyKeys("resolution", "aspect-ratio", "freshness", "tag-priority", ScoreEngine.PENALTY);
        assertThat(scored.breakdown().keySet()).containsExactly("resolution", "aspect-ratio", "freshness", "tag-priority", ScoreEngine.PENALTY);
        assertThat(scored.breakdown().get("resolution")).isCloseTo(6.0 / 13, within(1e-12));
        assertThat(scored.breakdown().get("tag-priority")).isCloseTo(2.7 / 13, within(1e-12));
        assertThat(scored.disqualified()).isFalse();
        assertThat(scored.defaultedComponents()).isEmpty();
    }

    @Test
    void missingAttributesScoreWithDefaultsInsteadOfFailing() {
        ScoredImage scored = engine.score(EnrichedImage.untagged(ImageRecord.of("IMG_1", "H1", null, null)), CONTEXT);

        assertThat(scored.score()).isZero();
        assertThat(scored.defaultedComponents()).containsExactly("resolution", "aspect-ratio", "freshness", "tag-priority");
    }

    @Test
    void penaltyTagsLowerTheScore() {
        Map<String, Double> tags = new HashMap<>();
        tags.put("pool", 0.9);
        tags.put("blurry", null);

        ScoredImage clean = engine.score(fullHd(Map.of("pool", 0.9)), CONTEXT);
        ScoredImage blurry = engine.score(fullHd(tags), CONTEXT);

        assertThat(blurry.score()).isCloseTo(clean.score() - 0.3, within(1e-12));
        assertThat(blurry.breakdown().get(ScoreEngine.PENALTY)).isEqualTo(-0.3);
        assertThat(blurry.disqualified()).isFalse();
    }

    @Test
    void penaltyNeverPushesScoreBelowZero() {
        ScoreEngine harsh = ScoreEngine.builder()
                .component(new AspectRatioScore(0.3, 4.65), 1)
                .tagPolicy(new TagPolicy(0.0, 1.0, Map.of("dark", 5.0), Set.of()))
                .build();

        ScoredImage scored = harsh.score(fullHd(Map.of("dark", 1.0)), CONTEXT);

        assertThat(scored.score()).isZero();
        assertThat(scored.disqualified()).isFalse();
    }

    @Test
    void disqualifyingTagForcesSentinelButKeepsBreakdown() {
        ScoredImage scored = engine.score(fullHd(Map.of("pool", 0.9, "watermarked", 0.8, "duplicate", 0.6)), CONTEXT);

        assertThat(scored.score()).isEqualTo(ScoredImage.DISQUALIFIED_SCORE);
        assertThat(scored.disqualified()).isTrue();
        assertThat(scored.disqualifyingTags()).containsExactly("duplicate", "watermarked");
        assertThat(scored.breakdown().get("resolution")).isCloseTo(6.0 / 13, within(1e-12));
    }

    @Test
    void tagsBelowConfidenceThresholdAreIgnoredForScoring() {
        TagPolicy strict = new TagPolicy(0.5, 1.0, Map.of(), Set.of("watermarked"));
        ScoreEngine strictEngine = ScoreEngine.builder()
                .component(new TagPriorityScore(strict), 1)
                .tagPolicy(strict)
                .build();

        ScoredImage scored = strictEngine.score(fullHd(Map.of("watermarked", 0.2, "pool", 0.4, "view", 0.7)), CONTEXT);

        assertThat(scored.disqualified()).isFalse();
        assertThat(scored.score()).isCloseTo(0.7, within(1e-12));
        assertThat(scored.image().tagNames()).containsExactly("pool", "view", "watermarked");
    }

    @Test
    void scoringIsDeterministic() {
        EnrichedImage image = new EnrichedImage(
                new ImageRecord("IMG_7", "H2", 1280, 960, Instant.parse("2021-03-04T10:15:30Z"), "partner", 2, null),
                Map.of("pool", 0.66, "blurry", 0.5));

        List<ScoredImage> first = engine.scoreAll(List.of(image), CONTEXT);
        List<ScoredImage> second = engine.scoreAll(List.of(image), new ScoreContext(Instant.parse("2024-06-01T00:00:00Z")));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void builderRejectsInvalidWeights() {
        assertThatThrownBy(() -> ScoreEngine.builder().component(new FreshnessScore(10), -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScoreEngine.builder().component(new FreshnessScore(10), 0).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ScoreEngine.builder().build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void extraComponentsCanBeRegisteredWithoutTouchingOthers() {
        ScoreComponent constant = new ScoreComponent() {
            @Override
            public String name() {
                return "constant";
            }

            @Override
            public ComponentScore evaluate(EnrichedImage image, ScoreContext context) {
                return ComponentScore.of(2.5);
            }
        };
        ScoreEngine extended = ScoreEngine.builder()
                .component(new AspectRatioScore(0.3, 4.65), 1)
                .component(constant, 1)
                .build();

        ScoredImage scored = extended.score(fullHd(Map.of()), CONTEXT);

        assertThat(scored.score()).isEqualTo(1.0);
        assertThat(extended.componentNames()).containsExactly("aspect-ratio", "constant");
        assertThat(extended.weightOf("constant")).isEqualTo(1.0);
    }

    private static EnrichedImage fullHd(Map<String, Double> tags) {
        return new EnrichedImage(new ImageRecord("IMG_1", "H1", 1920, 1080, AS_OF, null, null, null), tags);
    }
}
