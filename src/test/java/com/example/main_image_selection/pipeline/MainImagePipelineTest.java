package com.example.main_image_selection.pipeline;

import com.example.main_image_selection.assembler.CandidateAssembler;
import com.example.main_image_selection.cdc.CdcDiffer;
import com.example.main_image_selection.metrics.MetricsAggregator;
import com.example.main_image_selection.model.AnomalyType;
import com.example.main_image_selection.model.ChangeType;
import com.example.main_image_selection.model.CdcEvent;
import com.example.main_image_selection.model.ImageRecord;
import com.example.main_image_selection.model.PriorAssignment;
import com.example.main_image_selection.model.Selection;
import com.example.main_image_selection.model.SnapshotRecord;
import com.example.main_image_selection.model.TagRecord;
import com.example.main_image_selection.scoring.AspectRatioScore;
import com.example.main_image_selection.scoring.FreshnessScore;
import com.example.main_image_selection.scoring.ResolutionScore;
import com.example.main_image_selection.scoring.ScoreEngine;
import com.example.main_image_selection.scoring.TagPolicy;
import com.example.main_image_selection.scoring.TagPriorityScore;
import com.example.main_image_selection.selector.RankingMainImageSelector;
import com.example.main_image_selection.selector.SelectorConfig;
import com.example.main_image_selection.snapshot.SnapshotBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class MainImagePipelineTest {

    private static final Instant AS_OF = Instant.parse("2024-06-01T00:00:00Z");

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void endToEndProducesConsistentSelectionsCdcSnapshotAndMetrics() {
        List<ImageRecord> images = List.of(
                image("I1", "H1", 1920, 1080, 1),
                image("I2", "H2", 640, 480, 1),
                image("I3", "H2", 1920, 1080, 2),
                image("I4", "H3", 1200, 800, null),
                image("I5", "H3", 1200, 800, null));
        List<TagRecord> tags = List.of(
                new TagRecord("I1", "pool", 0.9),
                new TagRecord("I3", "view", 0.8),
                new TagRecord("I5", "watermarked", 0.99),
                new TagRecord("I_GONE", "pool", 0.5));
        List<PriorAssignment> prior = List.of(
                new PriorAssignment("H1", "I1"),
                new PriorAssignment("H2", "I2"),
                new PriorAssignment("H4", "I9"));

        RunResult result = pipeline(4).run(PipelineInput.of(images, tags, prior), "run-1", AS_OF);

        assertThat(result.isCompleted()).isTrue();
        PipelineOutputs outputs = result.outputs().orElseThrow();
        assertThat(outputs.selections().asList()).extracting(Selection::imageId).containsExactly("I1", "I3", "I4");
        assertThat(outputs.cdc()).extracting(CdcEvent::hotelId, CdcEvent::changeType).containsExactly(
                tuple("H1", ChangeType.UNCHANGED),
                tuple("H2", ChangeType.REASSIGNED),
                tuple("H3", ChangeType.ASSIGNED),
                tuple("H4", ChangeType.REMOVED));
        assertThat(outputs.snapshot()).extracting(SnapshotRecord::hotelId, SnapshotRecord::imageId)
                .containsExactlyElementsOf(outputs.selections().asList().stream()
                        .map(s -> tuple(s.hotelId(), s.imageId()))
                        .toList());
        assertThat(outputs.snapshot()).allSatisfy(row -> assertThat(row.asOf()).isEqualTo(AS_OF));
        assertThat(outputs.scored()).hasSize(5);

        assertThat(result.report().count(AnomalyType.ORPHAN_TAG)).isEqualTo(1);
        assertThat(outputs.metrics().anomalies()).containsEntry(AnomalyType.ORPHAN_TAG, 1L);
        assertThat(outputs.metrics().hotelsProcessed()).isEqualTo(4);
        assertThat(outputs.metrics().selections()).isEqualTo(3);
        assertThat(outputs.metrics().disqualifiedImages()).isEqualTo(1);
        assertThat(outputs.metrics().changeRate()).isEqualTo(0.75);
    }

    @Test
    void partitionCountDoesNotChangeAnyOutput() {
        List<ImageRecord> images = new ArrayList<>();
        List<TagRecord> tags = new ArrayList<>();
        List<PriorAssignment> prior = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            String hotel = String.format("H%02d", i % 23);
            String id = String.format("IMG_%03d", i);
            images.add(image(id, hotel, 400 + (i % 9) * 200, 300 + (i % 4) * 150, i % 6 == 0 ? null : i % 4));
            if (i % 3 == 0) {
                tags.add(new TagRecord(id, i % 13 == 0 ? "watermarked" : "pool", (i % 10) / 10.0));
            }
            if (i < 23 && i % 2 == 0) {
                prior.add(new PriorAssignment(hotel, id));
            }
        }
        PipelineInput input = PipelineInput.of(images, tags, prior);

        PipelineOutputs single = pipeline(1).run(input, "run", AS_OF).outputs().orElseThrow();
        for (int partitions : new int[]{2, 3, 4, 7}) {
            PipelineOutputs split = pipeline(partitions).run(input, "run", AS_OF).outputs().orElseThrow();

            assertThat(split.selections()).as("partitions=%d", partitions).isEqualTo(single.selections());
            assertThat(split.cdc()).isEqualTo(single.cdc());
            assertThat(split.snapshot()).isEqualTo(single.snapshot());
            assertThat(split.metrics()).isEqualTo(single.metrics());
        }
    }

    @Test
    void rerunAgainstOwnSnapshotIsAllUnchanged() {
        List<ImageRecord> images = List.of(image("I1", "H1", 800, 600, null), image("I2", "H2", 800, 600, null));
        MainImagePipeline pipeline = pipeline(2);

        PipelineOutputs first = pipeline.run(PipelineInput.of(images, List.of(), List.of()), "run-1", AS_OF)
                .outputs().orElseThrow();
        List<PriorAssignment> prior = first.snapshot().stream()
                .map(row -> new PriorAssignment(row.hotelId(), row.imageId()))
                .toList();
        PipelineOutputs second = pipeline.run(PipelineInput.of(images, List.of(), prior), "run-2", AS_OF)
                .outputs().orElseThrow();

        assertThat(second.cdc()).extracting(CdcEvent::changeType).containsOnly(ChangeType.UNCHANGED);
        assertThat(second.metrics().changeRate()).isZero();
    }

    @Test
    void conflictingPriorAssignmentAbortsWithoutOutputs() {
        PipelineInput input = PipelineInput.of(
                List.of(image("I1", "H1", 800, 600, null)),
                List.of(),
                List.of(new PriorAssignment("H1", "I1"), new PriorAssignment("H1", "I7")));

        RunResult result = pipeline(2).run(input, "run-x", AS_OF);

        assertThat(result.isCompleted()).isFalse();
        assertThat(result.status()).isEqualTo(RunStatus.ABORTED);
        assertThat(result.outputs()).isEmpty();
        assertThat(result.failureReason()).get().asString().contains("H1");
    }

    @Test
    void emptyInputCompletesWithEmptyOutputs() {
        RunResult result = pipeline(3).run(PipelineInput.of(List.of(), List.of(), List.of()), "run-0", AS_OF);

        PipelineOutputs outputs = result.outputs().orElseThrow();
        assertThat(outputs.selections().isEmpty()).isTrue();
        assertThat(outputs.cdc()).isEmpty();
        assertThat(outputs.snapshot()).isEmpty();
        assertThat(outputs.metrics().scoreDistribution()).isNull();
    }

    @Test
    void partitionSplitsIntoContiguousChunks() {
        assertThat(MainImagePipeline.partition(List.of(1, 2, 3, 4, 5), 2)).containsExactly(List.of(1, 2, 3), List.of(4, 5));
        assertThat(MainImagePipeline.partition(List.of(1, 2), 5)).containsExactly(List.of(1), List.of(2));
        assertThat(MainImagePipeline.partition(List.of(), 3)).containsExactly(List.of());
    }

    private MainImagePipeline pipeline(int partitions) {
        TagPolicy tagPolicy = new TagPolicy(0.0, 1.0, Map.of("blurry", 0.3), Set.of("watermarked"));
        ScoreEngine engine = ScoreEngine.builder()
                .component(new ResolutionScore(160_000, 2_073_600), 6)
                .component(new AspectRatioScore(0.3, 4.65), 2)
                .component(new FreshnessScore(3650), 2)
                .component(new TagPriorityScore(tagPolicy), 3)
                .tagPolicy(tagPolicy)
                .build();
        SelectorConfig config = SelectorConfig.defaults().withPartitions(partitions);
        return new MainImagePipeline(new CandidateAssembler(), engine, new RankingMainImageSelector(config),
                new CdcDiffer(), new SnapshotBuilder(), new MetricsAggregator(), pool, config);
    }

    private static ImageRecord image(String imageId, String hotelId, int width, int height, Integer priorityRank) {
        return new ImageRecord(imageId, hotelId, width, height, Instant.parse("2023-06-01T00:00:00Z"), "hotel", priorityRank, null);
    }
}
