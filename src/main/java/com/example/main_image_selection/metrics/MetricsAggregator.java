package com.example.main_image_selection.metrics;

import com.example.main_image_selection.model.CdcEvent;
import com.example.main_image_selection.model.ChangeType;
import com.example.main_image_selection.model.DataQualityReport;
import com.example.main_image_selection.model.MetricsRecord;
import com.example.main_image_selection.model.ScoreDistribution;
import com.example.main_image_selection.model.ScoredImage;
import com.example.main_image_selection.model.Selection;
import com.example.main_image_selection.selector.SelectionResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure reduction of a run's outputs into a {@link MetricsRecord}.
 */
@Component
public class MetricsAggregator {

    /**
     * Everything a run produced that the metrics are computed from.
     *
     * @param runId     run identifier.
     * @param asOf      as-of instant of the run.
     * @param scored    scored candidates.
     * @param selection selection stage outcome.
     * @param events    CDC events.
     * @param report    anomalies collected so far.
     */
    public record RunFacts(String runId,
                           Instant asOf,
                           Collection<ScoredImage> scored,
                           SelectionResult selection,
                           List<CdcEvent> events,
                           DataQualityReport report) {
    }

    public MetricsRecord aggregate(RunFacts facts) {
        Set<String> hotelsProcessed = new HashSet<>(facts.selection().candidateHotels());
        for (CdcEvent event : facts.events()) {
            hotelsProcessed.add(event.hotelId());
        }
        long selections = facts.selection().selections().size();

        Map<ChangeType, Long> changeCounts = new EnumMap<>(ChangeType.class);
        for (ChangeType type : ChangeType.values()) {
            changeCounts.put(type, 0L);
        }
        for (CdcEvent event : facts.events()) {
            changeCounts.merge(event.changeType(), 1L, Long::sum);
        }
        long changed = facts.events().size() - changeCounts.get(ChangeType.UNCHANGED);
        double changeRate = facts.events().isEmpty() ? 0.0 : changed / (double) facts.events().size();

        long disqualifiedImages = 0;
        long defaulted = 0;
        for (ScoredImage image : facts.scored()) {
            if (image.disqualified()) {
                disqualifiedImages++;
            }
            if (!image.defaultedComponents().isEmpty()) {
                defaulted++;
            }
        }
        long disqualifiedOnlySelections = facts.selection().selections().asList().stream()
                .filter(s -> s.rankMetadata().disqualifiedOnly())
                .count();

        return new MetricsRecord(
                facts.runId(),
                facts.asOf(),
                facts.scored().size(),
                facts.selection().candidateHotels().size(),
                hotelsProcessed.size(),
                hotelsProcessed.size() - selections,
                selections,
                changeCounts,
                new MetricsRecord.MainImageChanges(
                        changeCounts.get(ChangeType.ASSIGNED),
                        changeCounts.get(ChangeType.REASSIGNED),
                        changeCounts.get(ChangeType.REMOVED)),
                changeRate,
                distribution(facts.selection().selections().asList()),
                disqualifiedImages,
                disqualifiedOnlySelections,
                facts.selection().suppressedHotels().size(),
                defaulted,
                facts.report().asMap());
    }

    static ScoreDistribution distribution(List<Selection> selections) {
        if (selections.isEmpty()) {
            return null;
        }
        double[] scores = selections.stream().mapToDouble(Selection::score).toArray();
        Arrays.sort(scores);
        double sum = 0.0;
        for (double score : scores) {
            sum += score;
        }
        return new ScoreDistribution(
                scores[0],
                scores[scores.length - 1],
                sum / scores.length,
                percentile(scores, 50),
                percentile(scores, 90),
                percentile(scores, 99));
    }

    // nearest-rank on an ascending array
    static double percentile(double[] sorted, int p) {
        int rank = (int) Math.ceil(p / 100.0 * sorted.length);
        int index = Math.min(sorted.length - 1, Math.max(0, rank - 1));
        return sorted[index];
    }
}
