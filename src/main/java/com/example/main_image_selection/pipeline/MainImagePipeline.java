package com.example.main_image_selection.pipeline;

import com.example.main_image_selection.assembler.AssemblyResult;
import com.example.main_image_selection.assembler.CandidateAssembler;
import com.example.main_image_selection.cdc.CdcDiffer;
import com.example.main_image_selection.exception.StructuralViolationException;
import com.example.main_image_selection.metrics.MetricsAggregator;
import com.example.main_image_selection.model.AnomalyType;
import com.example.main_image_selection.model.CdcEvent;
import com.example.main_image_selection.model.DataQualityReport;
import com.example.main_image_selection.model.EnrichedImage;
import com.example.main_image_selection.model.MetricsRecord;
import com.example.main_image_selection.model.PriorAssignment;
import com.example.main_image_selection.model.ScoredImage;
import com.example.main_image_selection.model.SnapshotRecord;
import com.example.main_image_selection.scoring.ScoreContext;
import com.example.main_image_selection.scoring.ScoreEngine;
import com.example.main_image_selection.selector.HotelRanking;
import com.example.main_image_selection.selector.MainImageSelector;
import com.example.main_image_selection.selector.SelectionResult;
import com.example.main_image_selection.selector.SelectorConfig;
import com.example.main_image_selection.snapshot.SnapshotBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs assembly, scoring, selection, CDC, snapshot and metrics for one batch.
 * <p>
 * Scoring and per-partition ranking run on the worker executor; CDC and snapshot run concurrently once the
 * selection is known, metrics after the CDC events. The run is a pure function of its input and as-of instant.
 */
@Service
public class MainImagePipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(MainImagePipeline.class);

    private final CandidateAssembler assembler;
    private final ScoreEngine scoreEngine;
    private final MainImageSelector selector;
    private final CdcDiffer cdcDiffer;
    private final SnapshotBuilder snapshotBuilder;
    private final MetricsAggregator metricsAggregator;
    private final Executor executor;
    private final int partitions;

    public MainImagePipeline(CandidateAssembler assembler,
                             ScoreEngine scoreEngine,
                             MainImageSelector selector,
                             CdcDiffer cdcDiffer,
                             SnapshotBuilder snapshotBuilder,
                             MetricsAggregator metricsAggregator,
                             @Qualifier("pipelineTaskExecutor") Executor executor,
                             SelectorConfig selectorConfig) {
        this.assembler = assembler;
        this.scoreEngine = scoreEngine;
        this.selector = selector;
        this.cdcDiffer = cdcDiffer;
        this.snapshotBuilder = snapshotBuilder;
        this.metricsAggregator = metricsAggregator;
        this.executor = executor;
        this.partitions = selectorConfig.partitions();
    }

    public RunResult run(PipelineInput input, String runId, Instant asOf) {
        LOGGER.info("PIPELINE start runId={} asOf={} images={} tags={} prior={} partitions={}",
                runId, asOf, input.images().size(), input.tags().size(), input.prior().size(), partitions);
        DataQualityReport report = input.readReport();
        try {
            SortedMap<String, PriorAssignment> priorByHotel = CdcDiffer.indexPrior(input.prior());

            AssemblyResult assembly = assembler.assemble(input.images(), input.tags());
            report = report.merge(assembly.report());

            ScoreContext context = new ScoreContext(asOf);
            List<Partial> partials = scoreAndRank(assembly.candidates(), context);
            List<ScoredImage> scored = new ArrayList<>(assembly.candidates().size());
            List<HotelRanking> rankings = new ArrayList<>(partials.size());
            long missingAttributes = 0;
            for (Partial partial : partials) {
                scored.addAll(partial.scored());
                rankings.add(partial.ranking());
                missingAttributes += partial.scored().stream().mapToLong(s -> s.defaultedComponents().size()).sum();
            }
            report = report.plus(AnomalyType.MISSING_ATTRIBUTE, missingAttributes);

            SelectionResult selection = selector.finish(selector.merge(rankings));

            CompletableFuture<List<CdcEvent>> cdcFuture =
                    CompletableFuture.supplyAsync(() -> cdcDiffer.diff(priorByHotel, selection.selections()), executor);
            CompletableFuture<List<SnapshotRecord>> snapshotFuture =
                    CompletableFuture.supplyAsync(() -> snapshotBuilder.build(selection.selections(), asOf), executor);
            DataQualityReport finalReport = report;
            CompletableFuture<MetricsRecord> metricsFuture = cdcFuture.thenApplyAsync(events -> metricsAggregator.aggregate(
                    new MetricsAggregator.RunFacts(runId, asOf, scored, selection, events, finalReport)), executor);

            PipelineOutputs outputs = new PipelineOutputs(selection.selections(), cdcFuture.join(),
                    snapshotFuture.join(), metricsFuture.join(), List.copyOf(scored));
            LOGGER.info("PIPELINE done runId={} candidates={} selections={} cdcEvents={} anomalies={}",
                    runId, scored.size(), selection.selections().size(), outputs.cdc().size(), report.total());
            return RunResult.completed(runId, asOf, outputs, report, assembly.droppedImages());
        } catch (StructuralViolationException e) {
            LOGGER.error("PIPELINE aborted runId={} structural violation: {}", runId, e.getMessage());
            return RunResult.aborted(runId, asOf, e.getMessage(), report);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOGGER.error("PIPELINE aborted runId={} stage failure: {}", runId, cause.toString(), cause);
            return RunResult.aborted(runId, asOf, cause.toString(), report);
        }
    }

    private List<Partial> scoreAndRank(List<EnrichedImage> candidates, ScoreContext context) {
        List<List<EnrichedImage>> chunks = partition(candidates, partitions);
        List<CompletableFuture<Partial>> futures = new ArrayList<>(chunks.size());
        for (List<EnrichedImage> chunk : chunks) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                List<ScoredImage> scored = scoreEngine.scoreAll(chunk, context);
                return new Partial(scored, selector.rank(scored));
            }, executor));
        }
        List<Partial> partials = new ArrayList<>(futures.size());
        for (CompletableFuture<Partial> future : futures) {
            partials.add(future.join());
        }
        LOGGER.debug("PIPELINE scored partitions={} candidates={}", partials.size(), candidates.size());
        return partials;
    }

    static <T> List<List<T>> partition(List<T> items, int parts) {
        List<List<T>> chunks = new ArrayList<>();
        if (items.isEmpty()) {
            chunks.add(List.of());
            return chunks;
        }
        int size = (items.size() + parts - 1) / parts;
        for (int start = 0; start < items.size(); start += size) {
            chunks.add(items.subList(start, Math.min(items.size(), start + size)));
        }
        return chunks;
    }

    private record Partial(List<ScoredImage> scored, HotelRanking ranking) {
    }
}
