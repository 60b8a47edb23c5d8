package com.example.main_image_selection.runner;

import com.example.main_image_selection.config.PipelineProperties;
import com.example.main_image_selection.exception.InputReadException;
import com.example.main_image_selection.io.InputRecordParsers;
import com.example.main_image_selection.io.JsonlReader;
import com.example.main_image_selection.io.OutputPublisher;
import com.example.main_image_selection.io.ReadResult;
import com.example.main_image_selection.io.ScoredImageLine;
import com.example.main_image_selection.model.ImageRecord;
import com.example.main_image_selection.model.PriorAssignment;
import com.example.main_image_selection.model.TagRecord;
import com.example.main_image_selection.pipeline.MainImagePipeline;
import com.example.main_image_selection.pipeline.PipelineInput;
import com.example.main_image_selection.pipeline.PipelineOutputs;
import com.example.main_image_selection.pipeline.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Boundary around the pipeline: reads the three JSONL inputs, runs the pipeline, applies the drop-rate
 * policy and publishes the outputs of a completed run. Nothing is written for an aborted run.
 */
@Service
public class MainImageJob {
    private static final Logger LOGGER = LoggerFactory.getLogger(MainImageJob.class);

    private final MainImagePipeline pipeline;
    private final JsonlReader reader;
    private final OutputPublisher publisher;
    private final PipelineProperties properties;
    private final Clock clock;

    public MainImageJob(MainImagePipeline pipeline,
                        JsonlReader reader,
                        OutputPublisher publisher,
                        PipelineProperties properties,
                        Clock clock) {
        this.pipeline = pipeline;
        this.reader = reader;
        this.publisher = publisher;
        this.properties = properties;
        this.clock = clock;
    }

    public RunResult execute() {
        String runId = UUID.randomUUID().toString();
        Instant asOf = resolveAsOf();

        PipelineInput input;
        try {
            input = readInputs();
        } catch (InputReadException e) {
            LOGGER.error("JOB aborted runId={} input failure: {}", runId, e.getMessage());
            return RunResult.aborted(runId, asOf, e.getMessage(), null);
        }

        RunResult result = pipeline.run(input, runId, asOf);
        if (!result.isCompleted()) {
            LOGGER.error("JOB aborted runId={} reason={} nothing published", runId, result.failureReason().orElse("-"));
            return result;
        }

        double dropRatio = input.images().isEmpty() ? 0.0 : result.droppedImages() / (double) input.images().size();
        if (dropRatio > properties.getMaxDroppedImageRatio()) {
            String reason = String.format(Locale.ROOT, "dropped image ratio %.4f exceeds %.4f (%d of %d)",
                    dropRatio, properties.getMaxDroppedImageRatio(), result.droppedImages(), input.images().size());
            LOGGER.error("JOB aborted runId={} reason={} nothing published", runId, reason);
            return RunResult.aborted(runId, asOf, reason, result.report());
        }

        PipelineOutputs outputs = result.outputs().orElseThrow();
        publisher.publish(outputFiles(outputs));
        LOGGER.info("JOB completed runId={} asOf={} selections={} cdcEvents={} anomalies={}",
                runId, asOf, outputs.selections().size(), outputs.cdc().size(), result.anomalyCount());
        return result;
    }

    PipelineInput readInputs() {
        PipelineProperties.Input in = properties.getInput();
        ReadResult<ImageRecord> images = reader.read(Path.of(in.getImages()), InputRecordParsers.images());
        ReadResult<TagRecord> tags = reader.read(Path.of(in.getTags()), InputRecordParsers.tags());
        ReadResult<PriorAssignment> prior = reader.read(Path.of(in.getMainImages()), InputRecordParsers.priorAssignments());
        return new PipelineInput(images.records(), tags.records(), prior.records(),
                images.report().merge(tags.report()).merge(prior.report()));
    }

    Map<Path, Collection<?>> outputFiles(PipelineOutputs outputs) {
        PipelineProperties.Output out = properties.getOutput();
        Map<Path, Collection<?>> files = new LinkedHashMap<>();
        files.put(Path.of(out.getCdc()), outputs.cdc());
        files.put(Path.of(out.getSnapshot()), outputs.snapshot());
        files.put(Path.of(out.getMetrics()), List.of(outputs.metrics()));
        if (out.getScores() != null && !out.getScores().isBlank()) {
            files.put(Path.of(out.getScores()), outputs.scored().stream().map(ScoredImageLine::from).toList());
        }
        return files;
    }

    Instant resolveAsOf() {
        String pinned = properties.getAsOf();
        if (pinned == null || pinned.isBlank()) {
            return clock.instant();
        }
        try {
            return Instant.parse(pinned.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("pipeline.as-of is not an ISO-8601 instant: " + pinned, e);
        }
    }
}
