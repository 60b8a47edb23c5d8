package com.example.main_image_selection.pipeline;

import com.example.main_image_selection.model.DataQualityReport;

import java.time.Instant;
import java.util.Optional;

/**
 * Typed outcome of a run: either completed with all outputs and the anomalies it recovered from, or aborted
 * with a reason and no outputs at all.
 */
public final class RunResult {
    private final String runId;
    private final Instant asOf;
    private final RunStatus status;
    private final PipelineOutputs outputs;
    private final DataQualityReport report;
    private final int droppedImages;
    private final String failureReason;

    private RunResult(String runId, Instant asOf, RunStatus status, PipelineOutputs outputs,
                      DataQualityReport report, int droppedImages, String failureReason) {
        this.runId = runId;
        this.asOf = asOf;
        this.status = status;
        this.outputs = outputs;
        this.report = report;
        this.droppedImages = droppedImages;
        this.failureReason = failureReason;
    }

    public static RunResult completed(String runId, Instant asOf, PipelineOutputs outputs,
                                      DataQualityReport report, int droppedImages) {
        return new RunResult(runId, asOf, RunStatus.COMPLETED, outputs, report, droppedImages, null);
    }

    public static RunResult aborted(String runId, Instant asOf, String failureReason, DataQualityReport report) {
        return new RunResult(runId, asOf, RunStatus.ABORTED, null, report, 0, failureReason);
    }

    public String runId() {
        return runId;
    }

    public Instant asOf() {
        return asOf;
    }

    public RunStatus status() {
        return status;
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    /** Outputs of a completed run; empty when the run was aborted. */
    public Optional<PipelineOutputs> outputs() {
        return Optional.ofNullable(outputs);
    }

    public DataQualityReport report() {
        return report;
    }

    public long anomalyCount() {
        return report == null ? 0 : report.total();
    }

    public int droppedImages() {
        return droppedImages;
    }

    public Optional<String> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public String toString() {
        return "RunResult{" +
                "runId='" + runId + '\'' +
                ", status=" + status +
                ", anomalies=" + anomalyCount() +
                ", failureReason='" + failureReason + '\'' +
                '}';
    }
}
