package com.example.main_image_selection.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Input and output locations of a run plus boundary policies.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private boolean runOnStartup = true;
    /** ISO-8601 instant pinning the run's as-of time; blank means "now". */
    private String asOf;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxDroppedImageRatio = 1.0;

    @Valid
    private Input input = new Input();
    @Valid
    private Output output = new Output();
    @Valid
    private Worker worker = new Worker();

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public String getAsOf() {
        return asOf;
    }

    public void setAsOf(String asOf) {
        this.asOf = asOf;
    }

    public double getMaxDroppedImageRatio() {
        return maxDroppedImageRatio;
    }

    public void setMaxDroppedImageRatio(double maxDroppedImageRatio) {
        this.maxDroppedImageRatio = maxDroppedImageRatio;
    }

    public Input getInput() {
        return input;
    }

    public void setInput(Input input) {
        this.input = input;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public static class Input {
        @NotBlank
        private String images = "data/images.jsonl";
        @NotBlank
        private String tags = "data/image_tags.jsonl";
        @NotBlank
        private String mainImages = "data/main_images.jsonl";

        public String getImages() { return images; }
        public void setImages(String images) { this.images = images; }

        public String getTags() { return tags; }
        public void setTags(String tags) { this.tags = tags; }

        public String getMainImages() { return mainImages; }
        public void setMainImages(String mainImages) { this.mainImages = mainImages; }
    }

    public static class Output {
        @NotBlank
        private String cdc = "output/output_cdc.jsonl";
        @NotBlank
        private String snapshot = "output/output_snapshot.jsonl";
        @NotBlank
        private String metrics = "output/output_metrics.jsonl";
        /** Optional audit of every scored image; blank disables it. */
        private String scores;

        public String getCdc() { return cdc; }
        public void setCdc(String cdc) { this.cdc = cdc; }

        public String getSnapshot() { return snapshot; }
        public void setSnapshot(String snapshot) { this.snapshot = snapshot; }

        public String getMetrics() { return metrics; }
        public void setMetrics(String metrics) { this.metrics = metrics; }

        public String getScores() { return scores; }
        public void setScores(String scores) { this.scores = scores; }
    }

    public static class Worker {
        @Min(1)
        private int threads = 4;
        @Min(1)
        private int queueCapacity = 100;

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
