package com.example.main_image_selection.runner;

import com.example.main_image_selection.exception.PipelineAbortedException;
import com.example.main_image_selection.pipeline.RunResult;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Executes one batch run on startup. An aborted run fails the application so the process exits non-zero.
 */
@Component
@ConditionalOnProperty(prefix = "pipeline", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class PipelineRunner implements ApplicationRunner {

    private final MainImageJob job;

    public PipelineRunner(MainImageJob job) {
        this.job = job;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunResult result = job.execute();
        if (!result.isCompleted()) {
            throw new PipelineAbortedException("Run " + result.runId() + " aborted: " + result.failureReason().orElse("unknown"));
        }
    }
}
