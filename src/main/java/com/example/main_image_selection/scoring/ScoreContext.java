package com.example.main_image_selection.scoring;

import java.time.Instant;
import java.util.Objects;

/**
 * Run-level inputs shared by every component evaluation.
 *
 * @param asOf reference instant of the run; freshness is measured against it.
 */
public record ScoreContext(Instant asOf) {
    public ScoreContext {
        Objects.requireNonNull(asOf, "asOf");
    }
}
