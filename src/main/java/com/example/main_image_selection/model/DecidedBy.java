package com.example.main_image_selection.model;

/**
 * Ranking level that separated a hotel's winner from its runner-up.
 */
public enum DecidedBy {
    SOLE_CANDIDATE,
    SCORE,
    PRIORITY_RANK,
    IMAGE_ID
}
