package com.example.main_image_selection.model;

/**
 * Data-quality anomalies that are recovered locally and never abort a run.
 */
public enum AnomalyType {
    /** Tag whose image id matches no image record. */
    ORPHAN_TAG,
    /** Record without an image id or hotel id. */
    MISSING_JOIN_KEY,
    /** Image id seen more than once; only the first record is kept. */
    DUPLICATE_IMAGE,
    /** Input line or field that could not be parsed. */
    UNPARSEABLE_RECORD,
    /** Scoring attribute absent, default component value applied. */
    MISSING_ATTRIBUTE
}
