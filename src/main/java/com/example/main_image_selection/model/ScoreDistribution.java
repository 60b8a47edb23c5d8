package com.example.main_image_selection.model;

/**
 * Summary of selected scores.
 */
public record ScoreDistribution(double min, double max, double mean, double p50, double p90, double p99) {
}
