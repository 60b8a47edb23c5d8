package com.example.main_image_selection.model;

/**
 * Main image chosen for a hotel in the current run.
 *
 * @param hotelId      hotel identifier.
 * @param imageId      winning image.
 * @param score        score of the winning image.
 * @param rankMetadata ranking trace.
 */
public record Selection(String hotelId, String imageId, double score, RankMetadata rankMetadata) {
}
