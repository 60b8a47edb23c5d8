package com.example.main_image_selection.model;

/**
 * Main image chosen for a hotel by the previous run.
 *
 * @param hotelId hotel identifier.
 * @param imageId previously selected image.
 */
public record PriorAssignment(String hotelId, String imageId) {
}
