package com.example.main_image_selection.model;

import java.time.Instant;

/**
 * Raw per-image facts as delivered by the images feed.
 *
 * @param imageId      image identifier, join key towards tags.
 * @param hotelId      hotel the image belongs to.
 * @param width        width in pixels, may be {@code null}.
 * @param height       height in pixels, may be {@code null}.
 * @param createdAt    capture/upload instant, may be {@code null}.
 * @param source       origin of the image (e.g. "partner", "ugc"), may be {@code null}.
 * @param priorityRank explicit priority where a lower rank wins ties, may be {@code null}.
 * @param url          image location, carried through for audit output only.
 */
public record ImageRecord(String imageId,
                          String hotelId,
                          Integer width,
                          Integer height,
                          Instant createdAt,
                          String source,
                          Integer priorityRank,
                          String url) {

    public static ImageRecord of(String imageId, String hotelId, Integer width, Integer height) {
        return new ImageRecord(imageId, hotelId, width, height, null, null, null, null);
    }

    public boolean hasJoinKeys() {
        return imageId != null && !imageId.isBlank() && hotelId != null && !hotelId.isBlank();
    }
}
