package com.example.main_image_selection.model;

/**
 * One tag attached to an image by the tagging feed.
 *
 * @param imageId    image the tag refers to.
 * @param tag        tag name.
 * @param confidence tagger confidence in {@code [0, 1]}, {@code null} when the feed has none.
 */
public record TagRecord(String imageId, String tag, Double confidence) {
}
