package com.example.main_image_selection.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Image joined with all of its tags.
 * <p>
 * Tags are kept in a sorted map of tag name to the highest confidence seen for it. A tag reported without
 * any confidence is stored with a {@code null} value.
 */
public final class EnrichedImage {
    private final ImageRecord image;
    private final Map<String, Double> tags;

    public EnrichedImage(ImageRecord image, Map<String, Double> tags) {
        this.image = image;
        this.tags = Collections.unmodifiableMap(new TreeMap<>(tags == null ? Map.of() : tags));
    }

    public static EnrichedImage untagged(ImageRecord image) {
        return new EnrichedImage(image, Map.of());
    }

    public ImageRecord image() {
        return image;
    }

    public String imageId() {
        return image.imageId();
    }

    public String hotelId() {
        return image.hotelId();
    }

    public Map<String, Double> tags() {
        return tags;
    }

    public Set<String> tagNames() {
        return tags.keySet();
    }

    public boolean hasTag(String tag) {
        return tags.containsKey(tag);
    }

    public Optional<Double> confidence(String tag) {
        return Optional.ofNullable(tags.get(tag));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnrichedImage that)) return false;
        return image.equals(that.image) && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return 31 * image.hashCode() + tags.hashCode();
    }

    @Override
    public String toString() {
        return "EnrichedImage{" +
                "imageId='" + image.imageId() + '\'' +
                ", hotelId='" + image.hotelId() + '\'' +
                ", tags=" + tags +
                '}';
    }
}
