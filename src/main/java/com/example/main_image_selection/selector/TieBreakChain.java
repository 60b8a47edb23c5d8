package com.example.main_image_selection.selector;

import com.example.main_image_selection.model.DecidedBy;
import com.example.main_image_selection.model.ScoredImage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Total order over candidates built from named {@code (key extractor, direction)} levels.
 * The best candidate sorts first. Absent keys sort last whatever the direction.
 */
public final class TieBreakChain implements Comparator<ScoredImage> {

    public enum Direction {
        ASCENDING,
        DESCENDING
    }

    private record Level(DecidedBy name, Comparator<ScoredImage> comparator) {
    }

    private final List<Level> levels;

    private TieBreakChain(List<Level> levels) {
        this.levels = List.copyOf(levels);
    }

    /**
     * Score descending, then priority rank ascending, then image id ascending.
     */
    public static TieBreakChain standard() {
        return builder()
                .then(DecidedBy.SCORE, ScoredImage::score, Direction.DESCENDING)
                .then(DecidedBy.PRIORITY_RANK, ScoredImage::priorityRank, Direction.ASCENDING)
                .then(DecidedBy.IMAGE_ID, ScoredImage::imageId, Direction.ASCENDING)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int compare(ScoredImage a, ScoredImage b) {
        for (Level level : levels) {
            int result = level.comparator().compare(a, b);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    /**
     * First level on which the two candidates differ, {@code null} when they are equal on every level.
     */
    public DecidedBy decidingLevel(ScoredImage a, ScoredImage b) {
        for (Level level : levels) {
            if (level.comparator().compare(a, b) != 0) {
                return level.name();
            }
        }
        return null;
    }

    /** The better of two candidates; {@code a} on a full tie. */
    public ScoredImage best(ScoredImage a, ScoredImage b) {
        return compare(a, b) <= 0 ? a : b;
    }

    public static final class Builder {
        private final List<Level> levels = new ArrayList<>();

        private Builder() {
        }

        public <K extends Comparable<? super K>> Builder then(DecidedBy name,
                                                              Function<ScoredImage, ? extends K> key,
                                                              Direction direction) {
            Comparator<K> order;
            if (direction == Direction.ASCENDING) {
                order = Comparator.naturalOrder();
            } else {
                order = Comparator.reverseOrder();
            }
            levels.add(new Level(name, Comparator.comparing(key, Comparator.nullsLast(order))));
            return this;
        }

        public TieBreakChain build() {
            if (levels.isEmpty()) {
                throw new IllegalStateException("TieBreakChain needs at least one level");
            }
            return new TieBreakChain(levels);
        }
    }
}
