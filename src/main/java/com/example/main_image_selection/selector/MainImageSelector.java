package com.example.main_image_selection.selector;

import com.example.main_image_selection.model.ScoredImage;

import java.util.Collection;
import java.util.List;

/**
 * Picks exactly one main image per hotel from scored candidates.
 * <p>
 * Selection is a grouped reduction: {@link #rank} reduces any subset of the candidates, {@link #merge} combines
 * partial rankings and {@link #finish} turns the merged ranking into selections. The result does not depend
 * on how the candidates were partitioned.
 */
public interface MainImageSelector {

    /**
     * Reduces a partition of candidates to a per-hotel ranking.
     *
     * @param candidates scored images of any hotels.
     * @return partial ranking.
     */
    HotelRanking rank(Collection<ScoredImage> candidates);

    /**
     * Combines partial rankings.
     *
     * @param partials rankings of disjoint partitions.
     * @return ranking equivalent to ranking the union of the partitions.
     */
    HotelRanking merge(List<HotelRanking> partials);

    /**
     * Applies the disqualification policy and produces the selections.
     *
     * @param ranking merged ranking over all candidates.
     * @return selections plus the hotels they were drawn from.
     */
    SelectionResult finish(HotelRanking ranking);

    /**
     * Convenience for ranking, merging and finishing a single partition.
     */
    default SelectionResult select(Collection<ScoredImage> candidates) {
        return finish(rank(candidates));
    }
}
