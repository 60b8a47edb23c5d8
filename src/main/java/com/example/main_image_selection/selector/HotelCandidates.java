package com.example.main_image_selection.selector;

import com.example.main_image_selection.model.ScoredImage;

/**
 * Immutable per-hotel accumulator: the two best candidates and counters.
 * {@link #combine} is associative and commutative for a total order, so partial accumulators built on any
 * partitioning merge into the same result.
 */
public record HotelCandidates(ScoredImage best, ScoredImage runnerUp, int candidateCount, int disqualifiedCount) {

    public static HotelCandidates of(ScoredImage image) {
        return new HotelCandidates(image, null, 1, image.disqualified() ? 1 : 0);
    }

    public HotelCandidates add(ScoredImage image, TieBreakChain chain) {
        return combine(of(image), chain);
    }

    public HotelCandidates combine(HotelCandidates other, TieBreakChain chain) {
        ScoredImage first = chain.best(best, other.best);
        ScoredImage firstLoser = first == best ? other.best : best;
        ScoredImage second = firstLoser;
        ScoredImage ownRunnerUp = first == best ? runnerUp : other.runnerUp;
        if (ownRunnerUp != null) {
            second = chain.best(ownRunnerUp, firstLoser);
        }
        return new HotelCandidates(first, second,
                candidateCount + other.candidateCount,
                disqualifiedCount + other.disqualifiedCount);
    }

    public boolean disqualifiedOnly() {
        return disqualifiedCount == candidateCount;
    }
}
