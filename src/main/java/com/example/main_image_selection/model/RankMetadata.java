package com.example.main_image_selection.model;

/**
 * Explains how a hotel's selection was reached.
 *
 * @param candidateCount    candidates considered for the hotel.
 * @param disqualifiedCount disqualified candidates among them.
 * @param disqualifiedOnly  {@code true} when every candidate was disqualified and the least-bad one was picked.
 * @param decidedBy         ranking level that separated the winner from the runner-up.
 * @param runnerUpImageId   second-best candidate, {@code null} for a sole candidate.
 */
public record RankMetadata(int candidateCount,
                           int disqualifiedCount,
                           boolean disqualifiedOnly,
                           DecidedBy decidedBy,
                           String runnerUpImageId) {
}
