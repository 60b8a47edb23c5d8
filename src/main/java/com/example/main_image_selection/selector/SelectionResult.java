package com.example.main_image_selection.selector;

import com.example.main_image_selection.model.SelectionSet;

import java.util.Set;

/**
 * Outcome of the selection stage.
 *
 * @param selections       one selection per hotel that has one.
 * @param candidateHotels  every hotel that had at least one candidate, sorted.
 * @param suppressedHotels disqualified-only hotels left without a selection by {@link DisqualifiedPolicy#NO_SELECTION}.
 */
public record SelectionResult(SelectionSet selections, Set<String> candidateHotels, Set<String> suppressedHotels) {
}
