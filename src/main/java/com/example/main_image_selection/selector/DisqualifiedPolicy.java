package com.example.main_image_selection.selector;

/**
 * What to do with a hotel whose candidates are all disqualified.
 */
public enum DisqualifiedPolicy {
    /** Select the least-bad candidate and flag the selection as disqualified-only. */
    FORCE_WORST_PICK,
    /** Leave the hotel without a selection; a prior assignment then turns into a removal. */
    NO_SELECTION
}
