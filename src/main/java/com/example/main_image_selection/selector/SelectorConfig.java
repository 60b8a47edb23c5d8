package com.example.main_image_selection.selector;

/**
 * Configuration for the {@link MainImageSelector}.
 *
 * @param disqualifiedPolicy handling of hotels whose candidates are all disqualified.
 * @param partitions         number of partitions the candidates are split into for partial reduction.
 */
public record SelectorConfig(DisqualifiedPolicy disqualifiedPolicy, int partitions) {

    public SelectorConfig {
        if (disqualifiedPolicy == null) {
            disqualifiedPolicy = DisqualifiedPolicy.FORCE_WORST_PICK;
        }
        partitions = Math.max(1, partitions);
    }

    /**
     * Forced worst pick on a single partition.
     *
     * @return default selector configuration.
     */
    public static SelectorConfig defaults() {
        return new SelectorConfig(DisqualifiedPolicy.FORCE_WORST_PICK, 1);
    }

    public SelectorConfig withPolicy(DisqualifiedPolicy policy) {
        return new SelectorConfig(policy, partitions);
    }

    public SelectorConfig withPartitions(int partitions) {
        return new SelectorConfig(disqualifiedPolicy, partitions);
    }
}
