package com.example.main_image_selection.config;

import com.example.main_image_selection.selector.DisqualifiedPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Selection policy and partitioning of the grouped reduction.
 */
@Validated
@ConfigurationProperties(prefix = "selector")
public class SelectorProperties {
    @NotNull
    private DisqualifiedPolicy disqualifiedPolicy = DisqualifiedPolicy.FORCE_WORST_PICK;
    @Min(1)
    private int partitions = 4;

    public DisqualifiedPolicy getDisqualifiedPolicy() {
        return disqualifiedPolicy;
    }

    public void setDisqualifiedPolicy(DisqualifiedPolicy disqualifiedPolicy) {
        this.disqualifiedPolicy = disqualifiedPolicy;
    }

    public int getPartitions() {
        return partitions;
    }

    public void setPartitions(int partitions) {
        this.partitions = partitions;
    }
}
