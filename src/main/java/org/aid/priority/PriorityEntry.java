package org.aid.priority;

import java.util.Objects;

/**
 * One row of the ranked aid-priority list.
 *
 * @param id record identifier
 * @param clusterId cluster label of the record (-1 for noise)
 * @param score composite vulnerability score of the record
 * @param clusterScore vulnerability score of the cluster's mean profile (NaN for noise)
 * @param tier priority tier
 */
public record PriorityEntry(String id, int clusterId, double score, double clusterScore, PriorityTier tier) {

    public PriorityEntry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
    }

    public boolean needsReview() {
        return tier == PriorityTier.REVIEW;
    }
}
