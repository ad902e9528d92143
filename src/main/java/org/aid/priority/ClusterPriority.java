package org.aid.priority;

/**
 * Cluster-level ranking row.
 *
 * @param clusterId cluster label
 * @param score vulnerability score of the cluster's mean profile
 * @param size member count
 * @param tier tier of the cluster score under the same thresholds as records
 */
public record ClusterPriority(int clusterId, double score, int size, PriorityTier tier) {
}
