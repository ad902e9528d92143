package org.aid.evaluation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Member counts and names per cluster.
 *
 * @param algorithm producing algorithm
 * @param clusterCount number of non-noise clusters
 * @param noiseCount records labeled noise
 * @param membersByCluster cluster id -> member identifiers in record order, ascending by id
 */
public record ClusterSummary(String algorithm, int clusterCount, int noiseCount, Map<Integer, List<String>> membersByCluster) {

    public ClusterSummary {
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(membersByCluster, "membersByCluster must not be null");
    }

    public int countOf(int clusterId) {
        List<String> members = membersByCluster.get(clusterId);
        return members == null ? 0 : members.size();
    }
}
