package org.aid.cluster;

/**
 * @param k number of clusters to cut the merge tree into; checked against the
 *          record count at cut time
 */
public record HierarchicalParams(int k) implements ClusteringParams {

    @Override
    public String describe() {
        return "k=" + k;
    }
}
