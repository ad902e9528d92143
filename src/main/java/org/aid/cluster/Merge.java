package org.aid.cluster;

/**
 * One agglomeration step of a merge tree.
 *
 * @param step 0-based merge order; the created cluster gets id {@code n + step}
 * @param left lower id of the two merged clusters
 * @param right higher id of the two merged clusters
 * @param height Ward linkage distance at which the two clusters merged
 * @param size number of records in the created cluster
 */
public record Merge(int step, int left, int right, double height, int size) {

    public Merge {
        if (left >= right) {
            throw new IllegalArgumentException("left must be < right, got " + left + " / " + right);
        }
    }
}
