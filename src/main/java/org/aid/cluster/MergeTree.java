package org.aid.cluster;

import java.util.List;
import java.util.Objects;

/**
 * Full agglomeration history, from singletons to one root cluster.
 * Leaves are the record indexes {@code 0..n-1}; merge step {@code s}
 * creates cluster {@code n + s}.
 *
 * @param ids record identifiers in matrix order
 * @param merges n - 1 merges in step order
 */
public record MergeTree(List<String> ids, List<Merge> merges) {

    public MergeTree {
        Objects.requireNonNull(ids, "ids must not be null");
        Objects.requireNonNull(merges, "merges must not be null");
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("ids must not be empty");
        }
        if (merges.size() != ids.size() - 1) {
            throw new IllegalArgumentException(
                    "A tree over " + ids.size() + " records needs " + (ids.size() - 1) + " merges, got " + merges.size());
        }
        for (int s = 0; s < merges.size(); s++) {
            Merge m = merges.get(s);
            if (m.step() != s) {
                throw new IllegalArgumentException("Merge at position " + s + " has step " + m.step());
            }
            if (m.right() >= ids.size() + s) {
                throw new IllegalArgumentException("Merge " + s + " refers to cluster " + m.right() + " not created yet");
            }
        }
        ids = List.copyOf(ids);
        merges = List.copyOf(merges);
    }

    public int leafCount() {
        return ids.size();
    }

    public double rootHeight() {
        return merges.isEmpty() ? 0.0 : merges.get(merges.size() - 1).height();
    }
}
