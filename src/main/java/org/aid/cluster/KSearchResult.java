package org.aid.cluster;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Scores of a k search, one per candidate in ascending k order.
 */
public record KSearchResult(List<KScore> scores) {

    public KSearchResult {
        Objects.requireNonNull(scores, "scores must not be null");
        scores = List.copyOf(scores);
    }

    /**
     * The k with the highest mean silhouette among candidates with k >= 2.
     * Equal scores keep the smaller k. Empty when no candidate has a defined
     * silhouette.
     */
    public OptionalInt bestK() {
        KScore best = null;
        for (KScore s : scores) {
            if (s.k() < 2 || s.silhouette() == null) continue;
            if (best == null || s.silhouette() > best.silhouette()) {
                best = s;
            }
        }
        return best == null ? OptionalInt.empty() : OptionalInt.of(best.k());
    }

    public KScore scoreFor(int k) {
        for (KScore s : scores) {
            if (s.k() == k) return s;
        }
        throw new IllegalArgumentException("k=" + k + " was not searched");
    }

    /** Inertia per k, in k order; for the elbow plot only. */
    public double[] inertiaCurve() {
        double[] out = new double[scores.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = scores.get(i).inertia();
        }
        return out;
    }
}
