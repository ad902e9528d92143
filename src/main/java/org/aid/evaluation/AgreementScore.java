package org.aid.evaluation;

import org.aid.error.DataShapeException;
import org.aid.model.ClusterAssignment;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Adjusted Rand index between two assignments of the same records.
 *
 * 1.0 means the two partitions put exactly the same pairs together (label
 * names do not matter); values around 0 mean no more agreement than chance.
 * Noise is compared as an ordinary label.
 */
public final class AgreementScore {

    private AgreementScore() {
    }

    public static double adjustedRand(ClusterAssignment a, ClusterAssignment b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        if (!a.ids().equals(b.ids())) {
            throw new DataShapeException(
                    "Cannot compare " + a.algorithm() + " and " + b.algorithm() + ": records differ");
        }

        int n = a.size();
        Map<Long, Integer> contingency = new HashMap<>();
        Map<Integer, Integer> rowSums = new HashMap<>();
        Map<Integer, Integer> colSums = new HashMap<>();
        for (int i = 0; i < n; i++) {
            int la = a.label(i);
            int lb = b.label(i);
            long key = ((long) la << 32) | (lb & 0xffffffffL);
            contingency.merge(key, 1, Integer::sum);
            rowSums.merge(la, 1, Integer::sum);
            colSums.merge(lb, 1, Integer::sum);
        }

        double index = 0.0;
        for (int c : contingency.values()) index += pairs(c);
        double sumA = 0.0;
        for (int c : rowSums.values()) sumA += pairs(c);
        double sumB = 0.0;
        for (int c : colSums.values()) sumB += pairs(c);

        double total = pairs(n);
        double expected = total == 0.0 ? 0.0 : sumA * sumB / total;
        double max = 0.5 * (sumA + sumB);
        double denom = max - expected;
        if (denom == 0.0) {
            // both partitions trivial in the same way (all together or all apart)
            return 1.0;
        }
        return (index - expected) / denom;
    }

    private static double pairs(int count) {
        return count * (count - 1) / 2.0;
    }
}
