package org.aid.cluster;

import org.aid.error.ConfigurationException;
import org.aid.metrics.DistanceMatrix;
import org.aid.model.ClusterAssignment;
import org.aid.model.FeatureMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Agglomerative clustering with Ward linkage.
 *
 * Each step merges the two active clusters whose union gives the smallest
 * increase in within-cluster variance. Distances are kept in a full table and
 * updated with the Lance-Williams formula for Ward:
 *
 * d(ij, k) = sqrt(((n_i + n_k) d(i,k)^2 + (n_j + n_k) d(j,k)^2 - n_k d(i,j)^2) / (n_i + n_j + n_k))
 *
 * Equal distances go to the pair with the smaller (lower id, higher id).
 */
public final class HierarchicalClusterer implements Clusterer<HierarchicalParams> {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalClusterer.class);

    @Override
    public String name() {
        return "hierarchical";
    }

    @Override
    public ClusterAssignment fit(FeatureMatrix matrix, HierarchicalParams params) {
        Objects.requireNonNull(params, "params must not be null");
        return cut(buildTree(matrix), params.k());
    }

    public MergeTree buildTree(FeatureMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        int n = matrix.size();

        DistanceMatrix initial = DistanceMatrix.euclidean(matrix);
        double[][] d = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                d[i][j] = initial.get(i, j);
            }
        }

        // slot -> current cluster id / size; a merged pair lives on in the lower slot
        int[] clusterId = new int[n];
        int[] size = new int[n];
        boolean[] active = new boolean[n];
        for (int i = 0; i < n; i++) {
            clusterId[i] = i;
            size[i] = 1;
            active[i] = true;
        }

        List<Merge> merges = new ArrayList<>(Math.max(0, n - 1));
        for (int step = 0; step < n - 1; step++) {
            int bestP = -1;
            int bestQ = -1;
            double bestD = Double.POSITIVE_INFINITY;
            int bestLow = Integer.MAX_VALUE;
            int bestHigh = Integer.MAX_VALUE;

            for (int p = 0; p < n; p++) {
                if (!active[p]) continue;
                for (int q = p + 1; q < n; q++) {
                    if (!active[q]) continue;
                    double dist = d[p][q];
                    int low = Math.min(clusterId[p], clusterId[q]);
                    int high = Math.max(clusterId[p], clusterId[q]);
                    if (dist < bestD
                            || (dist == bestD && (low < bestLow || (low == bestLow && high < bestHigh)))) {
                        bestD = dist;
                        bestP = p;
                        bestQ = q;
                        bestLow = low;
                        bestHigh = high;
                    }
                }
            }

            int merged = size[bestP] + size[bestQ];
            merges.add(new Merge(step, bestLow, bestHigh, bestD, merged));

            // Lance-Williams update into slot bestP
            for (int r = 0; r < n; r++) {
                if (!active[r] || r == bestP || r == bestQ) continue;
                double ni = size[bestP];
                double nj = size[bestQ];
                double nk = size[r];
                double sq = ((ni + nk) * d[bestP][r] * d[bestP][r]
                        + (nj + nk) * d[bestQ][r] * d[bestQ][r]
                        - nk * bestD * bestD) / (ni + nj + nk);
                double updated = Math.sqrt(Math.max(0.0, sq));
                d[bestP][r] = updated;
                d[r][bestP] = updated;
            }
            active[bestQ] = false;
            size[bestP] = merged;
            clusterId[bestP] = n + step;
        }

        MergeTree tree = new MergeTree(matrix.ids(), merges);
        log.info("Ward merge tree built over {} records, root height {}", n, tree.rootHeight());
        return tree;
    }

    /**
     * Cuts the tree into exactly {@code k} clusters by undoing its last
     * {@code k - 1} merges. Clusters are numbered in the order their first
     * member appears in record order.
     *
     * @throws ConfigurationException if k < 1 or k > record count
     */
    public ClusterAssignment cut(MergeTree tree, int k) {
        Objects.requireNonNull(tree, "tree must not be null");
        int n = tree.leafCount();
        if (k < 1 || k > n) {
            throw ConfigurationException.of("linkage_cut_k", k, "must be in [1, " + n + "]");
        }

        int[] parent = new int[2 * n - 1];
        Arrays.fill(parent, -1);
        for (int s = 0; s < n - k; s++) {
            Merge m = tree.merges().get(s);
            parent[m.left()] = n + s;
            parent[m.right()] = n + s;
        }

        Map<Integer, Integer> labelByRoot = new HashMap<>();
        int[] labels = new int[n];
        for (int i = 0; i < n; i++) {
            int root = i;
            while (parent[root] >= 0) {
                root = parent[root];
            }
            Integer label = labelByRoot.get(root);
            if (label == null) {
                label = labelByRoot.size();
                labelByRoot.put(root, label);
            }
            labels[i] = label;
        }

        log.debug("Cut merge tree into {} clusters", k);
        return new ClusterAssignment(name(), tree.ids(), labels);
    }
}
