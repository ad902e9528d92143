package org.aid.cluster;

import org.aid.metrics.EuclideanDistance;
import org.aid.metrics.Neighbor;
import org.aid.metrics.RadiusNeighbors;
import org.aid.model.ClusterAssignment;
import org.aid.model.FeatureMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * DBSCAN over Euclidean distance.
 *
 * Records are visited in matrix order; a new cluster id is opened at each
 * core point not yet claimed, so ids follow the order in which each cluster's
 * first core point is discovered. A border point reachable from several
 * clusters stays with the first one that reached it.
 */
public final class DensityClusterer implements Clusterer<DensityParams> {

    private static final Logger log = LoggerFactory.getLogger(DensityClusterer.class);

    @Override
    public String name() {
        return "dbscan";
    }

    @Override
    public ClusterAssignment fit(FeatureMatrix matrix, DensityParams params) {
        return new ClusterAssignment(name(), matrix.ids(), run(matrix, params).labels);
    }

    public DensityModel fitModel(FeatureMatrix matrix, DensityParams params) {
        Run run = run(matrix, params);
        List<String> coreIds = new ArrayList<>();
        List<double[]> corePoints = new ArrayList<>();
        List<Integer> coreLabels = new ArrayList<>();
        for (int i = 0; i < matrix.size(); i++) {
            if (run.core[i]) {
                coreIds.add(matrix.id(i));
                corePoints.add(matrix.row(i).toArrayCopy());
                coreLabels.add(run.labels[i]);
            }
        }
        return new DensityModel(
                matrix.featureNames(),
                params.eps(),
                params.minSamples(),
                coreIds,
                corePoints.toArray(new double[0][]),
                coreLabels.stream().mapToInt(Integer::intValue).toArray()
        );
    }

    private Run run(FeatureMatrix matrix, DensityParams params) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        Objects.requireNonNull(params, "params must not be null");

        int n = matrix.size();
        RadiusNeighbors index = new RadiusNeighbors(matrix, EuclideanDistance.INSTANCE);

        List<List<Neighbor>> neighborhoods = new ArrayList<>(n);
        boolean[] core = new boolean[n];
        for (int i = 0; i < n; i++) {
            List<Neighbor> hood = index.withinRadius(i, params.eps());
            neighborhoods.add(hood);
            core[i] = hood.size() >= params.minSamples();
        }

        int[] labels = new int[n];
        Arrays.fill(labels, ClusterAssignment.NOISE);
        int nextCluster = 0;

        for (int i = 0; i < n; i++) {
            if (labels[i] != ClusterAssignment.NOISE || !core[i]) continue;

            int cluster = nextCluster++;
            labels[i] = cluster;
            Deque<Integer> frontier = new ArrayDeque<>();
            frontier.add(i);

            while (!frontier.isEmpty()) {
                int p = frontier.poll();
                for (Neighbor nb : neighborhoods.get(p)) {
                    int q = nb.index();
                    if (labels[q] != ClusterAssignment.NOISE) continue;
                    labels[q] = cluster;
                    if (core[q]) {
                        frontier.add(q);
                    }
                }
            }
        }

        int noise = 0;
        for (int label : labels) {
            if (label == ClusterAssignment.NOISE) noise++;
        }
        log.info("DBSCAN ({}) found {} clusters and {} noise points", params.describe(), nextCluster, noise);
        return new Run(labels, core);
    }

    private record Run(int[] labels, boolean[] core) {
    }
}
