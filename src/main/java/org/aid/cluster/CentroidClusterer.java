package org.aid.cluster;

import org.aid.error.ConfigurationException;
import org.aid.metrics.DistanceMatrix;
import org.aid.metrics.EuclideanDistance;
import org.aid.metrics.Silhouette;
import org.aid.model.ClusterAssignment;
import org.aid.model.ConvergenceWarning;
import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * k-means with seeded k-means++ initialization and several restarts.
 *
 * Determinism: every fit draws from its own {@code Random(seed)}, so the same
 * matrix, k and seed always give the same centroids and labels, whether the
 * k search runs sequentially or in parallel.
 */
public final class CentroidClusterer implements Clusterer<CentroidParams> {

    private static final Logger log = LoggerFactory.getLogger(CentroidClusterer.class);

    // relative slack when comparing inertia of neighboring k
    private static final double INERTIA_TOLERANCE = 1e-12;

    private final long seed;
    private final int maxIterations;
    private final int nInit;
    private final boolean parallel;

    /**
     * @param seed random seed for initialization
     * @param maxIterations hard cap on Lloyd iterations per run (>= 1)
     * @param nInit number of seeded restarts; the lowest inertia wins (>= 1)
     * @param parallel whether the k search may fit candidates concurrently
     */
    public CentroidClusterer(long seed, int maxIterations, int nInit, boolean parallel) {
        if (maxIterations < 1) {
            throw ConfigurationException.of("max_iterations", maxIterations, "must be >= 1");
        }
        if (nInit < 1) {
            throw ConfigurationException.of("n_init", nInit, "must be >= 1");
        }
        this.seed = seed;
        this.maxIterations = maxIterations;
        this.nInit = nInit;
        this.parallel = parallel;
    }

    @Override
    public String name() {
        return "kmeans";
    }

    @Override
    public ClusterAssignment fit(FeatureMatrix matrix, CentroidParams params) {
        Objects.requireNonNull(params, "params must not be null");
        return fit(matrix, params.k());
    }

    public ClusterAssignment fit(FeatureMatrix matrix, int k) {
        Run run = runFor(matrix, k);
        ConvergenceWarning warning = run.converged ? null
                : new ConvergenceWarning(k, run.iterations, run.changedAtLast);
        if (warning != null) {
            log.warn(warning.message());
        }
        log.info("k-means fitted: k={}, inertia={}, iterations={}", k, run.inertia, run.iterations);
        return new ClusterAssignment(name(), matrix.ids(), run.labels, warning);
    }

    /**
     * Same fit as {@link #fit(FeatureMatrix, int)}, returning the centroids for
     * prediction on unseen vectors.
     */
    public CentroidModel fitModel(FeatureMatrix matrix, int k) {
        Run run = runFor(matrix, k);
        if (!run.converged) {
            log.warn(new ConvergenceWarning(k, run.iterations, run.changedAtLast).message());
        }
        return new CentroidModel(matrix.featureNames(), run.centroids, seed, run.inertia, run.iterations, run.converged);
    }

    /**
     * Fits every k in [kMin, kMax] and scores it by inertia and mean silhouette.
     * The run scored for a k is the one {@link #fit(FeatureMatrix, int)} returns
     * for that k.
     */
    public KSearchResult searchK(FeatureMatrix matrix, int kMin, int kMax) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        if (kMin < 1) {
            throw ConfigurationException.of("k_min", kMin, "must be >= 1");
        }
        if (kMax < kMin) {
            throw ConfigurationException.of("k_max", kMax, "must be >= k_min (" + kMin + ")");
        }
        if (kMax > matrix.size()) {
            throw ConfigurationException.of("k_max", kMax, "exceeds record count " + matrix.size());
        }

        List<Run> runs = chain(matrix, kMax).subList(kMin - 1, kMax);

        DistanceMatrix distances = DistanceMatrix.compute(matrix, EuclideanDistance.INSTANCE, parallel);
        List<KScore> scores = new ArrayList<>(runs.size());
        for (Run run : runs) {
            int k = run.centroids.length;
            OptionalDouble sil = Silhouette.mean(distances, run.labels, parallel);
            Double silhouette = sil.isPresent() ? sil.getAsDouble() : null;
            log.debug("k={} inertia={} silhouette={}", k, run.inertia, silhouette);
            scores.add(new KScore(k, run.inertia, silhouette, run.converged));
        }

        KSearchResult result = new KSearchResult(scores);
        log.info("k search over [{}, {}] selected k={}", kMin, kMax,
                result.bestK().isPresent() ? result.bestK().getAsInt() : "none");
        return result;
    }

    // -------------------------------------------------------------------------
    // Per-k runs
    // -------------------------------------------------------------------------

    private Run runFor(FeatureMatrix matrix, int k) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        if (k < 1) {
            throw ConfigurationException.of("k", k, "must be >= 1");
        }
        if (matrix.size() < k) {
            throw ConfigurationException.of("k", k, "fewer records (" + matrix.size() + ") than clusters");
        }
        return chain(matrix, k).get(k - 1);
    }

    /**
     * Runs for k = 1..kMax, element {@code k - 1} holding k.
     *
     * Independent restarts per k may run in parallel and are collected in
     * ascending k order. A sequential pass then restarts k from the k-1 run plus
     * one extra centroid whenever the independent run came out with a higher
     * inertia, so the inertia curve never increases. Both the search and single
     * fits read their runs from this chain.
     */
    private List<Run> chain(FeatureMatrix matrix, int kMax) {
        IntStream ks = IntStream.rangeClosed(1, kMax);
        if (parallel) {
            ks = ks.parallel();
        }
        List<Run> runs = new ArrayList<>(ks.mapToObj(k -> bestRun(matrix, k)).toList());

        for (int i = 1; i < runs.size(); i++) {
            Run previous = runs.get(i - 1);
            Run current = runs.get(i);
            if (current.inertia > previous.inertia * (1.0 + INERTIA_TOLERANCE)) {
                Run warm = lloyd(matrix, withFarthestPoint(matrix, previous));
                log.debug("k={} independent inertia {} above k={} inertia {}; warm start gave {}",
                        current.centroids.length, current.inertia,
                        previous.centroids.length, previous.inertia, warm.inertia);
                if (warm.inertia < current.inertia) {
                    runs.set(i, relabelBySize(warm));
                }
            }
        }
        return runs;
    }

    // -------------------------------------------------------------------------
    // Lloyd iterations
    // -------------------------------------------------------------------------

    private Run bestRun(FeatureMatrix matrix, int k) {
        Random rand = new Random(seed);
        Run best = null;
        for (int r = 0; r < nInit; r++) {
            Run run = lloyd(matrix, kMeansPlusPlus(matrix, k, rand));
            if (best == null || run.inertia < best.inertia) {
                best = run;
            }
        }
        return relabelBySize(best);
    }

    /**
     * Runs assignment/update steps from the given centroids until no point
     * changes cluster or the iteration cap is reached. Returned labels are
     * always the nearest-centroid labels of the returned centroids.
     */
    private Run lloyd(FeatureMatrix matrix, double[][] initial) {
        int n = matrix.size();
        int k = initial.length;
        FeatureVector[] centroids = new FeatureVector[k];
        for (int c = 0; c < k; c++) {
            centroids[c] = new FeatureVector(initial[c]);
        }

        int[] labels = new int[n];
        Arrays.fill(labels, -1);
        int iterations = 0;
        int changed = n;
        boolean converged = false;

        while (iterations < maxIterations) {
            iterations++;
            changed = assign(matrix, centroids, labels);
            if (changed == 0) {
                converged = true;
                break;
            }
            update(matrix, centroids, labels);
        }
        if (!converged) {
            // cap reached right after an update: reassign against the final centroids
            changed = assign(matrix, centroids, labels);
            converged = changed == 0;
        }

        double inertia = 0.0;
        for (int i = 0; i < n; i++) {
            inertia += matrix.row(i).squaredDistanceTo(centroids[labels[i]]);
        }

        double[][] out = new double[k][];
        for (int c = 0; c < k; c++) {
            out[c] = centroids[c].toArrayCopy();
        }
        return new Run(out, labels, inertia, iterations, converged, changed);
    }

    /** Nearest centroid for every point, ties to the lower id. Returns the number of moved points. */
    private static int assign(FeatureMatrix matrix, FeatureVector[] centroids, int[] labels) {
        int changed = 0;
        for (int i = 0; i < matrix.size(); i++) {
            FeatureVector x = matrix.row(i);
            int best = 0;
            double bestD = Double.POSITIVE_INFINITY;
            for (int c = 0; c < centroids.length; c++) {
                double d = x.squaredDistanceTo(centroids[c]);
                if (d < bestD) {
                    bestD = d;
                    best = c;
                }
            }
            if (labels[i] != best) {
                labels[i] = best;
                changed++;
            }
        }
        return changed;
    }

    /**
     * Moves each centroid to the mean of its members. An empty cluster is
     * re-seeded at the point farthest from its current centroid.
     */
    private static void update(FeatureMatrix matrix, FeatureVector[] centroids, int[] labels) {
        int k = centroids.length;
        List<List<FeatureVector>> members = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            members.add(new ArrayList<>());
        }
        for (int i = 0; i < labels.length; i++) {
            members.get(labels[i]).add(matrix.row(i));
        }

        boolean[] taken = new boolean[labels.length];
        for (int c = 0; c < k; c++) {
            if (!members.get(c).isEmpty()) {
                centroids[c] = FeatureVector.mean(members.get(c));
                continue;
            }
            int far = -1;
            double farD = -1.0;
            for (int i = 0; i < labels.length; i++) {
                if (taken[i]) continue;
                double d = matrix.row(i).squaredDistanceTo(centroids[labels[i]]);
                if (d > farD) {
                    farD = d;
                    far = i;
                }
            }
            if (far >= 0) {
                taken[far] = true;
                centroids[c] = matrix.row(far);
            }
        }
    }

    /**
     * k-means++ seeding: first centroid uniform, each next one drawn with
     * probability proportional to the squared distance to the nearest chosen one.
     */
    private static double[][] kMeansPlusPlus(FeatureMatrix matrix, int k, Random rand) {
        int n = matrix.size();
        double[][] centroids = new double[k][];
        FeatureVector[] chosen = new FeatureVector[k];

        int first = rand.nextInt(n);
        chosen[0] = matrix.row(first);
        centroids[0] = chosen[0].toArrayCopy();

        double[] minDist = new double[n];
        for (int j = 0; j < n; j++) {
            minDist[j] = matrix.row(j).squaredDistanceTo(chosen[0]);
        }

        for (int c = 1; c < k; c++) {
            double sum = 0.0;
            for (double d : minDist) sum += d;

            int pick;
            if (sum <= 0.0) {
                // every point already coincides with a centroid
                pick = rand.nextInt(n);
            } else {
                double r = rand.nextDouble() * sum;
                double cumulative = 0.0;
                pick = -1;
                int lastPositive = 0;
                for (int j = 0; j < n; j++) {
                    if (minDist[j] > 0.0) lastPositive = j;
                    cumulative += minDist[j];
                    if (cumulative >= r && minDist[j] > 0.0) {
                        pick = j;
                        break;
                    }
                }
                if (pick < 0) pick = lastPositive;
            }

            chosen[c] = matrix.row(pick);
            centroids[c] = chosen[c].toArrayCopy();
            for (int j = 0; j < n; j++) {
                minDist[j] = Math.min(minDist[j], matrix.row(j).squaredDistanceTo(chosen[c]));
            }
        }
        return centroids;
    }

    /** Previous solution's centroids plus the point farthest from its own centroid. */
    private static double[][] withFarthestPoint(FeatureMatrix matrix, Run previous) {
        int far = 0;
        double farD = -1.0;
        for (int i = 0; i < matrix.size(); i++) {
            double d = matrix.row(i).squaredDistanceTo(new FeatureVector(previous.centroids[previous.labels[i]]));
            if (d > farD) {
                farD = d;
                far = i;
            }
        }
        double[][] out = Arrays.copyOf(previous.centroids, previous.centroids.length + 1);
        out[previous.centroids.length] = matrix.row(far).toArrayCopy();
        return out;
    }

    /**
     * Renumbers clusters by descending size; equal sizes keep the cluster whose
     * first member comes earlier in record order first.
     */
    private static Run relabelBySize(Run run) {
        int k = run.centroids.length;
        int[] size = new int[k];
        int[] firstMember = new int[k];
        Arrays.fill(firstMember, Integer.MAX_VALUE);
        for (int i = 0; i < run.labels.length; i++) {
            int c = run.labels[i];
            size[c]++;
            firstMember[c] = Math.min(firstMember[c], i);
        }

        Integer[] order = new Integer[k];
        for (int c = 0; c < k; c++) order[c] = c;
        Arrays.sort(order, Comparator.<Integer>comparingInt(c -> -size[c])
                .thenComparingInt(c -> firstMember[c])
                .thenComparingInt(c -> c));

        int[] newId = new int[k];
        double[][] centroids = new double[k][];
        for (int rank = 0; rank < k; rank++) {
            newId[order[rank]] = rank;
            centroids[rank] = run.centroids[order[rank]];
        }
        int[] labels = new int[run.labels.length];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = newId[run.labels[i]];
        }
        return new Run(centroids, labels, run.inertia, run.iterations, run.converged, run.changedAtLast);
    }

    private record Run(double[][] centroids,
                       int[] labels,
                       double inertia,
                       int iterations,
                       boolean converged,
                       int changedAtLast) {
    }
}
