import org.aid.cache.ModelCache;
import org.aid.cache.ModelKey;
import org.aid.cluster.CentroidClusterer;
import org.aid.cluster.CentroidModel;
import org.aid.cluster.CentroidParams;
import org.aid.cluster.Clusterer;
import org.aid.cluster.ClusteringParams;
import org.aid.cluster.DensityClusterer;
import org.aid.cluster.DensityModel;
import org.aid.cluster.DensityParams;
import org.aid.cluster.HierarchicalClusterer;
import org.aid.cluster.HierarchicalParams;
import org.aid.cluster.KSearchResult;
import org.aid.cluster.MergeTree;
import org.aid.error.ConfigurationException;
import org.aid.error.DataShapeException;
import org.aid.evaluation.ClusterEvaluator;
import org.aid.io.json.ModelStore;
import org.aid.model.ClusterAssignment;
import org.aid.model.ClusterProfile;
import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;
import org.aid.priority.PriorityEntry;
import org.aid.priority.PriorityRanker;
import org.aid.priority.TierThresholds;
import org.aid.priority.VulnerabilityWeights;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RequirementsAcceptanceTest
 *
 * Goal:
 *  Verify end to end, on small hand-made data sets, the behavior the engine
 *  promises to its callers:
 *
 *  A) Clustering
 *    1) k search: inertia never increases with k; silhouette picks k
 *    2) Seeded centroid fits are reproducible
 *    3) Merge tree cuts at both extremes
 *    4) Density noise rule
 *
 *  B) Evaluation and ranking
 *    5) Self agreement is maximal
 *    6) Priority list is a total order
 *    7) Profiles recomputed from an assignment reproduce the ranking means
 *
 *  C) Engineering
 *    8) One clustering capability shared by the three algorithms
 *    9) Explicit model cache with fingerprint keys
 *   10) Saved models behave identically after reload
 *   11) Fatal errors name the offending parameter
 */
public class RequirementsAcceptanceTest {

    private static FeatureMatrix random(long seed, int n, int dim) {
        Random rand = new Random(seed);
        double[][] rows = new double[n][dim];
        for (double[] r : rows) {
            for (int j = 0; j < dim; j++) r[j] = rand.nextGaussian();
        }
        return FeatureMatrix.fromRows(rows);
    }

    private static FeatureMatrix twoTriples() {
        return FeatureMatrix.fromRows(new double[][]{
                {0.0, 0.0}, {0.3, 0.1}, {0.1, 0.4},
                {8.0, 8.0}, {8.2, 7.9}, {7.8, 8.3}});
    }

    @Nested
    class ClusteringRequirements {

        @Test
        void inertiaIsNonIncreasingOverRandomMatrices() {
            for (long seed = 10; seed < 20; seed++) {
                FeatureMatrix m = random(seed, 25, 3);
                KSearchResult r = new CentroidClusterer(seed, 300, 3, true).searchK(m, 1, 10);
                double[] curve = r.inertiaCurve();
                for (int i = 1; i < curve.length; i++) {
                    assertTrue(curve[i] <= curve[i - 1] * (1.0 + 1e-12),
                            "seed " + seed + ": inertia rose at k=" + (i + 1));
                }
            }
        }

        @Test
        void twoTriplesScenario() {
            FeatureMatrix m = twoTriples();
            CentroidClusterer c = new CentroidClusterer(42L, 300, 10, false);

            assertEquals(2, c.searchK(m, 2, 4).bestK().getAsInt());

            ClusterAssignment a = c.fit(m, 2);
            assertEquals(a.label(0), a.label(1));
            assertEquals(a.label(0), a.label(2));
            assertEquals(a.label(3), a.label(4));
            assertEquals(a.label(3), a.label(5));
            assertNotEquals(a.label(0), a.label(3));
        }

        @Test
        void seededFitIsIdempotent() {
            FeatureMatrix m = random(5, 40, 4);
            CentroidClusterer c = new CentroidClusterer(99L, 300, 5, true);

            assertEquals(c.fit(m, 4), c.fit(m, 4));
            assertEquals(c.fit(m, 4), new CentroidClusterer(99L, 300, 5, false).fit(m, 4));
        }

        @Test
        void cutExtremes() {
            FeatureMatrix m = random(3, 12, 2);
            HierarchicalClusterer h = new HierarchicalClusterer();
            MergeTree tree = h.buildTree(m);

            ClusterAssignment all = h.cut(tree, m.size());
            Set<Integer> distinct = new HashSet<>();
            for (int i = 0; i < m.size(); i++) distinct.add(all.label(i));
            assertEquals(m.size(), distinct.size());

            ClusterAssignment one = h.cut(tree, 1);
            for (int i = 0; i < m.size(); i++) assertEquals(0, one.label(i));
        }

        @Test
        void outlierScenario() {
            FeatureMatrix m = FeatureMatrix.fromRows(new double[][]{
                    {0.0, 0.0}, {0.2, 0.0}, {0.0, 0.2}, {30.0, 30.0}});

            ClusterAssignment a = new DensityClusterer().fit(m, new DensityParams(0.5, 3));

            assertEquals(ClusterAssignment.NOISE, a.label(3));
            assertTrue(a.label(0) >= 0);
            assertEquals(a.label(0), a.label(1));
            assertEquals(a.label(0), a.label(2));
        }

        @Test
        void sparsePointsOutOfReachAreNoise() {
            FeatureMatrix m = random(21, 60, 2);
            DensityParams p = new DensityParams(0.4, 4);
            ClusterAssignment a = new DensityClusterer().fit(m, p);

            boolean[] core = new boolean[m.size()];
            for (int i = 0; i < m.size(); i++) {
                int within = 0;
                for (int j = 0; j < m.size(); j++) {
                    if (Math.sqrt(m.row(i).squaredDistanceTo(m.row(j))) <= p.eps()) within++;
                }
                core[i] = within >= p.minSamples();
            }
            for (int i = 0; i < m.size(); i++) {
                if (core[i]) continue;
                boolean reachable = false;
                for (int j = 0; j < m.size(); j++) {
                    if (core[j] && Math.sqrt(m.row(i).squaredDistanceTo(m.row(j))) <= p.eps()) reachable = true;
                }
                if (!reachable) {
                    assertEquals(ClusterAssignment.NOISE, a.label(i), "record " + i);
                }
            }
        }
    }

    @Nested
    class EvaluationAndRankingRequirements {

        private final ClusterEvaluator evaluator = new ClusterEvaluator(0.5);
        private final PriorityRanker ranker = new PriorityRanker(
                new VulnerabilityWeights(Map.of("f0", 1.0, "f1", -0.5)), new TierThresholds(-0.5, 0.5));

        @Test
        void selfAgreementIsMaximal() {
            FeatureMatrix m = random(8, 30, 3);
            ClusterAssignment a = new CentroidClusterer(1L, 300, 3, false).fit(m, 4);
            ClusterAssignment d = new DensityClusterer().fit(m, new DensityParams(0.8, 3));

            assertEquals(1.0, evaluator.agreement(a, a), 1e-12);
            assertEquals(1.0, evaluator.agreement(d, d), 1e-12);
        }

        @Test
        void priorityListIsATotalOrder() {
            // rounded values force equal scores
            double[][] rows = new double[30][2];
            Random rand = new Random(4);
            for (double[] r : rows) {
                r[0] = Math.round(rand.nextGaussian());
                r[1] = Math.round(rand.nextGaussian());
            }
            FeatureMatrix m = FeatureMatrix.fromRows(rows);
            ClusterAssignment a = new CentroidClusterer(2L, 300, 3, false).fit(m, 3);

            List<PriorityEntry> ranked = ranker.rank(a, m, evaluator.profile(a, m));

            for (int i = 1; i < ranked.size(); i++) {
                PriorityEntry p = ranked.get(i - 1);
                PriorityEntry q = ranked.get(i);
                assertTrue(p.score() >= q.score());
                if (p.score() == q.score()) {
                    assertTrue(p.id().compareTo(q.id()) < 0);
                }
            }
        }

        @Test
        void recomputedProfilesReproduceRankingMeans() {
            FeatureMatrix m = random(12, 20, 2);
            ClusterAssignment a = new CentroidClusterer(3L, 300, 3, false).fit(m, 3);

            SortedMap<Integer, ClusterProfile> original = evaluator.profile(a, m);
            List<PriorityEntry> ranked = ranker.rank(a, m, original);
            SortedMap<Integer, ClusterProfile> recomputed = evaluator.profile(a, m);

            FeatureVector w = new FeatureVector(new double[]{1.0, -0.5});
            for (PriorityEntry e : ranked) {
                ClusterProfile p = recomputed.get(e.clusterId());
                assertEquals(original.get(e.clusterId()).means(), p.means());
                assertEquals(e.clusterScore(), p.means().dot(w));
            }
        }
    }

    @Nested
    class EngineeringRequirements {

        @Test
        void oneCapabilityForAllThreeAlgorithms() {
            FeatureMatrix m = twoTriples();
            Map<Clusterer<?>, ClusteringParams> fits = new LinkedHashMap<>();
            fits.put(new CentroidClusterer(42L, 300, 10, false), new CentroidParams(2));
            fits.put(new HierarchicalClusterer(), new HierarchicalParams(2));
            fits.put(new DensityClusterer(), new DensityParams(1.0, 2));

            List<ClusterAssignment> out = new ArrayList<>();
            for (Map.Entry<Clusterer<?>, ClusteringParams> e : fits.entrySet()) {
                out.add(fit(e.getKey(), e.getValue(), m));
            }

            ClusterEvaluator evaluator = new ClusterEvaluator(0.5);
            for (ClusterAssignment a : out) {
                assertEquals(2, a.clusterCount(), a.algorithm());
                assertEquals(1.0, evaluator.agreement(out.get(0), a), 1e-12);
            }
        }

        @SuppressWarnings("unchecked")
        private <P extends ClusteringParams> ClusterAssignment fit(Clusterer<P> c, ClusteringParams p, FeatureMatrix m) {
            return c.fit(m, (P) p);
        }

        @Test
        void cacheIsExplicitAndKeyedByContent() {
            ModelCache cache = new ModelCache();
            FeatureMatrix m = twoTriples();
            CentroidClusterer c = new CentroidClusterer(42L, 300, 10, false);

            ClusterAssignment a = cache.getOrCompute(ModelKey.of(m, c.name(), new CentroidParams(2)),
                    ClusterAssignment.class, () -> c.fit(m, 2));
            ClusterAssignment b = cache.getOrCompute(ModelKey.of(twoTriples(), c.name(), new CentroidParams(2)),
                    ClusterAssignment.class, () -> fail("recomputed a cached fit"));

            assertSame(a, b);
            assertEquals(1, cache.invalidateMatrix(m.fingerprint()));
        }

        @Test
        void reloadedModelsBehaveIdentically(@TempDir Path tmp) throws IOException {
            FeatureMatrix train = random(30, 30, 3);
            FeatureMatrix unseen = random(31, 20, 3);
            ModelStore store = new ModelStore();

            CentroidModel centroid = new CentroidClusterer(5L, 300, 3, false).fitModel(train, 3);
            store.save(centroid, tmp.resolve("c.json"));
            CentroidModel centroidBack = store.loadCentroidModel(tmp.resolve("c.json"));

            DensityModel density = new DensityClusterer().fitModel(train, new DensityParams(0.9, 3));
            store.save(density, tmp.resolve("d.json"));
            DensityModel densityBack = store.loadDensityModel(tmp.resolve("d.json"));

            for (FeatureVector v : unseen.rows()) {
                assertEquals(centroid.predict(v), centroidBack.predict(v));
                assertEquals(density.predict(v), densityBack.predict(v));
            }

            HierarchicalClusterer h = new HierarchicalClusterer();
            MergeTree tree = h.buildTree(train);
            store.save(tree, tmp.resolve("t.json"));
            MergeTree treeBack = store.loadMergeTree(tmp.resolve("t.json"));
            for (int k = 1; k <= train.size(); k++) {
                assertEquals(h.cut(tree, k), h.cut(treeBack, k));
            }
        }

        @Test
        void fatalErrorsNameTheParameter() {
            FeatureMatrix m = twoTriples();

            assertEquals("k", assertThrows(ConfigurationException.class,
                    () -> new CentroidClusterer(1L, 300, 1, false).fit(m, 7)).parameter());
            assertEquals("eps", assertThrows(ConfigurationException.class,
                    () -> new DensityParams(0.0, 3)).parameter());
            assertEquals("min_samples", assertThrows(ConfigurationException.class,
                    () -> new DensityParams(1.0, 0)).parameter());
            assertEquals("linkage_cut_k", assertThrows(ConfigurationException.class,
                    () -> new HierarchicalClusterer().fit(m, new HierarchicalParams(0))).parameter());
            assertThrows(DataShapeException.class, () -> FeatureMatrix.fromRows(new double[][]{{1, 2}, {3}}));
        }
    }
}
