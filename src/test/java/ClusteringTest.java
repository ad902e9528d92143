import org.aid.cluster.CentroidClusterer;
import org.aid.cluster.CentroidModel;
import org.aid.cluster.CentroidParams;
import org.aid.cluster.DensityClusterer;
import org.aid.cluster.DensityModel;
import org.aid.cluster.DensityParams;
import org.aid.cluster.HierarchicalClusterer;
import org.aid.cluster.HierarchicalParams;
import org.aid.cluster.KScore;
import org.aid.cluster.KSearchResult;
import org.aid.cluster.Merge;
import org.aid.cluster.MergeTree;
import org.aid.error.ConfigurationException;
import org.aid.metrics.EuclideanDistance;
import org.aid.metrics.RadiusNeighbors;
import org.aid.model.ClusterAssignment;
import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the three clusterers and their fitted models.
 */
public class ClusteringTest {

    private static final double[][] TWO_TRIPLES = {
            {0, 0}, {0, 1}, {1, 0},
            {10, 10}, {10, 11}, {11, 10}
    };

    private static FeatureVector v(double... xs) {
        return new FeatureVector(xs);
    }

    private static FeatureMatrix randomMatrix(long seed, int n, int dim) {
        Random rand = new Random(seed);
        double[][] rows = new double[n][dim];
        for (double[] r : rows) {
            for (int j = 0; j < dim; j++) r[j] = rand.nextGaussian() * 2.0;
        }
        return FeatureMatrix.fromRows(rows);
    }

    private static CentroidClusterer kmeans() {
        return new CentroidClusterer(42L, 300, 10, false);
    }

    @Nested
    @DisplayName("CentroidClusterer")
    class CentroidTests {

        @Test
        void separatesTwoTriples() {
            ClusterAssignment a = kmeans().fit(FeatureMatrix.fromRows(TWO_TRIPLES), new CentroidParams(2));

            assertEquals("kmeans", a.algorithm());
            assertEquals(a.label(0), a.label(1));
            assertEquals(a.label(0), a.label(2));
            assertEquals(a.label(3), a.label(4));
            assertEquals(a.label(3), a.label(5));
            assertNotEquals(a.label(0), a.label(3));
            assertTrue(a.convergenceWarning().isEmpty());
        }

        @Test
        void clusterZeroIsTheLargest() {
            FeatureMatrix m = FeatureMatrix.fromRows(new double[][]{
                    {10, 10}, {10, 11},
                    {0, 0}, {0, 1}, {1, 0}, {1, 1}});
            ClusterAssignment a = kmeans().fit(m, 2);
            assertEquals(0, a.label(2));
            assertEquals(1, a.label(0));
        }

        @Test
        void sameSeedGivesSameResult() {
            FeatureMatrix m = randomMatrix(11, 40, 3);
            assertEquals(kmeans().fit(m, 4), kmeans().fit(m, 4));

            CentroidModel first = kmeans().fitModel(m, 4);
            CentroidModel second = kmeans().fitModel(m, 4);
            assertArrayEquals(first.centroids(), second.centroids());
            assertEquals(first.inertia(), second.inertia());
        }

        @Test
        void fitAndModelAgree() {
            FeatureMatrix m = randomMatrix(5, 30, 2);
            ClusterAssignment a = kmeans().fit(m, 3);
            CentroidModel model = kmeans().fitModel(m, 3);
            for (int i = 0; i < m.size(); i++) {
                assertEquals(a.label(i), model.predict(m.row(i)));
            }
            assertEquals(3, model.k());
            assertEquals(List.of("f0", "f1"), model.featureNames());
        }

        @Test
        void kAboveRecordCountIsRejected() {
            FeatureMatrix m = FeatureMatrix.fromRows(new double[][]{{0}, {1}, {2}});
            ConfigurationException ex = assertThrows(ConfigurationException.class, () -> kmeans().fit(m, 4));
            assertEquals("k", ex.parameter());
            assertThrows(ConfigurationException.class, () -> new CentroidParams(0));
        }

        @Test
        void invalidClustererSettingsAreRejected() {
            assertEquals("max_iterations",
                    assertThrows(ConfigurationException.class, () -> new CentroidClusterer(1, 0, 1, false)).parameter());
            assertEquals("n_init",
                    assertThrows(ConfigurationException.class, () -> new CentroidClusterer(1, 10, 0, false)).parameter());
        }

        @Test
        void iterationCapAttachesConvergenceWarning() {
            double[][] line = new double[300][];
            for (int i = 0; i < line.length; i++) line[i] = new double[]{i};
            CentroidClusterer capped = new CentroidClusterer(42L, 1, 1, false);
            ClusterAssignment a = capped.fit(FeatureMatrix.fromRows(line), 3);

            assertTrue(a.convergenceWarning().isPresent());
            assertEquals(3, a.convergenceWarning().get().k());
            assertEquals(1, a.convergenceWarning().get().iterations());
            assertEquals(300, a.size());
        }

        @Test
        void cappedRunLabelsMatchItsCentroids() {
            FeatureMatrix m = randomMatrix(11, 40, 2);
            CentroidClusterer capped = new CentroidClusterer(42L, 1, 1, false);
            ClusterAssignment a = capped.fit(m, 4);
            CentroidModel model = capped.fitModel(m, 4);

            double inertia = 0.0;
            for (int i = 0; i < m.size(); i++) {
                assertEquals(a.label(i), model.predict(m.row(i)), "row " + i);
                inertia += m.row(i).squaredDistanceTo(model.centroid(a.label(i)));
            }
            assertEquals(inertia, model.inertia(), 1e-9);
        }

        @Test
        void predictRejectsWrongDimension() {
            CentroidModel model = kmeans().fitModel(FeatureMatrix.fromRows(TWO_TRIPLES), 2);
            ConfigurationException ex = assertThrows(ConfigurationException.class, () -> model.predict(v(1, 2, 3)));
            assertEquals("features", ex.parameter());
        }

        @Test
        void predictUsesNearestCentroid() {
            FeatureMatrix m = FeatureMatrix.fromRows(TWO_TRIPLES);
            ClusterAssignment a = kmeans().fit(m, 2);
            CentroidModel model = kmeans().fitModel(m, 2);

            assertEquals(a.label(0), model.predict(v(0.2, 0.2)));
            assertEquals(a.label(3), model.predict(v(10.5, 10.5)));
            assertEquals(1.0 / 3.0, model.centroid(a.label(0)).get(0), 1e-12);
        }
    }

    @Nested
    @DisplayName("k search")
    class KSearchTests {

        @Test
        void inertiaNeverIncreasesWithK() {
            for (long seed = 1; seed <= 5; seed++) {
                FeatureMatrix m = randomMatrix(seed, 35, 3);
                double[] curve = new CentroidClusterer(seed, 300, 3, false).searchK(m, 1, 8).inertiaCurve();
                for (int i = 1; i < curve.length; i++) {
                    assertTrue(curve[i] <= curve[i - 1] * (1 + 1e-9) + 1e-12,
                            "seed " + seed + ": inertia rose from k=" + i + " to k=" + (i + 1));
                }
            }
        }

        @Test
        void searchScoresTheRunThatFitReturns() {
            for (long seed = 0; seed < 40; seed++) {
                Random rand = new Random(seed);
                FeatureMatrix m = randomMatrix(seed, 12 + rand.nextInt(20), 2);
                CentroidClusterer clusterer = new CentroidClusterer(42L, 300, 1, false);
                KSearchResult search = clusterer.searchK(m, 1, 8);
                for (int k = 1; k <= 8; k++) {
                    assertEquals(search.scoreFor(k).inertia(), clusterer.fitModel(m, k).inertia(), 1e-12,
                            "seed " + seed + ", k=" + k);
                }
            }
        }

        @Test
        void searchFromAboveOneMatchesSingleFits() {
            FeatureMatrix m = randomMatrix(10, 25, 2);
            CentroidClusterer clusterer = new CentroidClusterer(42L, 300, 1, true);
            KSearchResult search = clusterer.searchK(m, 3, 8);
            for (int k = 3; k <= 8; k++) {
                assertEquals(search.scoreFor(k).inertia(), clusterer.fitModel(m, k).inertia(), 1e-12, "k=" + k);
            }
        }

        @Test
        void picksTwoForTwoTriples() {
            KSearchResult r = kmeans().searchK(FeatureMatrix.fromRows(TWO_TRIPLES), 2, 5);
            assertEquals(2, r.bestK().getAsInt());
            assertEquals(List.of(2, 3, 4, 5), r.scores().stream().map(KScore::k).toList());
        }

        @Test
        void kOneHasInertiaButNoSilhouette() {
            KSearchResult r = kmeans().searchK(FeatureMatrix.fromRows(TWO_TRIPLES), 1, 3);
            KScore one = r.scoreFor(1);
            assertTrue(one.silhouetteScore().isEmpty());
            assertTrue(one.inertia() > r.scoreFor(2).inertia());
            assertThrows(IllegalArgumentException.class, () -> r.scoreFor(9));
        }

        @Test
        void parallelSearchMatchesSequential() {
            FeatureMatrix m = randomMatrix(8, 30, 2);
            KSearchResult seq = new CentroidClusterer(7, 300, 4, false).searchK(m, 2, 6);
            KSearchResult par = new CentroidClusterer(7, 300, 4, true).searchK(m, 2, 6);
            assertEquals(seq, par);
        }

        @Test
        void invalidRangesAreRejected() {
            FeatureMatrix m = FeatureMatrix.fromRows(TWO_TRIPLES);
            assertEquals("k_min",
                    assertThrows(ConfigurationException.class, () -> kmeans().searchK(m, 0, 3)).parameter());
            assertEquals("k_max",
                    assertThrows(ConfigurationException.class, () -> kmeans().searchK(m, 4, 3)).parameter());
            assertEquals("k_max",
                    assertThrows(ConfigurationException.class, () -> kmeans().searchK(m, 2, 7)).parameter());
        }
    }

    @Nested
    @DisplayName("HierarchicalClusterer")
    class HierarchicalTests {

        private final HierarchicalClusterer ward = new HierarchicalClusterer();

        @Test
        void cutIntoRecordCountGivesSingletons() {
            FeatureMatrix m = randomMatrix(4, 12, 2);
            ClusterAssignment a = ward.cut(ward.buildTree(m), 12);
            Set<Integer> labels = new HashSet<>();
            for (int i = 0; i < a.size(); i++) labels.add(a.label(i));
            assertEquals(12, labels.size());
        }

        @Test
        void cutIntoOneGivesSingleCluster() {
            FeatureMatrix m = randomMatrix(4, 12, 2);
            ClusterAssignment a = ward.cut(ward.buildTree(m), 1);
            for (int i = 0; i < a.size(); i++) assertEquals(0, a.label(i));
        }

        @Test
        void clustersNumberedByFirstAppearance() {
            ClusterAssignment a = ward.fit(FeatureMatrix.fromRows(TWO_TRIPLES), new HierarchicalParams(2));
            assertArrayEquals(new int[]{0, 0, 0, 1, 1, 1}, a.labelsCopy());
            assertEquals("hierarchical", a.algorithm());
        }

        @Test
        void equalDistancesMergeLowestPairFirst() {
            MergeTree tree = ward.buildTree(FeatureMatrix.fromRows(new double[][]{{0, 0}, {0, 1}, {1, 0}, {1, 1}}));

            assertEquals(3, tree.merges().size());
            assertEquals(new Merge(0, 0, 1, 1.0, 2), tree.merges().get(0));
            assertEquals(new Merge(1, 2, 3, 1.0, 2), tree.merges().get(1));
            Merge root = tree.merges().get(2);
            assertEquals(4, root.left());
            assertEquals(5, root.right());
            assertEquals(4, root.size());
        }

        @Test
        void mergeHeightsNeverDecrease() {
            MergeTree tree = ward.buildTree(randomMatrix(9, 25, 3));
            for (int s = 1; s < tree.merges().size(); s++) {
                assertTrue(tree.merges().get(s).height() >= tree.merges().get(s - 1).height() - 1e-12);
            }
            assertEquals(tree.merges().get(23).height(), tree.rootHeight());
        }

        @Test
        void cutOutOfRangeIsRejected() {
            MergeTree tree = ward.buildTree(FeatureMatrix.fromRows(TWO_TRIPLES));
            assertEquals("linkage_cut_k",
                    assertThrows(ConfigurationException.class, () -> ward.cut(tree, 0)).parameter());
            assertEquals("linkage_cut_k",
                    assertThrows(ConfigurationException.class, () -> ward.cut(tree, 7)).parameter());
        }

        @Test
        void singleRecordTreeHasNoMerges() {
            MergeTree tree = ward.buildTree(FeatureMatrix.fromRows(new double[][]{{1, 1}}));
            assertTrue(tree.merges().isEmpty());
            assertEquals(0, ward.cut(tree, 1).label(0));
        }
    }

    @Nested
    @DisplayName("DensityClusterer")
    class DensityTests {

        private final DensityClusterer dbscan = new DensityClusterer();

        @Test
        void outlierIsNoiseAndTripleSharesLabel() {
            FeatureMatrix m = FeatureMatrix.fromRows(new double[][]{{0, 0}, {0, 1}, {1, 0}, {10, 10}});
            ClusterAssignment a = dbscan.fit(m, new DensityParams(1.5, 3));

            assertEquals(0, a.label(0));
            assertEquals(0, a.label(1));
            assertEquals(0, a.label(2));
            assertEquals(ClusterAssignment.NOISE, a.label(3));
            assertEquals(1, a.noiseCount());
        }

        @Test
        void borderPointsJoinTheirCoreCluster() {
            FeatureMatrix m = FeatureMatrix.fromRows(new double[][]{{0}, {1}, {2}, {3.4}});
            ClusterAssignment a = dbscan.fit(m, new DensityParams(1.5, 3));
            assertArrayEquals(new int[]{0, 0, 0, 0}, a.labelsCopy());
        }

        @Test
        void clusterIdsFollowDiscoveryOrder() {
            FeatureMatrix m = FeatureMatrix.fromRows(new double[][]{
                    {50, 50}, {50, 51}, {51, 50},
                    {0, 0}, {0, 1}, {1, 0}});
            ClusterAssignment a = dbscan.fit(m, new DensityParams(1.5, 3));
            assertArrayEquals(new int[]{0, 0, 0, 1, 1, 1}, a.labelsCopy());
        }

        @Test
        void noisePointsAreNeitherCoreNorNearACore() {
            FeatureMatrix m = randomMatrix(21, 60, 2);
            DensityParams params = new DensityParams(0.8, 4);
            ClusterAssignment a = dbscan.fit(m, params);
            RadiusNeighbors index = new RadiusNeighbors(m, EuclideanDistance.INSTANCE);

            boolean[] core = new boolean[m.size()];
            for (int i = 0; i < m.size(); i++) {
                core[i] = index.withinRadius(i, params.eps()).size() >= params.minSamples();
            }
            for (int i = 0; i < m.size(); i++) {
                boolean nearCore = index.withinRadius(i, params.eps()).stream().anyMatch(nb -> core[nb.index()]);
                assertEquals(!core[i] && !nearCore, a.isNoise(i), "record " + i);
            }
        }

        @Test
        void invalidParametersAreRejected() {
            assertEquals("eps", assertThrows(ConfigurationException.class, () -> new DensityParams(0.0, 3)).parameter());
            assertEquals("eps", assertThrows(ConfigurationException.class, () -> new DensityParams(-1.0, 3)).parameter());
            assertEquals("min_samples",
                    assertThrows(ConfigurationException.class, () -> new DensityParams(1.0, 0)).parameter());
        }

        @Test
        void modelPredictsFromCorePoints() {
            FeatureMatrix m = FeatureMatrix.fromRows(new double[][]{{0, 0}, {0, 1}, {1, 0}, {10, 10}});
            DensityModel model = dbscan.fitModel(m, new DensityParams(1.5, 3));

            assertEquals(List.of("r0", "r1", "r2"), model.coreIds());
            assertEquals(0, model.predict(v(0.5, 0.5)));
            assertEquals(ClusterAssignment.NOISE, model.predict(v(5, 5)));
            assertEquals(new DensityParams(1.5, 3), model.params());
        }

        @Test
        void allNoiseModelPredictsNoise() {
            FeatureMatrix m = FeatureMatrix.fromRows(new double[][]{{0}, {10}, {20}});
            DensityModel model = dbscan.fitModel(m, new DensityParams(1.0, 2));
            assertTrue(model.coreIds().isEmpty());
            assertEquals(ClusterAssignment.NOISE, model.predict(v(0)));
        }
    }
}
