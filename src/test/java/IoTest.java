import org.aid.cluster.CentroidClusterer;
import org.aid.cluster.CentroidModel;
import org.aid.cluster.DensityClusterer;
import org.aid.cluster.DensityModel;
import org.aid.cluster.DensityParams;
import org.aid.cluster.HierarchicalClusterer;
import org.aid.cluster.MergeTree;
import org.aid.error.DataShapeException;
import org.aid.io.ResultWriter;
import org.aid.io.csv.IndicatorCsvReader;
import org.aid.io.json.JsonFeatureSource;
import org.aid.io.json.JsonFormat;
import org.aid.io.json.ModelStore;
import org.aid.model.ClusterAssignment;
import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;
import org.aid.model.IndicatorRecord;
import org.aid.model.ScalerState;
import org.aid.model.Standardizer;
import org.aid.priority.PriorityEntry;
import org.aid.priority.PriorityTier;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A single test file that covers:
 * - JsonFormat
 * - JsonFeatureSource (parsing, validation, caching, dimension)
 * - IndicatorCsvReader
 * - ResultWriter (CSV and JSON tables)
 * - ModelStore (save / load of fitted models)
 */
public class IoTest {

    private static final JsonFormat FORMAT = new JsonFormat("country", "features");
    private static final List<String> TWO = List.of("child_mort", "income");

    private static JsonFeatureSource source(String json, AtomicInteger opens) {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        return new JsonFeatureSource("memory", () -> {
            opens.incrementAndGet();
            return new ByteArrayInputStream(bytes);
        }, FORMAT, TWO);
    }

    private static JsonFeatureSource source(String json) {
        return source(json, new AtomicInteger());
    }

    // ----------------------------
    // JsonFormat tests
    // ----------------------------
    @Nested
    class JsonFormatTests {

        @Test
        void blankFieldNamesAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> new JsonFormat(" ", "features"));
            assertThrows(IllegalArgumentException.class, () -> new JsonFormat("country", null));
        }
    }

    // ----------------------------
    // JsonFeatureSource tests
    // ----------------------------
    @Nested
    class JsonFeatureSourceTests {

        @Test
        void parsesRecordsInOrderAndSkipsUnknownFields() {
            JsonFeatureSource src = source("""
                    [
                      {"country": "Chad", "region": {"name": "Africa"}, "features": [2.1, -1.3]},
                      {"country": "Japan", "features": [-1.0, 2]}
                    ]
                    """);

            FeatureMatrix m = src.load();

            assertEquals(List.of("Chad", "Japan"), m.ids());
            assertEquals(TWO, m.featureNames());
            assertEquals(new FeatureVector(new double[]{2.1, -1.3}), m.row(0));
            assertEquals(2.0, m.require("Japan").get(1));
            assertEquals("memory", src.name());
        }

        @Test
        void loadsOnceAndCaches() {
            AtomicInteger opens = new AtomicInteger();
            JsonFeatureSource src = source("[{\"country\": \"A\", \"features\": [1, 2]}]", opens);

            assertEquals(OptionalInt.empty(), src.dimension());
            FeatureMatrix first = src.load();
            FeatureMatrix second = src.load();

            assertSame(first, second);
            assertEquals(1, opens.get());
            assertEquals(OptionalInt.of(2), src.dimension());
        }

        @Test
        void malformedInputIsADataShapeError() {
            assertThrows(DataShapeException.class, () -> source("{\"country\": \"A\"}").load());
            assertThrows(DataShapeException.class, () -> source("[1, 2]").load());
            assertThrows(DataShapeException.class, () -> source("[]").load());
            assertThrows(DataShapeException.class, () -> source("[{\"features\": [1, 2]}]").load());
            assertThrows(DataShapeException.class, () -> source("[{\"country\": \"A\"}]").load());
            assertThrows(DataShapeException.class, () -> source("[{\"country\": \"A\", \"features\": []}]").load());
            assertThrows(DataShapeException.class,
                    () -> source("[{\"country\": \"A\", \"features\": [1, \"x\"]}]").load());
        }

        @Test
        void shapeRulesOfTheMatrixApply() {
            assertThrows(DataShapeException.class, () -> source(
                    "[{\"country\": \"A\", \"features\": [1, 2, 3]}]").load());
            assertThrows(DataShapeException.class, () -> source(
                    "[{\"country\": \"A\", \"features\": [1, 2]}, {\"country\": \"A\", \"features\": [3, 4]}]").load());
        }

        @Test
        void readFailureIsUnchecked() {
            JsonFeatureSource src = new JsonFeatureSource("broken", () -> {
                throw new IOException("disk gone");
            }, FORMAT, TWO);

            UncheckedIOException ex = assertThrows(UncheckedIOException.class, src::load);
            assertEquals("disk gone", ex.getCause().getMessage());
        }

        @Test
        void readsFromFile(@TempDir Path tmp) throws IOException {
            Path f = tmp.resolve("features.json");
            Files.writeString(f, "[{\"country\": \"A\", \"features\": [1, 2]}]", StandardCharsets.UTF_8);

            FeatureMatrix m = JsonFeatureSource.ofFile(f, FORMAT, TWO).load();
            assertEquals(1, m.size());
        }
    }

    // ----------------------------
    // IndicatorCsvReader tests
    // ----------------------------
    @Nested
    class CsvReaderTests {

        private final IndicatorCsvReader reader = new IndicatorCsvReader("country");

        @Test
        void readsNumericColumnsByHeader() throws IOException {
            List<IndicatorRecord> rows = reader.read(new StringReader("""
                    country,child_mort,income
                    Chad,150.0,1930
                    Japan, 3.2 ,35800
                    """));

            assertEquals(2, rows.size());
            assertEquals("Chad", rows.get(0).id());
            assertEquals(150.0, rows.get(0).require("child_mort"));
            assertEquals(3.2, rows.get(1).require("child_mort"));
            assertEquals(35800.0, rows.get(1).require("income"));
        }

        @Test
        void badCellsAreRejected() {
            assertThrows(DataShapeException.class, () -> reader.read(new StringReader("""
                    country,child_mort
                    Chad,
                    """)));
            DataShapeException ex = assertThrows(DataShapeException.class, () -> reader.read(new StringReader("""
                    country,child_mort
                    Chad,high
                    """)));
            assertInstanceOf(NumberFormatException.class, ex.getCause());
            assertThrows(DataShapeException.class, () -> reader.read(new StringReader("""
                    name,child_mort
                    Chad,1
                    """)));
        }

        @Test
        void headerOnlyIsRejected() {
            assertThrows(DataShapeException.class, () -> reader.read(new StringReader("country,child_mort\n")));
        }

        @Test
        void rowsFeedTheStandardizer(@TempDir Path tmp) throws IOException {
            Path f = tmp.resolve("data.csv");
            Files.writeString(f, "country,child_mort,income\nA,10,100\nB,20,300\n", StandardCharsets.UTF_8);

            FeatureMatrix m = new Standardizer().fitTransform(reader.read(f), TWO);
            assertEquals(new FeatureVector(new double[]{-1.0, -1.0}), m.row(0));
            assertEquals(new FeatureVector(new double[]{1.0, 1.0}), m.row(1));
        }
    }

    // ----------------------------
    // ResultWriter tests
    // ----------------------------
    @Nested
    class ResultWriterTests {

        @TempDir
        Path tmp;

        private final ResultWriter writer = new ResultWriter();

        @Test
        void assignmentsAsCsvWithOneColumnPerAlgorithm() throws IOException {
            List<String> ids = List.of("A", "B");
            Path f = tmp.resolve("out/clustering_results.csv");

            writer.writeAssignments(List.of(
                    new ClusterAssignment("kmeans", ids, new int[]{0, 1}),
                    new ClusterAssignment("dbscan", ids, new int[]{-1, 0})), f);

            List<String> lines = Files.readAllLines(f, StandardCharsets.UTF_8);
            assertEquals("id,kmeans,dbscan", lines.get(0));
            assertEquals("A,0,-1", lines.get(1));
            assertEquals("B,1,0", lines.get(2));
        }

        @Test
        void assignmentsOverDifferentRecordsAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> writer.writeAssignments(List.of(
                    new ClusterAssignment("kmeans", List.of("A"), new int[]{0}),
                    new ClusterAssignment("dbscan", List.of("B"), new int[]{0})), tmp.resolve("x.csv")));
        }

        @Test
        void priorityAsJsonLeavesNoiseClusterScoreNull() throws IOException {
            Path f = tmp.resolve("priority_list.json");
            writer.writePriority(List.of(
                    new PriorityEntry("A", 0, 2.0, 1.5, PriorityTier.HIGH),
                    new PriorityEntry("B", -1, 0.1, Double.NaN, PriorityTier.REVIEW)), f);

            String json = Files.readString(f, StandardCharsets.UTF_8);
            assertTrue(json.contains("\"rank\" : 1"));
            assertTrue(json.contains("\"cluster_score\" : null"));
            assertTrue(json.contains("\"tier\" : \"REVIEW\""));
        }
    }

    // ----------------------------
    // ModelStore tests
    // ----------------------------
    @Nested
    class ModelStoreTests {

        @TempDir
        Path tmp;

        private final ModelStore store = new ModelStore();

        private final FeatureMatrix m = FeatureMatrix.fromRows(new double[][]{
                {0.0, 0.0}, {0.2, 0.1}, {0.1, 0.3}, {5.0, 5.0}, {5.2, 4.9}, {4.9, 5.1}, {20, 20}});

        @Test
        void centroidModelPredictsTheSameAfterReload() throws IOException {
            CentroidModel model = new CentroidClusterer(42L, 300, 4, false).fitModel(m, 2);
            Path f = tmp.resolve("models/kmeans_model.json");

            store.save(model, f);
            CentroidModel back = store.loadCentroidModel(f);

            assertEquals(model.featureNames(), back.featureNames());
            assertEquals(model.seed(), back.seed());
            for (int i = 0; i < m.size(); i++) {
                assertEquals(model.predict(m.row(i)), back.predict(m.row(i)));
            }
            assertArrayEquals(model.centroids(), back.centroids());
            assertEquals(model, back);
            assertEquals(model.hashCode(), back.hashCode());
        }

        @Test
        void mergeTreeCutsTheSameAfterReload() throws IOException {
            HierarchicalClusterer h = new HierarchicalClusterer();
            MergeTree tree = h.buildTree(m);
            Path f = tmp.resolve("hierarchical_tree.json");

            store.save(tree, f);
            MergeTree back = store.loadMergeTree(f);

            assertEquals(tree, back);
            assertArrayEquals(h.cut(tree, 3).labelsCopy(), h.cut(back, 3).labelsCopy());
        }

        @Test
        void densityModelPredictsTheSameAfterReload() throws IOException {
            DensityModel model = new DensityClusterer().fitModel(m, new DensityParams(0.5, 2));
            Path f = tmp.resolve("dbscan_model.json");

            store.save(model, f);
            DensityModel back = store.loadDensityModel(f);

            assertEquals(model.params(), back.params());
            FeatureVector near = new FeatureVector(new double[]{5.1, 5.0});
            FeatureVector far = new FeatureVector(new double[]{-9, -9});
            assertEquals(model.predict(near), back.predict(near));
            assertEquals(ClusterAssignment.NOISE, back.predict(far));
            assertEquals(model, back);
            assertEquals(model.hashCode(), back.hashCode());
        }

        @Test
        void scalerTransformsTheSameAfterReload() throws IOException {
            ScalerState scaler = new Standardizer().fit(List.of(
                    new IndicatorRecord("A", Map.of("x", 1.0)),
                    new IndicatorRecord("B", Map.of("x", 3.0))), List.of("x"));
            Path f = tmp.resolve("scaler.json");

            store.save(scaler, f);
            ScalerState back = store.loadScaler(f);

            assertEquals(scaler.transform(new double[]{2.5}), back.transform(new double[]{2.5}));
            assertEquals(scaler, back);
            assertEquals(scaler.hashCode(), back.hashCode());
            assertNotEquals(scaler, new ScalerState(List.of("x"), new double[]{2.0}, new double[]{2.0}));
        }

        @Test
        void missingFileIsAnIoError() {
            assertThrows(IOException.class, () -> store.loadCentroidModel(tmp.resolve("nope.json")));
        }
    }
}
