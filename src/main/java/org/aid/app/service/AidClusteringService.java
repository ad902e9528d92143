package org.aid.app.service;

import org.aid.app.api.AidClusteringUseCases;
import org.aid.app.api.dto.AnalysisReport;
import org.aid.app.api.dto.PreparedData;
import org.aid.cache.ModelCache;
import org.aid.cache.ModelKey;
import org.aid.cluster.CentroidClusterer;
import org.aid.cluster.CentroidModel;
import org.aid.cluster.DensityClusterer;
import org.aid.cluster.DensityModel;
import org.aid.cluster.DensityParams;
import org.aid.cluster.HierarchicalClusterer;
import org.aid.cluster.KSearchResult;
import org.aid.cluster.MergeTree;
import org.aid.config.ClusteringConfig;
import org.aid.evaluation.AgreementReport;
import org.aid.evaluation.ClusterEvaluator;
import org.aid.evaluation.ClusterSummary;
import org.aid.evaluation.Projection;
import org.aid.model.ClusterAssignment;
import org.aid.model.ClusterProfile;
import org.aid.model.FeatureEngineering;
import org.aid.model.FeatureMatrix;
import org.aid.model.IndicatorRecord;
import org.aid.model.ScalerState;
import org.aid.model.Standardizer;
import org.aid.priority.ClusterPriority;
import org.aid.priority.PriorityEntry;
import org.aid.priority.PriorityRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeSet;

/** Default application service behind AidClusteringUseCases. */
public final class AidClusteringService implements AidClusteringUseCases {

    private static final Logger log = LoggerFactory.getLogger(AidClusteringService.class);

    private final ClusteringConfig config;
    private final ModelCache cache;

    private final CentroidClusterer centroidClusterer;
    private final HierarchicalClusterer hierarchicalClusterer = new HierarchicalClusterer();
    private final DensityClusterer densityClusterer = new DensityClusterer();
    private final ClusterEvaluator evaluator;
    private final PriorityRanker ranker;
    private final Standardizer standardizer = new Standardizer();

    public AidClusteringService(ClusteringConfig config) {
        this(config, new ModelCache());
    }

    public AidClusteringService(ClusteringConfig config, ModelCache cache) {
        this.config = Objects.requireNonNull(config, "config must not be null").validate();
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.centroidClusterer = new CentroidClusterer(
                config.randomSeed(), config.maxIterations(), config.nInit(), config.parallel());
        this.evaluator = new ClusterEvaluator(config.agreementThreshold());
        this.ranker = new PriorityRanker(config.weights(), config.tierThresholds());
    }

    public ClusteringConfig config() {
        return config;
    }

    /**
     * Clustering feature columns: the configured ones, then the derived ones when enabled.
     */
    public List<String> featureNames() {
        List<String> features = new ArrayList<>(config.features());
        if (config.engineeredFeatures()) {
            features.add(FeatureEngineering.HIGH_CHILD_MORTALITY);
            features.add(FeatureEngineering.EXPORTS_IMPORTS_RATIO);
        }
        return List.copyOf(features);
    }

    /**
     * Winsorizes the configured outlier columns, appends derived indicators when
     * enabled, then fits the scaler on the result.
     */
    @Override
    public PreparedData prepare(List<IndicatorRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        List<IndicatorRecord> clipped = FeatureEngineering.winsorized(
                records, config.outlierColumns(), config.iqrMultiplier());
        List<IndicatorRecord> input = config.engineeredFeatures() ? FeatureEngineering.standardSet(clipped) : clipped;
        ScalerState scaler = standardizer.fit(input, featureNames());
        return new PreparedData(scaler, scaler.transform(input));
    }

    @Override
    public KSearchResult searchK(FeatureMatrix matrix) {
        ModelKey key = ModelKey.of(matrix, "kmeans-search", centroidSettings("k=" + config.kMin() + ".." + config.kMax()));
        return cache.getOrCompute(key, KSearchResult.class,
                () -> centroidClusterer.searchK(matrix, config.kMin(), config.kMax()));
    }

    @Override
    public ClusterAssignment fitCentroid(FeatureMatrix matrix, int k) {
        ModelKey key = ModelKey.of(matrix, centroidClusterer.name(), centroidSettings("k=" + k));
        return cache.getOrCompute(key, ClusterAssignment.class, () -> centroidClusterer.fit(matrix, k));
    }

    @Override
    public CentroidModel centroidModel(FeatureMatrix matrix, int k) {
        ModelKey key = ModelKey.of(matrix, centroidClusterer.name() + "-model", centroidSettings("k=" + k));
        return cache.getOrCompute(key, CentroidModel.class, () -> centroidClusterer.fitModel(matrix, k));
    }

    @Override
    public MergeTree buildTree(FeatureMatrix matrix) {
        ModelKey key = ModelKey.of(matrix, hierarchicalClusterer.name(), "ward");
        return cache.getOrCompute(key, MergeTree.class, () -> hierarchicalClusterer.buildTree(matrix));
    }

    @Override
    public ClusterAssignment cutTree(MergeTree tree, int k) {
        return hierarchicalClusterer.cut(tree, k);
    }

    @Override
    public ClusterAssignment fitDensity(FeatureMatrix matrix) {
        DensityParams params = config.densityParams();
        ModelKey key = ModelKey.of(matrix, densityClusterer.name(), params);
        return cache.getOrCompute(key, ClusterAssignment.class, () -> densityClusterer.fit(matrix, params));
    }

    @Override
    public DensityModel densityModel(FeatureMatrix matrix) {
        DensityParams params = config.densityParams();
        ModelKey key = ModelKey.of(matrix, densityClusterer.name() + "-model", params);
        return cache.getOrCompute(key, DensityModel.class, () -> densityClusterer.fitModel(matrix, params));
    }

    @Override
    public Projection project(FeatureMatrix matrix) {
        return evaluator.project(matrix, config.pcaComponents());
    }

    @Override
    public SortedMap<Integer, ClusterProfile> profile(ClusterAssignment assignment, FeatureMatrix matrix) {
        return evaluator.profile(assignment, matrix);
    }

    @Override
    public AgreementReport agreement(ClusterAssignment a, ClusterAssignment b) {
        return evaluator.checkConsistency(a, b);
    }

    @Override
    public List<PriorityEntry> rank(ClusterAssignment assignment, FeatureMatrix matrix) {
        return ranker.rank(assignment, matrix, evaluator.profile(assignment, matrix));
    }

    @Override
    public AnalysisReport analyze(FeatureMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        log.info("Analyzing {} ({})", matrix, matrix.fingerprint());

        KSearchResult search = searchK(matrix);
        int k = chooseK(search);

        ClusterAssignment centroid = fitCentroid(matrix, k);
        ClusterAssignment hierarchical = cutTree(buildTree(matrix), config.linkageCutK());
        ClusterAssignment density = fitDensity(matrix);

        AgreementReport hierarchicalCheck = evaluator.checkConsistency(centroid, hierarchical);
        AgreementReport densityCheck = evaluator.checkConsistency(centroid, density);

        SortedMap<Integer, ClusterProfile> profiles = evaluator.profile(centroid, matrix);
        List<PriorityEntry> priority = ranker.rank(centroid, matrix, profiles);
        List<ClusterPriority> clusterRanking = ranker.rankClusters(profiles);
        List<String> focus = focusIds(centroid, profiles, hierarchical, evaluator.profile(hierarchical, matrix));

        Projection projection = evaluator.project(matrix, Math.min(config.pcaComponents(), matrix.dim()));
        List<ClusterSummary> summaries = List.of(
                evaluator.summarize(centroid),
                evaluator.summarize(hierarchical),
                evaluator.summarize(density));

        log.info("Analysis done: k={}, {} priority records in focus, density noise={}",
                k, focus.size(), density.noiseCount());
        return new AnalysisReport(search, k, centroid, hierarchical, density, hierarchicalCheck, densityCheck,
                profiles, priority, clusterRanking, focus, projection, summaries);
    }

    @Override
    public void invalidate(FeatureMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        cache.invalidateMatrix(matrix.fingerprint());
    }

    private int chooseK(KSearchResult search) {
        if (config.fixedK().isPresent()) {
            int k = config.fixedK().get();
            log.info("Using configured k={} (search suggested {})", k,
                    search.bestK().isPresent() ? search.bestK().getAsInt() : "none");
            return k;
        }
        OptionalInt best = search.bestK();
        if (best.isPresent()) {
            return best.getAsInt();
        }
        log.warn("No k in [{}, {}] has a defined silhouette; falling back to k_min", config.kMin(), config.kMax());
        return config.kMin();
    }

    /**
     * Records in the most vulnerable cluster of either partitioning method.
     * With a focus indicator that is the cluster with the highest mean of it,
     * otherwise the cluster with the highest weighted profile score.
     */
    private List<String> focusIds(ClusterAssignment centroid,
                                  SortedMap<Integer, ClusterProfile> centroidProfiles,
                                  ClusterAssignment hierarchical,
                                  SortedMap<Integer, ClusterProfile> hierarchicalProfiles) {
        TreeSet<String> ids = new TreeSet<>();
        OptionalInt c = mostVulnerable(centroidProfiles);
        if (c.isPresent()) {
            ids.addAll(centroidProfiles.get(c.getAsInt()).memberIds());
        }
        OptionalInt h = mostVulnerable(hierarchicalProfiles);
        if (h.isPresent()) {
            ids.addAll(hierarchicalProfiles.get(h.getAsInt()).memberIds());
        }
        log.debug("Most vulnerable clusters: {}={}, {}={}", centroid.algorithm(), c, hierarchical.algorithm(), h);
        return List.copyOf(ids);
    }

    private OptionalInt mostVulnerable(SortedMap<Integer, ClusterProfile> profiles) {
        return config.focusFeature()
                .map(feature -> ranker.highestMean(profiles, feature))
                .orElseGet(() -> ranker.mostVulnerable(profiles));
    }

    private String centroidSettings(String k) {
        return k + ",seed=" + config.randomSeed() + ",n_init=" + config.nInit() + ",max_iter=" + config.maxIterations();
    }
}
