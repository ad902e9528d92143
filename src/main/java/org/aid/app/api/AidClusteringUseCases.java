package org.aid.app.api;

import org.aid.app.api.dto.AnalysisReport;
import org.aid.app.api.dto.PreparedData;
import org.aid.cluster.CentroidModel;
import org.aid.cluster.DensityModel;
import org.aid.cluster.KSearchResult;
import org.aid.cluster.MergeTree;
import org.aid.evaluation.AgreementReport;
import org.aid.evaluation.Projection;
import org.aid.model.ClusterAssignment;
import org.aid.model.ClusterProfile;
import org.aid.model.FeatureMatrix;
import org.aid.model.IndicatorRecord;
import org.aid.priority.PriorityEntry;

import java.util.List;
import java.util.SortedMap;

/**
 * Application boundary of the clustering engine, consumed by the command-line
 * runner and by tests. Parameters not passed explicitly come from the
 * configuration the implementation was built with.
 */
public interface AidClusteringUseCases {

    /**
     * Standardizes raw records over the configured features (plus the derived
     * ones when enabled).
     */
    PreparedData prepare(List<IndicatorRecord> records);

    KSearchResult searchK(FeatureMatrix matrix);

    ClusterAssignment fitCentroid(FeatureMatrix matrix, int k);

    CentroidModel centroidModel(FeatureMatrix matrix, int k);

    MergeTree buildTree(FeatureMatrix matrix);

    ClusterAssignment cutTree(MergeTree tree, int k);

    ClusterAssignment fitDensity(FeatureMatrix matrix);

    DensityModel densityModel(FeatureMatrix matrix);

    Projection project(FeatureMatrix matrix);

    SortedMap<Integer, ClusterProfile> profile(ClusterAssignment assignment, FeatureMatrix matrix);

    AgreementReport agreement(ClusterAssignment a, ClusterAssignment b);

    List<PriorityEntry> rank(ClusterAssignment assignment, FeatureMatrix matrix);

    /**
     * Full pipeline: k search, the three clusterings, agreement checks,
     * profiles, priority list and projection.
     */
    AnalysisReport analyze(FeatureMatrix matrix);

    /**
     * Forgets every cached fit of this matrix.
     */
    void invalidate(FeatureMatrix matrix);
}
