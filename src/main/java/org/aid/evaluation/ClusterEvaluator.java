package org.aid.evaluation;

import org.aid.error.ConfigurationException;
import org.aid.model.ClusterAssignment;
import org.aid.model.ClusterProfile;
import org.aid.model.FeatureMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Validation side of the pipeline: projection for visual checks, per-cluster
 * profiles, and the cross-method agreement check. Works on any
 * {@link ClusterAssignment}, whichever clusterer produced it.
 */
public final class ClusterEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ClusterEvaluator.class);

    private final double agreementThreshold;
    private final ClusterProfiler profiler = new ClusterProfiler();

    /**
     * @param agreementThreshold adjusted Rand index below which two assignments
     *                           are reported as inconsistent, in [-1, 1]
     */
    public ClusterEvaluator(double agreementThreshold) {
        if (Double.isNaN(agreementThreshold) || agreementThreshold < -1.0 || agreementThreshold > 1.0) {
            throw ConfigurationException.of("agreement_threshold", agreementThreshold, "must be in [-1, 1]");
        }
        this.agreementThreshold = agreementThreshold;
    }

    public Projection project(FeatureMatrix matrix, int dims) {
        return PrincipalComponents.fit(matrix, dims).project(matrix);
    }

    public SortedMap<Integer, ClusterProfile> profile(ClusterAssignment assignment, FeatureMatrix matrix) {
        return profiler.profile(assignment, matrix);
    }

    public double agreement(ClusterAssignment a, ClusterAssignment b) {
        return AgreementScore.adjustedRand(a, b);
    }

    /**
     * Scores two assignments against the threshold. An inconsistent pair is
     * logged and reported, never dropped.
     */
    public AgreementReport checkConsistency(ClusterAssignment a, ClusterAssignment b) {
        double score = agreement(a, b);
        boolean consistent = score >= agreementThreshold;
        if (consistent) {
            log.info("{} vs {} agreement {} (threshold {})", a.algorithm(), b.algorithm(),
                    String.format("%.4f", score), agreementThreshold);
        } else {
            log.warn("{} vs {} agreement {} is below {}; the chosen k may be unstable",
                    a.algorithm(), b.algorithm(), String.format("%.4f", score), agreementThreshold);
        }
        return new AgreementReport(a.algorithm(), b.algorithm(), score, agreementThreshold, consistent);
    }

    public ClusterSummary summarize(ClusterAssignment assignment) {
        Objects.requireNonNull(assignment, "assignment must not be null");
        Map<Integer, List<String>> members = new LinkedHashMap<>();
        if (assignment.noiseCount() > 0) {
            members.put(ClusterAssignment.NOISE, idsOf(assignment, ClusterAssignment.NOISE));
        }
        for (int id : assignment.clusterIds()) {
            members.put(id, idsOf(assignment, id));
        }
        return new ClusterSummary(assignment.algorithm(), assignment.clusterCount(), assignment.noiseCount(), members);
    }

    public double agreementThreshold() {
        return agreementThreshold;
    }

    private static List<String> idsOf(ClusterAssignment assignment, int label) {
        return assignment.memberIndexes(label).stream().map(assignment::id).toList();
    }
}
