package org.aid.priority;

import org.aid.error.DataShapeException;
import org.aid.model.ClusterAssignment;
import org.aid.model.ClusterProfile;
import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Turns cluster labels into an ordered aid-priority list.
 *
 * Record score = standardized vector . weights. The list is sorted by
 * descending score with identifier ascending as tie-break, so it is a total
 * order. Noise records keep their score and position but get
 * {@link PriorityTier#REVIEW} instead of an automatic tier.
 */
public final class PriorityRanker {

    private static final Logger log = LoggerFactory.getLogger(PriorityRanker.class);

    private static final Comparator<PriorityEntry> ORDER =
            Comparator.comparingDouble(PriorityEntry::score).reversed()
                    .thenComparing(PriorityEntry::id);

    private final VulnerabilityWeights weights;
    private final TierThresholds thresholds;

    public PriorityRanker(VulnerabilityWeights weights, TierThresholds thresholds) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    public List<PriorityEntry> rank(ClusterAssignment assignment,
                                    FeatureMatrix matrix,
                                    Map<Integer, ClusterProfile> profiles) {
        Objects.requireNonNull(assignment, "assignment must not be null");
        Objects.requireNonNull(matrix, "matrix must not be null");
        Objects.requireNonNull(profiles, "profiles must not be null");
        assignment.requireAlignedWith(matrix);
        requireMatchingProfiles(assignment, profiles);

        FeatureVector w = weights.alignTo(matrix.featureNames());

        List<PriorityEntry> entries = new ArrayList<>(matrix.size());
        int review = 0;
        for (int i = 0; i < matrix.size(); i++) {
            int label = assignment.label(i);
            double score = matrix.row(i).dot(w);
            if (label == ClusterAssignment.NOISE) {
                entries.add(new PriorityEntry(matrix.id(i), label, score, Double.NaN, PriorityTier.REVIEW));
                review++;
            } else {
                double clusterScore = profiles.get(label).means().dot(w);
                entries.add(new PriorityEntry(matrix.id(i), label, score, clusterScore, thresholds.tierOf(score)));
            }
        }
        entries.sort(ORDER);

        log.info("Ranked {} records from {} assignment ({} flagged for review)",
                entries.size(), assignment.algorithm(), review);
        return List.copyOf(entries);
    }

    /**
     * Clusters by descending score of their mean profile, ties by cluster id.
     * The noise group is left out.
     */
    public List<ClusterPriority> rankClusters(Map<Integer, ClusterProfile> profiles) {
        Objects.requireNonNull(profiles, "profiles must not be null");
        List<ClusterPriority> out = new ArrayList<>();
        for (ClusterProfile p : profiles.values()) {
            if (p.isNoise()) continue;
            double score = p.means().dot(weights.alignTo(p.featureNames()));
            out.add(new ClusterPriority(p.clusterId(), score, p.size(), thresholds.tierOf(score)));
        }
        out.sort(Comparator.comparingDouble(ClusterPriority::score).reversed()
                .thenComparingInt(ClusterPriority::clusterId));
        return List.copyOf(out);
    }

    /**
     * @return the cluster with the highest profile score, if any non-noise cluster exists
     */
    public OptionalInt mostVulnerable(Map<Integer, ClusterProfile> profiles) {
        List<ClusterPriority> ranked = rankClusters(profiles);
        return ranked.isEmpty() ? OptionalInt.empty() : OptionalInt.of(ranked.get(0).clusterId());
    }

    /**
     * @return the non-noise cluster with the highest mean of {@code feature};
     *         ties go to the lower cluster id
     */
    public OptionalInt highestMean(Map<Integer, ClusterProfile> profiles, String feature) {
        Objects.requireNonNull(profiles, "profiles must not be null");
        Objects.requireNonNull(feature, "feature must not be null");
        int best = 0;
        double bestMean = Double.NEGATIVE_INFINITY;
        boolean found = false;
        for (ClusterProfile p : new TreeMap<>(profiles).values()) {
            if (p.isNoise()) continue;
            double mean = p.mean(feature);
            if (!found || mean > bestMean) {
                best = p.clusterId();
                bestMean = mean;
                found = true;
            }
        }
        return found ? OptionalInt.of(best) : OptionalInt.empty();
    }

    private static void requireMatchingProfiles(ClusterAssignment assignment, Map<Integer, ClusterProfile> profiles) {
        for (int id : assignment.clusterIds()) {
            ClusterProfile p = profiles.get(id);
            if (p == null) {
                throw new DataShapeException("No profile for cluster " + id + " of " + assignment.algorithm());
            }
            int members = assignment.memberIndexes(id).size();
            if (p.size() != members) {
                throw new DataShapeException(
                        "Profile of cluster " + id + " has " + p.size() + " members, assignment has " + members);
            }
        }
    }
}
