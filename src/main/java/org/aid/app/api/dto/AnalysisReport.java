package org.aid.app.api.dto;

import org.aid.cluster.KSearchResult;
import org.aid.evaluation.AgreementReport;
import org.aid.evaluation.ClusterSummary;
import org.aid.evaluation.Projection;
import org.aid.model.ClusterAssignment;
import org.aid.model.ClusterProfile;
import org.aid.priority.ClusterPriority;
import org.aid.priority.PriorityEntry;

import java.util.List;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Everything one analysis run produces.
 *
 * @param kSearch inertia and silhouette per searched k
 * @param chosenK cluster count used for the centroid fit
 * @param centroid centroid assignment with {@code chosenK} clusters
 * @param hierarchical Ward tree cut at the configured linkage k
 * @param density density assignment, noise included
 * @param centroidVsHierarchical agreement check of the two partitioning methods
 * @param centroidVsDensity agreement check against the density result
 * @param profiles per-cluster profiles of the centroid assignment
 * @param priority records ranked by vulnerability score
 * @param clusterRanking centroid clusters ranked by profile score
 * @param focusIds members of the most vulnerable centroid cluster or the most
 *                 vulnerable hierarchical cluster, sorted by id
 * @param projection low-dimensional view of the matrix
 * @param summaries one summary per assignment
 */
public record AnalysisReport(KSearchResult kSearch,
                             int chosenK,
                             ClusterAssignment centroid,
                             ClusterAssignment hierarchical,
                             ClusterAssignment density,
                             AgreementReport centroidVsHierarchical,
                             AgreementReport centroidVsDensity,
                             SortedMap<Integer, ClusterProfile> profiles,
                             List<PriorityEntry> priority,
                             List<ClusterPriority> clusterRanking,
                             List<String> focusIds,
                             Projection projection,
                             List<ClusterSummary> summaries) {

    public AnalysisReport {
        Objects.requireNonNull(kSearch, "kSearch must not be null");
        Objects.requireNonNull(centroid, "centroid must not be null");
        Objects.requireNonNull(hierarchical, "hierarchical must not be null");
        Objects.requireNonNull(density, "density must not be null");
        Objects.requireNonNull(profiles, "profiles must not be null");
        priority = List.copyOf(priority);
        clusterRanking = List.copyOf(clusterRanking);
        focusIds = List.copyOf(focusIds);
        summaries = List.copyOf(summaries);
    }

    public List<ClusterAssignment> assignments() {
        return List.of(centroid, hierarchical, density);
    }
}
