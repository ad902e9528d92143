package org.aid.evaluation;

import org.aid.model.ClusterAssignment;
import org.aid.model.ClusterProfile;
import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-cluster statistics derived from an assignment and its matrix.
 *
 * Members are always visited in record order, so profiling the same
 * assignment twice yields bit-identical means.
 */
public final class ClusterProfiler {

    /**
     * @return cluster id -> profile, ascending by id; the noise group appears
     *         under {@link ClusterAssignment#NOISE} when the assignment has one
     */
    public SortedMap<Integer, ClusterProfile> profile(ClusterAssignment assignment, FeatureMatrix matrix) {
        Objects.requireNonNull(assignment, "assignment must not be null");
        Objects.requireNonNull(matrix, "matrix must not be null");
        assignment.requireAlignedWith(matrix);

        List<Integer> labels = new ArrayList<>(assignment.clusterIds());
        if (assignment.noiseCount() > 0) {
            labels.add(0, ClusterAssignment.NOISE);
        }

        SortedMap<Integer, ClusterProfile> out = new TreeMap<>();
        for (int label : labels) {
            out.put(label, profileOf(label, assignment.memberIndexes(label), matrix));
        }
        return Collections.unmodifiableSortedMap(out);
    }

    private static ClusterProfile profileOf(int label, List<Integer> members, FeatureMatrix matrix) {
        List<FeatureVector> rows = new ArrayList<>(members.size());
        List<String> ids = new ArrayList<>(members.size());
        for (int i : members) {
            rows.add(matrix.row(i));
            ids.add(matrix.id(i));
        }

        FeatureVector means = FeatureVector.mean(rows);
        double[] spreads = new double[matrix.dim()];
        StandardDeviation population = new StandardDeviation(false);
        for (int j = 0; j < matrix.dim(); j++) {
            double[] column = new double[rows.size()];
            for (int r = 0; r < rows.size(); r++) {
                column[r] = rows.get(r).get(j);
            }
            spreads[j] = population.evaluate(column, means.get(j));
        }

        return new ClusterProfile(label, members.size(), matrix.featureNames(), means, new FeatureVector(spreads), ids);
    }
}
