package org.aid.evaluation;

import org.aid.error.ConfigurationException;
import org.aid.error.DataShapeException;
import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Principal-component analysis through the eigendecomposition of the sample
 * covariance matrix. Components come in descending eigenvalue order; each
 * eigenvector is flipped so that its largest absolute loading is positive,
 * which makes the projection reproducible across runs.
 */
public final class PrincipalComponents {

    private static final Logger log = LoggerFactory.getLogger(PrincipalComponents.class);

    private final List<ComponentAxis> axes;
    private final double[] explainedVarianceRatio;

    private PrincipalComponents(List<ComponentAxis> axes, double[] explainedVarianceRatio) {
        this.axes = List.copyOf(axes);
        this.explainedVarianceRatio = explainedVarianceRatio;
    }

    /**
     * @param dims number of components to keep, 1..matrix.dim()
     */
    public static PrincipalComponents fit(FeatureMatrix matrix, int dims) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        if (dims < 1 || dims > matrix.dim()) {
            throw ConfigurationException.of("pca_components", dims, "must be in [1, " + matrix.dim() + "]");
        }
        if (matrix.size() < 2) {
            throw new DataShapeException("PCA needs at least two records, got " + matrix.size());
        }

        double[][] data = new double[matrix.size()][];
        for (int i = 0; i < matrix.size(); i++) {
            data[i] = matrix.row(i).toArrayCopy();
        }
        FeatureVector origin = FeatureVector.mean(matrix.rows());
        RealMatrix covariance = new Covariance(data, true).getCovarianceMatrix();
        EigenDecomposition eigen = new EigenDecomposition(covariance);

        double[] eigenvalues = eigen.getRealEigenvalues();
        Integer[] order = new Integer[eigenvalues.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> -eigenvalues[i]).thenComparingInt(i -> i));

        double total = 0.0;
        for (double ev : eigenvalues) total += Math.max(0.0, ev);

        List<ComponentAxis> axes = new ArrayList<>(dims);
        double[] ratio = new double[dims];
        for (int c = 0; c < dims; c++) {
            int idx = order[c];
            double variance = Math.max(0.0, eigenvalues[idx]);
            axes.add(new ComponentAxis(origin, signNormalized(eigen.getEigenvector(idx)), variance));
            ratio[c] = total > 0.0 ? variance / total : 0.0;
        }

        PrincipalComponents pca = new PrincipalComponents(axes, ratio);
        log.info("PCA kept {} components explaining {} of the variance",
                dims, String.format("%.4f", Arrays.stream(ratio).sum()));
        return pca;
    }

    public List<ComponentAxis> axes() {
        return axes;
    }

    public double[] explainedVarianceRatio() {
        return Arrays.copyOf(explainedVarianceRatio, explainedVarianceRatio.length);
    }

    /** Coordinates of one vector on the kept components. */
    public double[] project(FeatureVector v) {
        double[] out = new double[axes.size()];
        for (int c = 0; c < out.length; c++) {
            out[c] = axes.get(c).coordinateOf(v);
        }
        return out;
    }

    public Projection project(FeatureMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        double[][] coords = new double[matrix.size()][];
        for (int i = 0; i < matrix.size(); i++) {
            coords[i] = project(matrix.row(i));
        }
        return new Projection(matrix.ids(), coords, explainedVarianceRatio);
    }

    private static FeatureVector signNormalized(RealVector eigenvector) {
        double[] v = eigenvector.toArray();
        int largest = 0;
        for (int i = 1; i < v.length; i++) {
            if (Math.abs(v[i]) > Math.abs(v[largest])) largest = i;
        }
        FeatureVector out = new FeatureVector(v);
        double norm = out.norm();
        if (norm > 0.0) {
            out = out.scale(1.0 / norm);
        }
        return v[largest] < 0.0 ? out.scale(-1.0) : out;
    }
}
