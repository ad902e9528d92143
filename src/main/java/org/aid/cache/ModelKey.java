package org.aid.cache;

import org.aid.cluster.ClusteringParams;
import org.aid.model.FeatureMatrix;

import java.util.Objects;

/**
 * Identity of a fitted model: which data, which algorithm, which parameters.
 *
 * @param fingerprint {@link FeatureMatrix#fingerprint()} of the training data
 * @param algorithm clusterer name
 * @param params canonical parameter description, including the seed where it matters
 */
public record ModelKey(String fingerprint, String algorithm, String params) {

    public ModelKey {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(params, "params must not be null");
    }

    public static ModelKey of(FeatureMatrix matrix, String algorithm, ClusteringParams params) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        Objects.requireNonNull(params, "params must not be null");
        return new ModelKey(matrix.fingerprint(), algorithm, params.describe());
    }

    public static ModelKey of(FeatureMatrix matrix, String algorithm, String params) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        return new ModelKey(matrix.fingerprint(), algorithm, params);
    }
}
