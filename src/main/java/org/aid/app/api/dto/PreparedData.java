package org.aid.app.api.dto;

import org.aid.model.FeatureMatrix;
import org.aid.model.ScalerState;

import java.util.Objects;

/**
 * Standardized feature matrix together with the scaling it was produced with,
 * so unseen records can be transformed the same way before prediction.
 */
public record PreparedData(ScalerState scaler, FeatureMatrix matrix) {

    public PreparedData {
        Objects.requireNonNull(scaler, "scaler must not be null");
        Objects.requireNonNull(matrix, "matrix must not be null");
    }
}
