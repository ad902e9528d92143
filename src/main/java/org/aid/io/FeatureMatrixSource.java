package org.aid.io;

import org.aid.model.FeatureMatrix;

import java.util.OptionalInt;

/**
 * Where a standardized feature matrix comes from (file, stream, classpath).
 *
 * Implementations should:
 * - load the data once and return the cached matrix afterwards
 * - reject malformed input with a DataShapeException before any clustering runs
 */
public interface FeatureMatrixSource {

    /**
     * Short description of the origin, used in log lines.
     */
    String name();

    FeatureMatrix load();

    /**
     * Feature count, known once {@link #load()} has run.
     */
    OptionalInt dimension();
}
