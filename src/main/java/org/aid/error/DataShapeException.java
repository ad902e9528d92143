package org.aid.error;

/**
 * The feature data itself is unusable: no records, vectors of different
 * lengths, duplicate identifiers, or an assignment that does not line up with
 * its matrix. Raised before any algorithm runs.
 */
public class DataShapeException extends IllegalArgumentException {

    public DataShapeException(String message) {
        super(message);
    }

    public DataShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
