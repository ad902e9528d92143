package org.aid.model;

/**
 * Non-fatal flag: a centroid fit stopped at its iteration cap before the
 * assignments stabilized. The result is still usable; the caller decides
 * whether to retry with another seed or k.
 *
 * @param k number of clusters requested
 * @param iterations iterations actually run (equal to the cap)
 * @param changedAtLastIteration points that still moved in the final iteration
 */
public record ConvergenceWarning(int k, int iterations, int changedAtLastIteration) {

    public String message() {
        return "k-means with k=" + k + " did not converge within " + iterations
                + " iterations (" + changedAtLastIteration + " points still moving)";
    }
}
