package org.aid.evaluation;

/**
 * Outcome of comparing two independently derived assignments.
 *
 * @param first algorithm of the first assignment
 * @param second algorithm of the second assignment
 * @param score adjusted Rand index
 * @param threshold minimum score accepted as consistent
 * @param consistent {@code score >= threshold}
 */
public record AgreementReport(String first, String second, double score, double threshold, boolean consistent) {
}
