package org.aid.metrics;

/**
 * A record index with its distance to the query.
 * Smaller distance means closer neighbor.
 */
public record Neighbor(int index, double distance) {
}
