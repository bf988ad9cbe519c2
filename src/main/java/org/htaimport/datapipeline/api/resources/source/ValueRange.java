package org.htaimport.datapipeline.api.resources.source;

/**
 * Minimum and maximum sample value of a source metric.
 *
 * @param min smallest value
 * @param max largest value
 */
public record ValueRange(double min, double max) {
}
