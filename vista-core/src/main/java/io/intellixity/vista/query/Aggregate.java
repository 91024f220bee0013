package io.intellixity.vista.query;

/**
 * Totals over a whole filtered result.
 *
 * @param sum sum of the numeric values of the sum control; null when there was none
 */
public record Aggregate(long count, Double sum) {}
