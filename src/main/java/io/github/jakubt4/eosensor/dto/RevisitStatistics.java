package io.github.jakubt4.eosensor.dto;

/**
 * Summary of a revisit grid. Revisit times are in hours.
 *
 * @param totalCells         number of grid cells
 * @param coveredCells       cells visited at least once
 * @param coverage           covered cells as a percentage of all cells
 * @param minRevisits        smallest non-zero cell count, 0 when nothing is covered
 * @param maxRevisits        largest cell count
 * @param averageRevisits    mean count over covered cells
 * @param averageRevisitTime time span divided by the average revisit count
 * @param minRevisitTime     shortest per-cell revisit interval
 * @param maxGap             longest per-cell revisit interval
 */
public record RevisitStatistics(int totalCells,
                                int coveredCells,
                                double coverage,
                                int minRevisits,
                                int maxRevisits,
                                double averageRevisits,
                                double averageRevisitTime,
                                double minRevisitTime,
                                double maxGap) {
}
