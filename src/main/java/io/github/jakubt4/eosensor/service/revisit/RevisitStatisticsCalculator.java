package io.github.jakubt4.eosensor.service.revisit;

import io.github.jakubt4.eosensor.dto.RevisitGrid;
import io.github.jakubt4.eosensor.dto.RevisitStatistics;
import org.springframework.stereotype.Component;

/**
 * Coverage and revisit-interval summary of a revisit grid.
 *
 * <p>A cell counted {@code n > 1} times over a span {@code T} is taken to be revisited every
 * {@code T / (n - 1)} hours.
 */
@Component
public class RevisitStatisticsCalculator {

    public RevisitStatistics summarize(final RevisitGrid grid, final double timeSpanHours) {
        final var totalCells = grid.rows() * grid.columns();

        var coveredCells = 0;
        var minCount = Integer.MAX_VALUE;
        var maxCount = 0;
        var totalRevisits = 0L;
        var minRevisitTime = Double.POSITIVE_INFINITY;
        var maxGap = 0.0;
        var revisitedCells = 0;

        for (var row = 0; row < grid.rows(); row++) {
            for (var column = 0; column < grid.columns(); column++) {
                final var count = grid.count(row, column);
                if (count == 0) {
                    continue;
                }
                coveredCells++;
                totalRevisits += count;
                minCount = Math.min(minCount, count);
                maxCount = Math.max(maxCount, count);

                if (count > 1) {
                    final var interval = timeSpanHours / (count - 1);
                    minRevisitTime = Math.min(minRevisitTime, interval);
                    maxGap = Math.max(maxGap, interval);
                    revisitedCells++;
                }
            }
        }

        if (coveredCells == 0) {
            minCount = 0;
        }
        if (revisitedCells == 0) {
            minRevisitTime = timeSpanHours;
            maxGap = timeSpanHours;
        }

        final var coverage = totalCells == 0 ? 0.0 : 100.0 * coveredCells / totalCells;
        final var averageRevisits = coveredCells > 0 ? (double) totalRevisits / coveredCells : 0.0;
        final var averageRevisitTime = averageRevisits > 0 ? timeSpanHours / averageRevisits : timeSpanHours;

        return new RevisitStatistics(totalCells, coveredCells, coverage, minCount, maxCount,
                averageRevisits, averageRevisitTime, minRevisitTime, maxGap);
    }
}
