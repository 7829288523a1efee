package io.github.jakubt4.eosensor.dto;

/**
 * Revisit grid together with its summary statistics.
 */
public record RevisitResult(RevisitGrid grid, RevisitStatistics statistics) {
}
