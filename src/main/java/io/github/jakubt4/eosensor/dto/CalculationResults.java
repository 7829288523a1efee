package io.github.jakubt4.eosensor.dto;

/**
 * Result of a sensor geometry evaluation.
 *
 * @param nominal   sensor at nadir, maximum altitude
 * @param worstCase sensor at the maximum off-nadir angle, maximum altitude
 * @param optics    field-of-view and focal summary shared by both cases
 */
public record CalculationResults(GeometryMetrics nominal, GeometryMetrics worstCase, SensorOptics optics) {
}
