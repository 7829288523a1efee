package io.github.jakubt4.eosensor.dto;

/**
 * Circular-orbit elements used for ground-track propagation.
 *
 * @param altitude    altitude above the mean Earth radius in kilometers
 * @param inclination inclination in degrees
 * @param raan        right ascension of the ascending node in degrees
 * @param trueAnomaly initial true anomaly (argument of latitude) in degrees
 */
public record OrbitalElements(double altitude, double inclination, double raan, double trueAnomaly) {
}
