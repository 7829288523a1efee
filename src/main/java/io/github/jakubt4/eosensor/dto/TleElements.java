package io.github.jakubt4.eosensor.dto;

import lombok.Builder;

/**
 * Mean orbital elements of a two-line element set.
 *
 * @param epochYear          four-digit epoch year
 * @param epochDay           fractional day of year, 1.0 being midnight of January 1st
 * @param inclination        inclination in degrees
 * @param raan               right ascension of the ascending node in degrees
 * @param eccentricity       eccentricity, in [0, 1)
 * @param argumentOfPerigee  argument of perigee in degrees
 * @param meanAnomaly        mean anomaly in degrees
 * @param meanMotion         mean motion in revolutions per day
 */
@Builder(toBuilder = true)
public record TleElements(int epochYear,
                          double epochDay,
                          double inclination,
                          double raan,
                          double eccentricity,
                          double argumentOfPerigee,
                          double meanAnomaly,
                          double meanMotion) {
}
