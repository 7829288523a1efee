package io.github.jakubt4.eosensor.dto;

import java.time.Instant;

/**
 * Sub-satellite point at one sample time.
 *
 * @param latitude  latitude in degrees, geocentric for circular tracks and geodetic for SGP4 tracks
 * @param longitude longitude in degrees, within [-180, 180]
 * @param timestamp sample time
 */
public record GroundTrackPoint(double latitude, double longitude, Instant timestamp) {
}
