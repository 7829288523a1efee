package io.github.jakubt4.eosensor.dto;

/**
 * WGS-84 geodetic position.
 *
 * @param latitude  geodetic latitude in degrees
 * @param longitude longitude in degrees
 * @param altitude  height above the ellipsoid in kilometers
 */
public record GeodeticPosition(double latitude, double longitude, double altitude) {
}
