package io.github.jakubt4.eosensor.dto;

/**
 * Optics summary derived from the sensor inputs.
 *
 * @param ifov                 instantaneous field of view in radians
 * @param horizontalFov        horizontal field of view in degrees
 * @param verticalFov          vertical field of view in degrees
 * @param fNumber              focal ratio (focal length / aperture)
 * @param focalLengthForGsd    focal length in millimeters that meets the GSD requirement at mean altitude
 */
public record SensorOptics(double ifov,
                           double horizontalFov,
                           double verticalFov,
                           double fNumber,
                           double focalLengthForGsd) {
}
