package io.github.jakubt4.eosensor.dto;

import lombok.Builder;

/**
 * Sensor, optics and orbit parameters for a ground-geometry evaluation.
 *
 * @param pixelSize            detector pixel pitch in micrometers
 * @param pixelCountH          horizontal pixel count
 * @param pixelCountV          vertical pixel count
 * @param gsdRequirements      target ground sample distance in meters per pixel
 * @param altitudeMin          minimum orbital altitude in meters
 * @param altitudeMax          maximum orbital altitude in meters
 * @param focalLength          focal length in millimeters
 * @param aperture             aperture diameter in millimeters
 * @param attitudeAccuracy     attitude-determination accuracy in degrees (3 sigma)
 * @param nominalOffNadirAngle nominal off-nadir pointing angle in degrees
 * @param maxOffNadirAngle     maximum off-nadir pointing angle in degrees
 * @param gpsAccuracy          GPS position accuracy in meters
 */
@Builder(toBuilder = true)
public record SensorInputs(double pixelSize,
                           double pixelCountH,
                           double pixelCountV,
                           double gsdRequirements,
                           double altitudeMin,
                           double altitudeMax,
                           double focalLength,
                           double aperture,
                           double attitudeAccuracy,
                           double nominalOffNadirAngle,
                           double maxOffNadirAngle,
                           double gpsAccuracy) {
}
