package io.github.jakubt4.eosensor.dto;

import lombok.Builder;

/**
 * Optical parameters for a point-spread-function evaluation.
 *
 * @param pixelSize     detector pixel pitch in micrometers
 * @param aperture      aperture diameter in millimeters
 * @param focalLength   focal length in millimeters
 * @param wavelength    central wavelength in nanometers
 * @param atmosphere    atmospheric bucket
 * @param offNadirAngle off-nadir angle in degrees
 * @param defocus       defocus in micrometers
 */
@Builder(toBuilder = true)
public record PsfInputs(double pixelSize,
                        double aperture,
                        double focalLength,
                        double wavelength,
                        AtmosphericCondition atmosphere,
                        double offNadirAngle,
                        double defocus) {
}
