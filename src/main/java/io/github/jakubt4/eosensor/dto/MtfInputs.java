package io.github.jakubt4.eosensor.dto;

import lombok.Builder;

/**
 * Imaging-chain parameters for a modulation-transfer-function evaluation.
 *
 * @param pixelSize        detector pixel pitch in micrometers
 * @param aperture         aperture diameter in millimeters
 * @param focalLength      focal length in millimeters
 * @param wavelength       central wavelength in nanometers
 * @param atmosphere       atmospheric bucket
 * @param offNadirAngle    off-nadir angle in degrees
 * @param defocus          defocus in micrometers
 * @param detectorQe       detector quantum efficiency (0-1)
 * @param electronicNoise  read noise in electrons RMS (carried, not used by the MTF model)
 * @param platformVelocity platform ground velocity in m/s
 * @param integrationTime  integration time in seconds
 * @param altitude         altitude in meters
 * @param frequencyMin     lowest sampled spatial frequency in cycles/mm
 * @param frequencyMax     highest sampled spatial frequency in cycles/mm
 */
@Builder(toBuilder = true)
public record MtfInputs(double pixelSize,
                        double aperture,
                        double focalLength,
                        double wavelength,
                        AtmosphericCondition atmosphere,
                        double offNadirAngle,
                        double defocus,
                        double detectorQe,
                        double electronicNoise,
                        double platformVelocity,
                        double integrationTime,
                        double altitude,
                        double frequencyMin,
                        double frequencyMax) {
}
