package io.github.jakubt4.eosensor.dto;

import java.util.List;

/**
 * Point-spread-function metrics and sampled curves. Lengths are in micrometers.
 *
 * @param airyDiskDiameter diameter of the first Airy zero
 * @param diffractionFwhm  diffraction-limited FWHM
 * @param psfFwhm          total FWHM including atmosphere and defocus
 * @param strehlRatio      peak intensity relative to the diffraction-limited ideal
 * @param rmsSpotSize      Gaussian sigma equivalent of the total FWHM
 * @param encircledEnergy  encircled-energy table
 * @param psfGrid          64x64 normalized PSF intensity grid spanning four FWHM
 * @param psfProfile       radial intensity profile spanning three FWHM
 * @param wavelengthRange  lower and upper wavelength of the analysis band, nanometers
 */
public record PsfResults(double airyDiskDiameter,
                         double diffractionFwhm,
                         double psfFwhm,
                         double strehlRatio,
                         double rmsSpotSize,
                         EncircledEnergy encircledEnergy,
                         double[][] psfGrid,
                         List<Double> psfProfile,
                         List<Double> wavelengthRange) {

    public PsfResults {
        psfGrid = copy(psfGrid);
        psfProfile = List.copyOf(psfProfile);
        wavelengthRange = List.copyOf(wavelengthRange);
    }

    @Override
    public double[][] psfGrid() {
        return copy(psfGrid);
    }

    private static double[][] copy(final double[][] source) {
        final var result = new double[source.length][];
        for (var i = 0; i < source.length; i++) {
            result[i] = source[i].clone();
        }
        return result;
    }
}
