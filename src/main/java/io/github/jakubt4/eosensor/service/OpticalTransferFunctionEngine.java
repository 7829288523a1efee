package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.AtmosphericCondition;
import io.github.jakubt4.eosensor.dto.EncircledEnergy;
import io.github.jakubt4.eosensor.dto.MtfInputs;
import io.github.jakubt4.eosensor.dto.MtfParameter;
import io.github.jakubt4.eosensor.dto.MtfResults;
import io.github.jakubt4.eosensor.dto.OpticalQualityMetrics;
import io.github.jakubt4.eosensor.dto.OpticalQualityMetrics.ImageQuality;
import io.github.jakubt4.eosensor.dto.OpticalQualityMetrics.LimitingFactor;
import io.github.jakubt4.eosensor.dto.PsfInputs;
import io.github.jakubt4.eosensor.dto.PsfResults;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * PSF and MTF models of the imaging chain.
 *
 * <p>Blur contributions are treated as independent: FWHMs add in quadrature, transfer
 * functions multiply. The PSF itself is modeled as a Gaussian of the total FWHM.
 */
@Slf4j
@Service
public class OpticalTransferFunctionEngine {

    private static final double FWHM_TO_SIGMA = 1.0 / (2 * FastMath.sqrt(2 * FastMath.log(2.0)));

    private static final int PSF_GRID_SIZE = 64;
    private static final int PSF_PROFILE_POINTS = 100;
    private static final int ENCIRCLED_ENERGY_POINTS = 50;
    private static final int FREQUENCY_SAMPLES = 100;
    private static final double WAVELENGTH_HALF_BAND_NM = 50.0;

    // Off-axis aberration scale, meters of wavefront per rad^2
    private static final double OFF_AXIS_WAVEFRONT_M = 100e-9;
    private static final double ARCSEC_TO_RAD = 4.85e-6;

    // ---------------------------------------------------------------- PSF

    public PsfResults computePsf(final PsfInputs inputs) {
        final var wavelengthM = inputs.wavelength() * 1e-9;
        final var focalLengthM = inputs.focalLength() * 1e-3;
        final var apertureM = inputs.aperture() * 1e-3;

        // Focal-plane lengths in micrometers
        final var airyDiskDiameter = 2.44 * wavelengthM * focalLengthM / apertureM * 1e6;
        final var diffractionFwhm = 1.22 * wavelengthM * focalLengthM / apertureM * 1e6;
        final var atmosphericFwhm = atmosphericFwhm(inputs.atmosphere(), inputs.offNadirAngle());
        final var defocusFwhm = FastMath.abs(inputs.defocus()) * 0.5;

        final var psfFwhm = FastMath.sqrt(diffractionFwhm * diffractionFwhm
                + atmosphericFwhm * atmosphericFwhm
                + defocusFwhm * defocusFwhm);

        final var wavefrontError = wavefrontError(inputs.defocus(), inputs.offNadirAngle());
        final var phase = 2 * FastMath.PI * wavefrontError / wavelengthM;
        final var strehlRatio = FastMath.exp(-(phase * phase));

        final var rmsSpotSize = psfFwhm * FWHM_TO_SIGMA;

        log.debug("PSF — diffraction FWHM={} um, total FWHM={} um, Strehl={}",
                String.format("%.3f", diffractionFwhm),
                String.format("%.3f", psfFwhm),
                String.format("%.4f", strehlRatio));

        return new PsfResults(
                airyDiskDiameter,
                diffractionFwhm,
                psfFwhm,
                strehlRatio,
                rmsSpotSize,
                encircledEnergy(psfFwhm, rmsSpotSize),
                psfGrid(psfFwhm),
                psfProfile(psfFwhm),
                List.of(inputs.wavelength() - WAVELENGTH_HALF_BAND_NM, inputs.wavelength() + WAVELENGTH_HALF_BAND_NM));
    }

    /**
     * Grades a PSF evaluation and lists the changes most likely to improve it.
     */
    public OpticalQualityMetrics assessQuality(final PsfResults results, final PsfInputs inputs) {
        final var strehl = results.strehlRatio();

        final ImageQuality quality;
        if (strehl > 0.8) {
            quality = ImageQuality.EXCELLENT;
        } else if (strehl > 0.6) {
            quality = ImageQuality.GOOD;
        } else if (strehl > 0.3) {
            quality = ImageQuality.ACCEPTABLE;
        } else {
            quality = ImageQuality.POOR;
        }

        final var fwhmRatio = results.psfFwhm() / results.diffractionFwhm();
        final LimitingFactor limitingFactor;
        if (fwhmRatio < 1.2) {
            limitingFactor = LimitingFactor.DIFFRACTION;
        } else if (inputs.defocus() > 5) {
            limitingFactor = LimitingFactor.DEFOCUS;
        } else if (inputs.atmosphere() != AtmosphericCondition.CLEAR) {
            limitingFactor = LimitingFactor.ATMOSPHERE;
        } else {
            limitingFactor = LimitingFactor.ABERRATIONS;
        }

        final var recommendations = new ArrayList<String>();
        if (strehl < 0.8) {
            recommendations.add("Consider reducing optical aberrations");
        }
        if (inputs.defocus() > 2) {
            recommendations.add("Improve focus accuracy");
        }
        if (fwhmRatio > 2) {
            recommendations.add("Check for optical misalignment");
        }

        return new OpticalQualityMetrics(quality, limitingFactor, recommendations, (int) FastMath.round(strehl * 100));
    }

    private static double atmosphericFwhm(final AtmosphericCondition condition, final double offNadirDeg) {
        final var airmass = 1.0 / FastMath.cos(FastMath.toRadians(offNadirDeg));
        return condition.baseSeeingMicrons() * FastMath.pow(airmass, 0.6);
    }

    /**
     * RMS wavefront error in meters: a quarter-wave-scaled defocus term and a quadratic
     * off-axis term, added in quadrature.
     */
    private static double wavefrontError(final double defocusMicrons, final double offNadirDeg) {
        final var defocusError = FastMath.abs(defocusMicrons) * 1e-6 / 4;
        final var angle = FastMath.toRadians(offNadirDeg);
        final var offAxisError = angle * angle * OFF_AXIS_WAVEFRONT_M;
        return FastMath.sqrt(defocusError * defocusError + offAxisError * offAxisError);
    }

    private static double[][] psfGrid(final double fwhm) {
        final var step = fwhm * 4 / PSF_GRID_SIZE;
        final var center = PSF_GRID_SIZE / 2;
        final var sigma = fwhm * FWHM_TO_SIGMA;

        final var grid = new double[PSF_GRID_SIZE][PSF_GRID_SIZE];
        for (var i = 0; i < PSF_GRID_SIZE; i++) {
            for (var j = 0; j < PSF_GRID_SIZE; j++) {
                final var x = (j - center) * step;
                final var y = (i - center) * step;
                grid[i][j] = FastMath.exp(-(x * x + y * y) / (2 * sigma * sigma));
            }
        }
        return grid;
    }

    private static List<Double> psfProfile(final double fwhm) {
        final var step = fwhm * 3 / PSF_PROFILE_POINTS;
        final var sigma = fwhm * FWHM_TO_SIGMA;

        final var profile = new ArrayList<Double>(PSF_PROFILE_POINTS + 1);
        for (var i = 0; i <= PSF_PROFILE_POINTS; i++) {
            final var r = i * step;
            profile.add(FastMath.exp(-(r * r) / (2 * sigma * sigma)));
        }
        return profile;
    }

    private static EncircledEnergy encircledEnergy(final double fwhm, final double sigma) {
        final var step = fwhm * 3 / ENCIRCLED_ENERGY_POINTS;

        final var radii = new ArrayList<Double>(ENCIRCLED_ENERGY_POINTS + 1);
        final var energy = new ArrayList<Double>(ENCIRCLED_ENERGY_POINTS + 1);
        for (var i = 0; i <= ENCIRCLED_ENERGY_POINTS; i++) {
            final var r = i * step;
            radii.add(r);
            energy.add((1 - FastMath.exp(-(r * r) / (2 * sigma * sigma))) * 100);
        }

        return new EncircledEnergy(radii, energy,
                radiusForEnergy(radii, energy, 50),
                radiusForEnergy(radii, energy, 80),
                radiusForEnergy(radii, energy, 95));
    }

    /**
     * Interpolated radius enclosing {@code targetPercent}; the largest sampled radius when
     * the table never reaches the target.
     */
    static double radiusForEnergy(final List<Double> radii, final List<Double> energy, final double targetPercent) {
        for (var i = 0; i < energy.size() - 1; i++) {
            final var lower = energy.get(i);
            final var upper = energy.get(i + 1);
            if (lower <= targetPercent && upper > targetPercent) {
                final var fraction = (targetPercent - lower) / (upper - lower);
                return radii.get(i) + fraction * (radii.get(i + 1) - radii.get(i));
            }
        }
        return radii.get(radii.size() - 1);
    }

    // ---------------------------------------------------------------- MTF

    public MtfResults computeMtf(final MtfInputs inputs) {
        final var frequencies = frequencies(inputs.frequencyMin(), inputs.frequencyMax());

        final var optics = opticsMtf(frequencies, inputs);
        final var detector = detectorMtf(frequencies, inputs);
        final var motion = motionMtf(frequencies, inputs);

        final var overall = new ArrayList<Double>(frequencies.size());
        final var sagittal = new ArrayList<Double>(frequencies.size());
        final var tangential = new ArrayList<Double>(frequencies.size());
        for (var i = 0; i < frequencies.size(); i++) {
            final var value = optics.get(i) * detector.get(i) * motion.get(i);
            overall.add(value);
            sagittal.add(value * 0.95);
            tangential.add(value * 0.98);
        }

        final var mtf50 = findMtf50(frequencies, overall);
        final var nyquist = 1000.0 / (2 * inputs.pixelSize());
        final var samplingEfficiency = samplingEfficiency(frequencies, overall, nyquist);

        log.debug("MTF — MTF50={} cy/mm, Nyquist={} cy/mm, sampling efficiency={}",
                String.format("%.2f", mtf50),
                String.format("%.2f", nyquist),
                String.format("%.3f", samplingEfficiency));

        return new MtfResults(frequencies, optics, detector, motion, overall, sagittal, tangential,
                mtf50, nyquist, samplingEfficiency);
    }

    /**
     * Proposes parameter changes that raise MTF50 towards {@code targetMtf50}. Empty when
     * the current design already meets the target.
     */
    public Map<MtfParameter, Double> suggestImprovements(final MtfInputs inputs, final double targetMtf50) {
        final var suggestions = new EnumMap<MtfParameter, Double>(MtfParameter.class);
        if (computeMtf(inputs).mtf50() >= targetMtf50) {
            return suggestions;
        }

        if (inputs.pixelSize() > 3) {
            suggestions.put(MtfParameter.PIXEL_SIZE, FastMath.max(3.0, inputs.pixelSize() * 0.8));
        }
        if (inputs.integrationTime() > 0.0005) {
            suggestions.put(MtfParameter.INTEGRATION_TIME, FastMath.max(0.0005, inputs.integrationTime() * 0.8));
        }
        suggestions.put(MtfParameter.APERTURE, inputs.aperture() * 1.2);
        if (inputs.defocus() > 1) {
            suggestions.put(MtfParameter.DEFOCUS, FastMath.max(0.0, inputs.defocus() * 0.5));
        }
        return suggestions;
    }

    private static List<Double> frequencies(final double min, final double max) {
        final var step = (max - min) / (FREQUENCY_SAMPLES - 1);
        final var frequencies = new ArrayList<Double>(FREQUENCY_SAMPLES);
        for (var i = 0; i < FREQUENCY_SAMPLES; i++) {
            frequencies.add(min + i * step);
        }
        return frequencies;
    }

    private static List<Double> opticsMtf(final List<Double> frequencies, final MtfInputs inputs) {
        final var apertureM = inputs.aperture() * 1e-3;
        final var focalLengthM = inputs.focalLength() * 1e-3;
        final var wavelengthM = inputs.wavelength() * 1e-9;
        final var defocusM = FastMath.abs(inputs.defocus()) * 1e-6;

        // Incoherent cutoff D / (lambda f), cycles/mm
        final var cutoff = apertureM / (wavelengthM * focalLengthM) / 1000;

        final var result = new ArrayList<Double>(frequencies.size());
        for (final var frequency : frequencies) {
            if (frequency == 0) {
                result.add(1.0);
                continue;
            }
            final var normalized = frequency / cutoff;
            var diffraction = 0.0;
            if (normalized <= 1) {
                diffraction = (2 / FastMath.PI)
                        * (FastMath.acos(normalized) - normalized * FastMath.sqrt(1 - normalized * normalized));
            }
            final var defocus = defocusMtf(frequency, defocusM, wavelengthM, focalLengthM, apertureM);
            final var atmosphere = atmosphericMtf(frequency, inputs.atmosphere(), inputs.offNadirAngle());
            result.add(diffraction * defocus * atmosphere);
        }
        return result;
    }

    private static double defocusMtf(final double frequency, final double defocusM, final double wavelengthM,
                                     final double focalLengthM, final double apertureM) {
        if (defocusM == 0) {
            return 1.0;
        }
        final var fNumber = focalLengthM / apertureM;
        final var x = (FastMath.PI * defocusM * frequency) / (wavelengthM * fNumber * fNumber * 1000);
        if (FastMath.abs(x) < 0.001) {
            return 1.0;
        }
        return FastMath.abs(FastMath.sin(x) / x);
    }

    /**
     * Kolmogorov-like rolloff {@code exp(-(f/f_break)^(5/3))} with the break frequency
     * derived from the Fried parameter of the air-mass-scaled seeing.
     */
    private static double atmosphericMtf(final double frequency, final AtmosphericCondition condition,
                                         final double offNadirDeg) {
        if (frequency == 0) {
            return 1.0;
        }
        final var airmass = 1.0 / FastMath.cos(FastMath.toRadians(offNadirDeg));
        final var effectiveSeeing = condition.seeingArcsec() * FastMath.pow(airmass, 0.6);
        final var friedParameter = 0.98 / (effectiveSeeing * ARCSEC_TO_RAD);
        final var breakFrequency = friedParameter / (2 * FastMath.PI) * 1000;
        return FastMath.exp(-FastMath.pow(frequency / breakFrequency, 5.0 / 3.0));
    }

    private static List<Double> detectorMtf(final List<Double> frequencies, final MtfInputs inputs) {
        final var pixelFrequency = 1000.0 / inputs.pixelSize();
        final var qe = inputs.detectorQe();

        final var result = new ArrayList<Double>(frequencies.size());
        for (final var frequency : frequencies) {
            if (frequency == 0) {
                result.add(qe);
                continue;
            }
            final var x = FastMath.PI * frequency / pixelFrequency;
            result.add(FastMath.abs(FastMath.sin(x) / x) * qe);
        }
        return result;
    }

    private static List<Double> motionMtf(final List<Double> frequencies, final MtfInputs inputs) {
        final var altitude = inputs.altitude();
        final var focalLengthM = inputs.focalLength() * 1e-3;
        final var groundVelocity = inputs.platformVelocity() * (altitude / (altitude + focalLengthM));
        final var gsd = altitude * inputs.pixelSize() * 1e-6 / focalLengthM;
        final var blurPixels = groundVelocity * inputs.integrationTime() / gsd;
        final var pixelFrequency = 1000.0 / inputs.pixelSize();

        final var result = new ArrayList<Double>(frequencies.size());
        for (final var frequency : frequencies) {
            if (frequency == 0 || blurPixels == 0) {
                result.add(1.0);
                continue;
            }
            final var x = FastMath.PI * frequency * blurPixels / pixelFrequency;
            result.add(FastMath.abs(x) < 0.001 ? 1.0 : FastMath.abs(FastMath.sin(x) / x));
        }
        return result;
    }

    /**
     * First downward crossing of 0.5, linearly interpolated; 0 when the curve never crosses.
     */
    static double findMtf50(final List<Double> frequencies, final List<Double> mtf) {
        for (var i = 0; i < mtf.size() - 1; i++) {
            final var current = mtf.get(i);
            final var next = mtf.get(i + 1);
            if (current >= 0.5 && next < 0.5) {
                final var fraction = (0.5 - current) / (next - current);
                return frequencies.get(i) + fraction * (frequencies.get(i + 1) - frequencies.get(i));
            }
        }
        return 0;
    }

    /**
     * Overall MTF at the first sample at or above Nyquist. Not interpolated onto Nyquist itself.
     */
    static double samplingEfficiency(final List<Double> frequencies, final List<Double> mtf, final double nyquist) {
        for (var i = 0; i < frequencies.size(); i++) {
            if (frequencies.get(i) >= nyquist) {
                return FastMath.max(0.0, FastMath.min(1.0, mtf.get(i)));
            }
        }
        return 0;
    }
}
