package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.MtfInputs;
import io.github.jakubt4.eosensor.dto.PsfInputs;
import io.github.jakubt4.eosensor.dto.SensorInputs;
import io.github.jakubt4.eosensor.dto.TleElements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-side checks for engine inputs. The engines themselves accept anything and let bad
 * values surface as {@code NaN} or infinite results.
 *
 * <p>Each method returns human-readable violations; an empty list means the input is valid.
 */
@Component
public class InputValidator {

    public List<String> validate(final SensorInputs inputs) {
        final var violations = new ArrayList<String>();
        positive(violations, "pixelSize", inputs.pixelSize());
        positive(violations, "pixelCountH", inputs.pixelCountH());
        positive(violations, "pixelCountV", inputs.pixelCountV());
        positive(violations, "gsdRequirements", inputs.gsdRequirements());
        positive(violations, "altitudeMin", inputs.altitudeMin());
        positive(violations, "altitudeMax", inputs.altitudeMax());
        positive(violations, "focalLength", inputs.focalLength());
        positive(violations, "aperture", inputs.aperture());
        positive(violations, "attitudeAccuracy", inputs.attitudeAccuracy());
        positive(violations, "gpsAccuracy", inputs.gpsAccuracy());
        angle(violations, "nominalOffNadirAngle", inputs.nominalOffNadirAngle());
        angle(violations, "maxOffNadirAngle", inputs.maxOffNadirAngle());

        if (inputs.altitudeMax() < inputs.altitudeMin()) {
            violations.add("altitudeMax must not be below altitudeMin");
        }
        if (inputs.nominalOffNadirAngle() > inputs.maxOffNadirAngle()) {
            violations.add("nominalOffNadirAngle must not exceed maxOffNadirAngle");
        }
        return violations;
    }

    public List<String> validate(final PsfInputs inputs) {
        final var violations = new ArrayList<String>();
        optics(violations, inputs.pixelSize(), inputs.aperture(), inputs.focalLength(), inputs.wavelength());
        if (inputs.atmosphere() == null) {
            violations.add("atmosphere is required");
        }
        angle(violations, "offNadirAngle", inputs.offNadirAngle());
        finite(violations, "defocus", inputs.defocus());
        return violations;
    }

    public List<String> validate(final MtfInputs inputs) {
        final var violations = new ArrayList<String>();
        optics(violations, inputs.pixelSize(), inputs.aperture(), inputs.focalLength(), inputs.wavelength());
        if (inputs.atmosphere() == null) {
            violations.add("atmosphere is required");
        }
        angle(violations, "offNadirAngle", inputs.offNadirAngle());
        finite(violations, "defocus", inputs.defocus());
        positive(violations, "detectorQe", inputs.detectorQe());
        if (inputs.detectorQe() > 1) {
            violations.add("detectorQe must not exceed 1");
        }
        positive(violations, "electronicNoise", inputs.electronicNoise());
        positive(violations, "platformVelocity", inputs.platformVelocity());
        positive(violations, "integrationTime", inputs.integrationTime());
        positive(violations, "altitude", inputs.altitude());
        positive(violations, "frequencyMax", inputs.frequencyMax());
        if (!(inputs.frequencyMin() >= 0)) {
            violations.add("frequencyMin must be zero or positive");
        }
        if (inputs.frequencyMax() <= inputs.frequencyMin()) {
            violations.add("frequencyMax must exceed frequencyMin");
        }
        return violations;
    }

    public List<String> validate(final TleElements elements) {
        final var violations = new ArrayList<String>();
        if (!(elements.eccentricity() >= 0 && elements.eccentricity() < 1)) {
            violations.add("eccentricity must be in [0, 1)");
        }
        positive(violations, "meanMotion", elements.meanMotion());
        if (!(elements.epochDay() >= 1 && elements.epochDay() < 367)) {
            violations.add("epochDay must be in [1, 367)");
        }
        if (!(elements.inclination() >= 0 && elements.inclination() <= 180)) {
            violations.add("inclination must be in [0, 180]");
        }
        finite(violations, "raan", elements.raan());
        finite(violations, "argumentOfPerigee", elements.argumentOfPerigee());
        finite(violations, "meanAnomaly", elements.meanAnomaly());
        return violations;
    }

    private static void optics(final List<String> violations, final double pixelSize, final double aperture,
                               final double focalLength, final double wavelength) {
        positive(violations, "pixelSize", pixelSize);
        positive(violations, "aperture", aperture);
        positive(violations, "focalLength", focalLength);
        positive(violations, "wavelength", wavelength);
    }

    // Negated comparisons also reject NaN
    private static void positive(final List<String> violations, final String name, final double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            violations.add(name + " must be a positive finite number");
        }
    }

    private static void angle(final List<String> violations, final String name, final double value) {
        if (!(value >= 0 && value < 90)) {
            violations.add(name + " must be in [0, 90) degrees");
        }
    }

    private static void finite(final List<String> violations, final String name, final double value) {
        if (!Double.isFinite(value)) {
            violations.add(name + " must be a finite number");
        }
    }
}
