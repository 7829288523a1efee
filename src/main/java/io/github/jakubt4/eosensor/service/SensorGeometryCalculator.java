package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.CalculationResults;
import io.github.jakubt4.eosensor.dto.GeometryMetrics;
import io.github.jakubt4.eosensor.dto.SensorInputs;
import io.github.jakubt4.eosensor.dto.SensorOptics;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

/**
 * Ground sampling, footprint and pointing-error budget for a push-frame sensor.
 *
 * <p>Both cases are evaluated at the maximum altitude. The nominal case points at nadir,
 * the worst case at the maximum off-nadir angle, where slant range and incidence inflate
 * the ground pixel non-linearly. Invalid inputs are not rejected; they surface as
 * {@code NaN} or infinite metrics.
 */
@Slf4j
@Service
public class SensorGeometryCalculator {

    // Spherical Earth radii, km: equatorial for pixel geometry, mean for swath
    private static final double PIXEL_EARTH_RADIUS_KM = 6378.0;
    private static final double FOOTPRINT_EARTH_RADIUS_KM = 6371.0;

    public CalculationResults compute(final SensorInputs inputs) {
        final var optics = computeOptics(inputs);
        final var altitudeKm = inputs.altitudeMax() / 1000.0;

        final var nominal = evaluate(inputs, optics, altitudeKm, 0.0);
        final var worstCase = evaluate(inputs, optics, altitudeKm, inputs.maxOffNadirAngle());

        log.debug("Sensor geometry — nominal center={} m, worst center={} m, worst RSS={} m",
                String.format("%.2f", nominal.centerPixelSize()),
                String.format("%.2f", worstCase.centerPixelSize()),
                String.format("%.2f", worstCase.rssError()));

        return new CalculationResults(nominal, worstCase, optics);
    }

    private SensorOptics computeOptics(final SensorInputs inputs) {
        final var ifov = 0.001 * inputs.pixelSize() / inputs.focalLength();

        // Detector extents in mm
        final var sensorWidthH = inputs.pixelSize() * inputs.pixelCountH() / 1000.0;
        final var sensorWidthV = inputs.pixelSize() * inputs.pixelCountV() / 1000.0;
        final var fovH = 2 * FastMath.atan(sensorWidthH / (2 * inputs.focalLength()));
        final var fovV = 2 * FastMath.atan(sensorWidthV / (2 * inputs.focalLength()));

        final var meanAltitudeKm = 0.5 * (inputs.altitudeMin() + inputs.altitudeMax()) / 1000.0;
        final var focalLengthForGsd = meanAltitudeKm * inputs.pixelSize() / inputs.gsdRequirements();

        return new SensorOptics(
                ifov,
                FastMath.toDegrees(fovH),
                FastMath.toDegrees(fovV),
                inputs.focalLength() / inputs.aperture(),
                focalLengthForGsd);
    }

    private GeometryMetrics evaluate(final SensorInputs inputs, final SensorOptics optics,
                                     final double altitudeKm, final double offNadirDeg) {
        final var ifov = optics.ifov();
        final var centerPixel = groundPixelSize(ifov, altitudeKm, offNadirDeg);
        final var edgePixel = groundPixelSize(ifov, altitudeKm, offNadirDeg + optics.horizontalFov() * 0.5);

        final var horizontalFootprint = footprint(altitudeKm, optics.horizontalFov(), offNadirDeg);
        final var verticalFootprint = footprint(altitudeKm, optics.verticalFov(), offNadirDeg);
        final var earthCenterAngle = FastMath.toDegrees(FastMath.atan(
                altitudeKm * FastMath.tan(FastMath.toRadians(optics.horizontalFov() * 0.5)) / PIXEL_EARTH_RADIUS_KM));

        // Small-angle displacement on the ground; roll sees the slant range twice
        final var secant = 1.0 / FastMath.cos(FastMath.toRadians(offNadirDeg));
        final var altitudeM = altitudeKm * 1000.0;
        final var attitudeRad = FastMath.toRadians(inputs.attitudeAccuracy());
        final var roll = altitudeM * secant * secant * attitudeRad;
        final var pitch = altitudeM * secant * attitudeRad;
        final var yaw = altitudeM * secant * attitudeRad;
        final var gps = inputs.gpsAccuracy();
        final var rss = FastMath.sqrt(roll * roll + pitch * pitch + yaw * yaw + gps * gps);

        return new GeometryMetrics(offNadirDeg, centerPixel, edgePixel,
                horizontalFootprint, verticalFootprint, earthCenterAngle,
                roll, pitch, yaw, gps, rss);
    }

    /**
     * Ground extent in meters of one IFOV whose near edge points {@code offNadirDeg} off nadir.
     */
    static double groundPixelSize(final double ifov, final double altitudeKm, final double offNadirDeg) {
        final var offNadir = FastMath.toRadians(offNadirDeg);
        final var scale = 1 + altitudeKm / PIXEL_EARTH_RADIUS_KM;
        return PIXEL_EARTH_RADIUS_KM * 1000 * (
                (FastMath.asin(FastMath.sin(offNadir + ifov) * scale) - offNadir - ifov)
                        - (FastMath.asin(FastMath.sin(offNadir) * scale) - offNadir));
    }

    /**
     * Swath length in kilometers across a field of view centered {@code offNadirDeg} off nadir.
     */
    static double footprint(final double altitudeKm, final double fovDeg, final double offNadirDeg) {
        final var offNadir = FastMath.toRadians(offNadirDeg);
        final var halfFov = FastMath.toRadians(fovDeg * 0.5);
        final var scale = 1 + altitudeKm / FOOTPRINT_EARTH_RADIUS_KM;

        final var farArg = clampUnit(FastMath.sin(offNadir + halfFov) * scale);
        final var nearArg = clampUnit(FastMath.sin(offNadir - halfFov) * scale);

        return FOOTPRINT_EARTH_RADIUS_KM * (
                (FastMath.asin(farArg) - offNadir - halfFov)
                        - (FastMath.asin(nearArg) - offNadir + halfFov));
    }

    private static double clampUnit(final double value) {
        return FastMath.max(-1.0, FastMath.min(1.0, value));
    }
}
