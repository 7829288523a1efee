package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.GeodeticPosition;
import io.github.jakubt4.eosensor.dto.TleElements;
import io.github.jakubt4.eosensor.service.tle.TleConversionTrace;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Sub-satellite point at the TLE epoch from mean Keplerian elements.
 *
 * <p>Elements are taken as osculating two-body elements; no SGP4 perturbations are applied.
 * Earth orientation is GMST only (no precession, nutation or polar motion).
 */
@Slf4j
@Service
public class TleGeodeticConverter {

    static final double MU_KM3_S2 = Constants.WGS84_EARTH_MU / 1e9;
    static final double EQUATORIAL_RADIUS_KM = Constants.WGS84_EARTH_EQUATORIAL_RADIUS / 1000.0;
    private static final double FLATTENING = Constants.WGS84_EARTH_FLATTENING;
    private static final double ECCENTRICITY_SQUARED = FLATTENING * (2 - FLATTENING);

    private static final double KEPLER_TOLERANCE = 1e-8;
    private static final int KEPLER_MAX_ITERATIONS = 100;
    private static final int GEODETIC_ITERATIONS = 5;
    private static final double JD_J2000 = 2451545.0;

    private final TleConversionTrace trace;

    public TleGeodeticConverter() {
        this(TleConversionTrace.NO_OP);
    }

    @Autowired
    public TleGeodeticConverter(final TleConversionTrace trace) {
        this.trace = trace;
    }

    public GeodeticPosition toGeodetic(final TleElements elements) {
        final var a = semiMajorAxis(elements.meanMotion());
        trace.stage("semi-major-axis", a);

        final var e = elements.eccentricity();
        final var eccentricAnomaly = solveKepler(FastMath.toRadians(elements.meanAnomaly()), e);
        trace.stage("eccentric-anomaly", FastMath.toDegrees(eccentricAnomaly));

        final var trueAnomaly = trueAnomaly(eccentricAnomaly, e);
        trace.stage("true-anomaly", FastMath.toDegrees(trueAnomaly));

        final var perifocal = new double[] {
            a * (FastMath.cos(eccentricAnomaly) - e),
            a * FastMath.sqrt(1 - e * e) * FastMath.sin(eccentricAnomaly),
            0.0
        };
        final var eci = perifocalToEci(perifocal,
                FastMath.toRadians(elements.argumentOfPerigee()),
                FastMath.toRadians(elements.inclination()),
                FastMath.toRadians(elements.raan()));
        trace.stage("eci", eci);

        final var jd = julianDate(elements.epochYear(), elements.epochDay());
        trace.stage("julian-date", jd);
        final var gmstDeg = gmstDegrees(jd);
        trace.stage("gmst", gmstDeg);

        final var ecef = rotateZ(eci, -FastMath.toRadians(gmstDeg));
        trace.stage("ecef", ecef);

        final var position = ecefToGeodetic(ecef);
        trace.stage("geodetic", position.latitude(), position.longitude(), position.altitude());

        log.debug("TLE epoch {}/{} -> lat={} lon={} alt={} km", elements.epochYear(), elements.epochDay(),
                String.format("%.4f", position.latitude()),
                String.format("%.4f", position.longitude()),
                String.format("%.3f", position.altitude()));
        return position;
    }

    /**
     * Semi-major axis in km from mean motion in revolutions per day.
     */
    static double semiMajorAxis(final double meanMotionRevPerDay) {
        final var n = meanMotionRevPerDay * 2 * FastMath.PI / 86400.0;
        return FastMath.cbrt(MU_KM3_S2 / (n * n));
    }

    /**
     * Newton-Raphson solution of {@code E - e sin E = M}. Returns the last iterate when the
     * iteration cap is reached.
     */
    static double solveKepler(final double meanAnomaly, final double e) {
        var eccentricAnomaly = e < 0.8 ? meanAnomaly : FastMath.PI;
        for (var i = 0; i < KEPLER_MAX_ITERATIONS; i++) {
            final var delta = (eccentricAnomaly - e * FastMath.sin(eccentricAnomaly) - meanAnomaly)
                    / (1 - e * FastMath.cos(eccentricAnomaly));
            eccentricAnomaly -= delta;
            if (FastMath.abs(delta) < KEPLER_TOLERANCE) {
                break;
            }
        }
        return eccentricAnomaly;
    }

    static double trueAnomaly(final double eccentricAnomaly, final double e) {
        return 2 * FastMath.atan2(
                FastMath.sqrt(1 + e) * FastMath.sin(eccentricAnomaly / 2),
                FastMath.sqrt(1 - e) * FastMath.cos(eccentricAnomaly / 2));
    }

    private static double[] perifocalToEci(final double[] r, final double argumentOfPerigee,
                                           final double inclination, final double raan) {
        final var cosO = FastMath.cos(raan);
        final var sinO = FastMath.sin(raan);
        final var cosI = FastMath.cos(inclination);
        final var sinI = FastMath.sin(inclination);
        final var cosW = FastMath.cos(argumentOfPerigee);
        final var sinW = FastMath.sin(argumentOfPerigee);

        final double[][] rotation = {
            {cosO * cosW - sinO * sinW * cosI, -cosO * sinW - sinO * cosW * cosI, sinO * sinI},
            {sinO * cosW + cosO * sinW * cosI, -sinO * sinW + cosO * cosW * cosI, -cosO * sinI},
            {sinW * sinI, cosW * sinI, cosI}
        };

        final var result = new double[3];
        for (var row = 0; row < 3; row++) {
            result[row] = rotation[row][0] * r[0] + rotation[row][1] * r[1] + rotation[row][2] * r[2];
        }
        return result;
    }

    /**
     * Julian date of a TLE epoch, where day 1.0 is 00:00 UTC on January 1st.
     */
    static double julianDate(final int year, final double dayOfYear) {
        // Meeus, with January treated as month 13 of the previous year
        final var adjustedYear = year - 1;
        final var month = 13;
        final var century = adjustedYear / 100;
        final var b = 2 - century + century / 4;
        final var januaryFirst = FastMath.floor(365.25 * (adjustedYear + 4716))
                + FastMath.floor(30.6001 * (month + 1)) + 1 + b - 1524.5;
        return januaryFirst + dayOfYear - 1;
    }

    /**
     * Greenwich mean sidereal time in degrees, [0, 360).
     */
    static double gmstDegrees(final double jd) {
        final var t = (jd - JD_J2000) / 36525.0;
        var gmst = 280.46061837 + 360.98564736629 * (jd - JD_J2000)
                + 0.000387933 * t * t - t * t * t / 38710000.0;
        gmst %= 360.0;
        if (gmst < 0) {
            gmst += 360.0;
        }
        return gmst;
    }

    static double[] rotateZ(final double[] v, final double angle) {
        final var cos = FastMath.cos(angle);
        final var sin = FastMath.sin(angle);
        return new double[] {cos * v[0] - sin * v[1], sin * v[0] + cos * v[1], v[2]};
    }

    static GeodeticPosition ecefToGeodetic(final double[] ecef) {
        final var x = ecef[0];
        final var y = ecef[1];
        final var z = ecef[2];
        final var p = FastMath.sqrt(x * x + y * y);
        final var longitude = FastMath.atan2(y, x);

        var latitude = FastMath.atan2(z, p * (1 - ECCENTRICITY_SQUARED));
        for (var i = 0; i < GEODETIC_ITERATIONS; i++) {
            final var n = primeVerticalRadius(latitude);
            final var h = p / FastMath.cos(latitude) - n;
            latitude = FastMath.atan2(z, p * (1 - ECCENTRICITY_SQUARED * n / (n + h)));
        }
        final var height = p / FastMath.cos(latitude) - primeVerticalRadius(latitude);

        return new GeodeticPosition(FastMath.toDegrees(latitude), FastMath.toDegrees(longitude), height);
    }

    private static double primeVerticalRadius(final double latitude) {
        final var sin = FastMath.sin(latitude);
        return EQUATORIAL_RADIUS_KM / FastMath.sqrt(1 - ECCENTRICITY_SQUARED * sin * sin);
    }
}
