package io.github.jakubt4.eosensor.service.tle;

import io.github.jakubt4.eosensor.dto.OrbitalElements;
import io.github.jakubt4.eosensor.dto.TleRecord;
import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Writes circular-orbit elements as a 69-column two-line element set.
 *
 * <p>Drag terms are zero, eccentricity and argument of perigee are zero, and the mean anomaly
 * equals the true anomaly.
 */
public final class TleGenerator {

    private static final double MU_KM3_S2 = Constants.WGS84_EARTH_MU / 1e9;
    private static final double EQUATORIAL_RADIUS_KM = Constants.WGS84_EARTH_EQUATORIAL_RADIUS / 1000.0;
    private static final double SECONDS_PER_DAY = 86400.0;

    private TleGenerator() {
    }

    public static TleRecord generate(final String satelliteName, final int satelliteNumber,
                                     final OrbitalElements elements, final Instant epoch) {
        if (satelliteNumber < 0 || satelliteNumber > 99999) {
            throw new IllegalArgumentException("Satellite number must fit in five digits, got " + satelliteNumber);
        }

        final var utc = epoch.atOffset(ZoneOffset.UTC);
        final var dayOfYear = utc.getDayOfYear()
                + utc.toLocalTime().toNanoOfDay() / (SECONDS_PER_DAY * 1e9);

        final var line1 = withChecksum(String.format(Locale.ROOT,
                "1 %05dU 00001A   %02d%012.8f  .00000000  00000-0  00000-0 0  999",
                satelliteNumber, utc.getYear() % 100, dayOfYear));

        final var line2 = withChecksum(String.format(Locale.ROOT,
                "2 %05d %8.4f %8.4f 0000000 %8.4f %8.4f %11.8f00000",
                satelliteNumber,
                normalize(elements.inclination()),
                normalize(elements.raan()),
                0.0,
                normalize(elements.trueAnomaly()),
                meanMotionRevPerDay(elements.altitude())));

        return TleParser.parse(satelliteName, line1, line2);
    }

    /**
     * Mean motion of a circular orbit at {@code altitudeKm} above the WGS-84 equatorial radius.
     */
    public static double meanMotionRevPerDay(final double altitudeKm) {
        final var semiMajorAxis = EQUATORIAL_RADIUS_KM + altitudeKm;
        return FastMath.sqrt(MU_KM3_S2 / (semiMajorAxis * semiMajorAxis * semiMajorAxis))
                * SECONDS_PER_DAY / (2 * FastMath.PI);
    }

    /**
     * Appends the modulo-10 checksum: digits count at face value, minus signs as one.
     */
    static String withChecksum(final String line) {
        var sum = 0;
        for (var i = 0; i < line.length(); i++) {
            final var c = line.charAt(i);
            if (Character.isDigit(c)) {
                sum += c - '0';
            } else if (c == '-') {
                sum++;
            }
        }
        return line + (sum % 10);
    }

    private static double normalize(final double angleDeg) {
        var result = angleDeg % 360.0;
        if (result < 0) {
            result += 360.0;
        }
        // %8.4f would round 359.99996 up to 360.0000
        return result >= 359.99995 ? 0.0 : result;
    }
}
