package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.GroundTrackPoint;
import io.github.jakubt4.eosensor.dto.OrbitalElements;
import io.github.jakubt4.eosensor.dto.TleElements;
import io.github.jakubt4.eosensor.dto.TleRecord;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.orekit.attitudes.FrameAlignedProvider;
import org.orekit.errors.OrekitException;
import org.orekit.frames.FramesFactory;
import org.orekit.propagation.Propagator;
import org.orekit.propagation.analytical.tle.TLE;
import org.orekit.propagation.analytical.tle.TLEPropagator;
import org.orekit.time.TimeScalesFactory;
import org.orekit.utils.Constants;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Two-body ground-track propagation for circular orbits.
 *
 * <p>The satellite moves at constant angular rate in a plane oriented by inclination and
 * RAAN; the Earth turns underneath it at the sidereal rate. Output size is bounded: long
 * spans are subsampled rather than producing more points.
 *
 * <p>Two-line element sets are propagated with Orekit's SGP4/SDP4 instead. No Orekit data
 * context is needed: epochs are read on the TAI scale (UTC-TAI leap seconds are ignored), SGP4
 * output is taken as-is in its TEME frame, and the Earth is rotated by GMST only, the same
 * model {@link TleGeodeticConverter} uses.
 */
@Slf4j
@Service
public class OrbitPropagator {

    /** J2000 reference epoch, used when the caller supplies no start time. */
    public static final Instant J2000 = Instant.parse("2000-01-01T12:00:00Z");

    public static final double MEAN_EARTH_RADIUS_KM = 6371.0;

    private static final double MU_KM3_S2 = Constants.WGS84_EARTH_MU / 1e9;
    private static final double EARTH_ROTATION_DEG_PER_MIN =
            FastMath.toDegrees(Constants.WGS84_EARTH_ANGULAR_VELOCITY) * 60.0;

    private static final double LONGITUDE_REDUCTION_THRESHOLD = 1e6;

    private final int minSamples;
    private final int maxSamples;

    public OrbitPropagator() {
        this(100, 500);
    }

    @Autowired
    public OrbitPropagator(@Value("${eo.orbit.min-samples:100}") final int minSamples,
                           @Value("${eo.orbit.max-samples:500}") final int maxSamples) {
        this.minSamples = minSamples;
        this.maxSamples = maxSamples;
    }

    public List<GroundTrackPoint> propagate(final OrbitalElements elements, final double timeSpanHours) {
        return propagate(elements, timeSpanHours, J2000);
    }

    /**
     * Samples the ground track over {@code timeSpanHours} starting at {@code start}.
     *
     * @return a fresh list of between {@code minSamples} and {@code maxSamples} points, in time order
     */
    public List<GroundTrackPoint> propagate(final OrbitalElements elements, final double timeSpanHours,
                                            final Instant start) {
        final var totalMinutes = timeSpanHours * 60.0;
        final var sampleCount = sampleCount(totalMinutes);

        final var meanMotionRadPerMin = 2 * FastMath.PI / orbitalPeriodMinutes(elements.altitude());
        final var inclination = FastMath.toRadians(elements.inclination());
        final var raan = FastMath.toRadians(elements.raan());
        final var initialAnomaly = FastMath.toRadians(elements.trueAnomaly());

        final var cosInc = FastMath.cos(inclination);
        final var sinInc = FastMath.sin(inclination);
        final var cosRaan = FastMath.cos(raan);
        final var sinRaan = FastMath.sin(raan);

        final var track = new ArrayList<GroundTrackPoint>(sampleCount);
        for (var i = 0; i < sampleCount; i++) {
            final var timeMinutes = i * totalMinutes / sampleCount;
            final var anomaly = initialAnomaly + meanMotionRadPerMin * timeMinutes;

            // Unit position in the orbital plane, rotated by inclination then RAAN
            final var xOrbit = FastMath.cos(anomaly);
            final var yOrbit = FastMath.sin(anomaly);
            final var x = xOrbit * cosRaan - yOrbit * cosInc * sinRaan;
            final var y = xOrbit * sinRaan + yOrbit * cosInc * cosRaan;
            final var z = yOrbit * sinInc;

            final var latitude = FastMath.toDegrees(FastMath.asin(z));
            final var longitude = normalizeLongitude(
                    FastMath.toDegrees(FastMath.atan2(y, x)) - EARTH_ROTATION_DEG_PER_MIN * timeMinutes);

            final var timestamp = start.plus(Duration.ofMillis(FastMath.round(timeMinutes * 60_000.0)));
            track.add(new GroundTrackPoint(latitude, longitude, timestamp));
        }

        log.debug("Propagated {} ground-track samples over {} h (alt={} km, inc={} deg)",
                sampleCount, timeSpanHours, elements.altitude(), elements.inclination());
        return track;
    }

    /**
     * SGP4 ground track of a two-line element set, starting at its epoch.
     */
    public List<GroundTrackPoint> propagate(final TleRecord tle, final double timeSpanHours) {
        return propagate(tle, timeSpanHours, epoch(tle.elements()));
    }

    /**
     * SGP4 ground track over {@code timeSpanHours} starting at {@code start}, with the same
     * sample count as the circular model. Samples SGP4 cannot compute (e.g. after decay) are
     * skipped, so the track may be shorter.
     *
     * @throws OrekitException if the element set cannot be read by Orekit
     */
    public List<GroundTrackPoint> propagate(final TleRecord tle, final double timeSpanHours, final Instant start) {
        final var totalMinutes = timeSpanHours * 60.0;
        final var sampleCount = sampleCount(totalMinutes);

        final var teme = FramesFactory.getGCRF();
        final var orekitTle = new TLE(tle.line1(), tle.line2(), TimeScalesFactory.getTAI());
        final var propagator = TLEPropagator.selectExtrapolator(orekitTle,
                new FrameAlignedProvider(teme), Propagator.DEFAULT_MASS, teme);

        final var elements = tle.elements();
        final var epochJulianDate = TleGeodeticConverter.julianDate(elements.epochYear(), elements.epochDay());
        final var startOffsetSeconds = Duration.between(epoch(elements), start).toMillis() / 1000.0;

        final var track = new ArrayList<GroundTrackPoint>(sampleCount);
        var skipped = 0;
        for (var i = 0; i < sampleCount; i++) {
            final var timeMinutes = i * totalMinutes / sampleCount;
            final var sinceEpochSeconds = startOffsetSeconds + timeMinutes * 60.0;
            try {
                final var position = propagator
                        .getPVCoordinates(orekitTle.getDate().shiftedBy(sinceEpochSeconds), teme)
                        .getPosition();
                final var eciKm = new double[] {position.getX() / 1000.0, position.getY() / 1000.0,
                    position.getZ() / 1000.0};
                final var gmst = TleGeodeticConverter.gmstDegrees(epochJulianDate + sinceEpochSeconds / 86400.0);
                final var geodetic = TleGeodeticConverter.ecefToGeodetic(
                        TleGeodeticConverter.rotateZ(eciKm, -FastMath.toRadians(gmst)));

                final var timestamp = start.plus(Duration.ofMillis(FastMath.round(timeMinutes * 60_000.0)));
                track.add(new GroundTrackPoint(geodetic.latitude(), normalizeLongitude(geodetic.longitude()),
                        timestamp));
            } catch (final OrekitException e) {
                skipped++;
                log.debug("[{}] SGP4 sample at +{} min skipped: {}", tle.satelliteName(),
                        String.format("%.1f", timeMinutes), e.getMessage());
            }
        }

        if (skipped > 0) {
            log.warn("[{}] {} of {} SGP4 samples could not be propagated", tle.satelliteName(), skipped, sampleCount);
        }
        log.debug("Propagated {} SGP4 ground-track samples over {} h for [{}]",
                track.size(), timeSpanHours, tle.satelliteName());
        return track;
    }

    /**
     * Epoch of an element set, day 1.0 being 00:00 UTC on January 1st.
     */
    public static Instant epoch(final TleElements elements) {
        final var januaryFirst = LocalDate.of(elements.epochYear(), 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC);
        return januaryFirst.plus(Duration.ofNanos(FastMath.round((elements.epochDay() - 1) * 86400e9)));
    }

    /**
     * Mean altitude above the WGS-84 equatorial radius implied by the element set's mean motion.
     */
    public static double meanAltitudeKm(final TleElements elements) {
        return TleGeodeticConverter.semiMajorAxis(elements.meanMotion()) - TleGeodeticConverter.EQUATORIAL_RADIUS_KM;
    }

    /**
     * Circular-orbit period from Kepler's third law, with the semi-major axis measured
     * from the mean Earth radius.
     */
    public static double orbitalPeriodMinutes(final double altitudeKm) {
        final var semiMajorAxis = MEAN_EARTH_RADIUS_KM + altitudeKm;
        return 2 * FastMath.PI * FastMath.sqrt(semiMajorAxis * semiMajorAxis * semiMajorAxis / MU_KM3_S2) / 60.0;
    }

    int sampleCount(final double totalMinutes) {
        final var requested = (int) FastMath.floor(totalMinutes / 2);
        return FastMath.max(minSamples, FastMath.min(maxSamples, requested));
    }

    /**
     * Wraps into [-180, 180] by repeated 360 degree shifts. Values far outside the range are
     * first reduced with a single remainder so the loops stay short.
     */
    static double normalizeLongitude(final double longitude) {
        var result = FastMath.abs(longitude) > LONGITUDE_REDUCTION_THRESHOLD
                ? FastMath.IEEEremainder(longitude, 360.0)
                : longitude;
        while (result > 180) {
            result -= 360;
        }
        while (result < -180) {
            result += 360;
        }
        return result;
    }
}
