package io.github.jakubt4.eosensor.service.revisit;

import io.github.jakubt4.eosensor.dto.OrbitalElements;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out satellites of common constellation patterns as circular-orbit elements.
 */
public final class ConstellationBuilder {

    private ConstellationBuilder() {
    }

    /**
     * Walker-delta pattern {@code i: T/P/F}. Planes are spread evenly over 360 degrees of RAAN,
     * satellites evenly within each plane, and plane {@code p} is shifted by {@code 360·F·p/T}
     * degrees of anomaly.
     *
     * @param totalSatellites T, a multiple of {@code planes}
     * @param planes          P
     * @param phasing         F, in [0, P-1]
     * @throws IllegalArgumentException if T is not a positive multiple of P or F is out of range
     */
    public static List<OrbitalElements> walkerDelta(final double altitudeKm, final double inclinationDeg,
                                                    final int totalSatellites, final int planes, final int phasing) {
        if (planes <= 0 || totalSatellites <= 0 || totalSatellites % planes != 0) {
            throw new IllegalArgumentException("Walker pattern needs T to be a positive multiple of P, got T="
                    + totalSatellites + " P=" + planes);
        }
        if (phasing < 0 || phasing >= planes) {
            throw new IllegalArgumentException("Walker phasing must be in [0, " + (planes - 1) + "], got " + phasing);
        }

        final var perPlane = totalSatellites / planes;
        final var satellites = new ArrayList<OrbitalElements>(totalSatellites);
        for (var plane = 0; plane < planes; plane++) {
            final var raan = 360.0 * plane / planes;
            for (var slot = 0; slot < perPlane; slot++) {
                final var anomaly = normalize(360.0 * slot / perPlane + 360.0 * phasing * plane / totalSatellites);
                satellites.add(new OrbitalElements(altitudeKm, inclinationDeg, raan, anomaly));
            }
        }
        return satellites;
    }

    /**
     * Satellites following each other in one plane, {@code spacingDeg} apart in anomaly.
     */
    public static List<OrbitalElements> train(final OrbitalElements leader, final int count, final double spacingDeg) {
        final var satellites = new ArrayList<OrbitalElements>(count);
        for (var i = 0; i < count; i++) {
            satellites.add(new OrbitalElements(leader.altitude(), leader.inclination(), leader.raan(),
                    normalize(leader.trueAnomaly() + i * spacingDeg)));
        }
        return satellites;
    }

    private static double normalize(final double angleDeg) {
        var result = angleDeg % 360.0;
        if (result < 0) {
            result += 360.0;
        }
        return result;
    }
}
