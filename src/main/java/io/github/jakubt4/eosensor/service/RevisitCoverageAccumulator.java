package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.DaytimeWindow;
import io.github.jakubt4.eosensor.dto.GroundTrackPoint;
import io.github.jakubt4.eosensor.dto.OrbitalElements;
import io.github.jakubt4.eosensor.dto.RevisitGrid;
import io.github.jakubt4.eosensor.dto.RevisitResult;
import io.github.jakubt4.eosensor.dto.TleRecord;
import io.github.jakubt4.eosensor.service.revisit.RevisitStatisticsCalculator;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Accumulates how often the sensor swath of one or more satellites covers each cell of a
 * global latitude/longitude grid.
 *
 * <p>Every ground-track sample adds one to each cell inside the swath bounding box. Increments
 * commute, so neither satellite order nor sample order changes the result. Each call starts
 * from an empty grid.
 */
@Slf4j
@Service
public class RevisitCoverageAccumulator {

    private static final double KM_PER_DEGREE = 111.0;
    private static final double MIN_LATITUDE_COSINE = 0.1;
    private static final int MINUTES_PER_DAY = 24 * 60;

    private final OrbitPropagator orbitPropagator;
    private final RevisitStatisticsCalculator statisticsCalculator;
    private final double sensorHalfAngleDeg;

    public RevisitCoverageAccumulator(final OrbitPropagator orbitPropagator) {
        this(orbitPropagator, new RevisitStatisticsCalculator(), 10.0);
    }

    @Autowired
    public RevisitCoverageAccumulator(final OrbitPropagator orbitPropagator,
                                      final RevisitStatisticsCalculator statisticsCalculator,
                                      @Value("${eo.revisit.sensor-half-angle-deg:10.0}") final double sensorHalfAngleDeg) {
        this.orbitPropagator = orbitPropagator;
        this.statisticsCalculator = statisticsCalculator;
        this.sensorHalfAngleDeg = sensorHalfAngleDeg;
    }

    /**
     * Builds a {@code gridResolution x 2*gridResolution} revisit grid over {@code timeSpanHours}.
     */
    public RevisitGrid accumulate(final List<OrbitalElements> satellites, final double timeSpanHours,
                                  final int gridResolution) {
        return accumulate(satellites, timeSpanHours, gridResolution, OrbitPropagator.J2000, null);
    }

    /**
     * As {@link #accumulate(List, double, int)}, starting at {@code start} and optionally counting
     * only samples taken during local daytime.
     *
     * @param daytimeWindow local solar time window, or {@code null} to count every sample
     */
    public RevisitGrid accumulate(final List<OrbitalElements> satellites, final double timeSpanHours,
                                  final int gridResolution, final Instant start, final DaytimeWindow daytimeWindow) {
        if (gridResolution <= 0) {
            return new RevisitGrid(new int[0][0]);
        }
        final var tracks = satellites.stream()
                .map(satellite -> new SwathTrack(swathHalfWidthDeg(satellite.altitude()),
                        orbitPropagator.propagate(satellite, timeSpanHours, start)))
                .toList();
        return accumulateTracks(tracks, gridResolution, daytimeWindow);
    }

    /**
     * As {@link #accumulate(List, double, int, Instant, DaytimeWindow)} for satellites given as
     * two-line element sets, propagated with SGP4. The swath width follows each set's mean altitude.
     */
    public RevisitGrid accumulateTles(final List<TleRecord> satellites, final double timeSpanHours,
                                      final int gridResolution, final Instant start,
                                      final DaytimeWindow daytimeWindow) {
        if (gridResolution <= 0) {
            return new RevisitGrid(new int[0][0]);
        }
        final var tracks = satellites.stream()
                .map(tle -> new SwathTrack(swathHalfWidthDeg(OrbitPropagator.meanAltitudeKm(tle.elements())),
                        orbitPropagator.propagate(tle, timeSpanHours, start)))
                .toList();
        return accumulateTracks(tracks, gridResolution, daytimeWindow);
    }

    private RevisitGrid accumulateTracks(final List<SwathTrack> tracks, final int gridResolution,
                                         final DaytimeWindow daytimeWindow) {
        final var rows = gridResolution;
        final var columns = gridResolution * 2;
        final var cells = new int[rows][columns];

        var counted = 0;
        for (final var track : tracks) {
            for (final var point : track.points()) {
                if (daytimeWindow != null && !daytimeWindow.contains(localSolarTime(point))) {
                    continue;
                }
                cover(cells, point, track.halfWidthDeg());
                counted++;
            }
        }

        final var grid = new RevisitGrid(cells);
        log.debug("Revisit grid {}x{}: {} satellites, {} samples counted, max count {}",
                rows, columns, tracks.size(), counted, grid.maxCount());
        return grid;
    }

    /**
     * Accumulates the grid and summarizes it.
     */
    public RevisitResult analyze(final List<OrbitalElements> satellites, final double timeSpanHours,
                                 final int gridResolution, final Instant start, final DaytimeWindow daytimeWindow) {
        final var grid = accumulate(satellites, timeSpanHours, gridResolution, start, daytimeWindow);
        return new RevisitResult(grid, statisticsCalculator.summarize(grid, timeSpanHours));
    }

    /**
     * Accumulates the grid from two-line element sets and summarizes it.
     */
    public RevisitResult analyzeTles(final List<TleRecord> satellites, final double timeSpanHours,
                                     final int gridResolution, final Instant start,
                                     final DaytimeWindow daytimeWindow) {
        final var grid = accumulateTles(satellites, timeSpanHours, gridResolution, start, daytimeWindow);
        return new RevisitResult(grid, statisticsCalculator.summarize(grid, timeSpanHours));
    }

    /**
     * Half-width of the instantaneous swath in degrees of arc, small-angle approximation.
     */
    double swathHalfWidthDeg(final double altitudeKm) {
        return altitudeKm * FastMath.tan(FastMath.toRadians(sensorHalfAngleDeg)) / KM_PER_DEGREE;
    }

    private static void cover(final int[][] cells, final GroundTrackPoint point, final double halfWidthDeg) {
        final var rows = cells.length;
        final var columns = cells[0].length;

        final var minLat = FastMath.max(-90.0, point.latitude() - halfWidthDeg);
        final var maxLat = FastMath.min(90.0, point.latitude() + halfWidthDeg);
        final var latCosine = FastMath.max(MIN_LATITUDE_COSINE, FastMath.cos(FastMath.toRadians(point.latitude())));
        final var lonHalfWidth = halfWidthDeg / latCosine;
        final var minLon = point.longitude() - lonHalfWidth;
        final var maxLon = point.longitude() + lonHalfWidth;

        // Northern edge maps to the smaller row index
        final var firstRow = rowIndex(maxLat, rows);
        final var lastRow = rowIndex(minLat, rows);
        final var firstColumn = columnIndex(minLon, columns);
        final var lastColumn = columnIndex(maxLon, columns);

        for (var row = firstRow; row <= lastRow; row++) {
            for (var column = firstColumn; column <= lastColumn; column++) {
                cells[row][column]++;
            }
        }
    }

    static int rowIndex(final double latitude, final int rows) {
        final var index = (int) FastMath.floor((90 - latitude) * rows / 180.0);
        return clamp(index, rows);
    }

    static int columnIndex(final double longitude, final int columns) {
        final var index = (int) FastMath.floor((longitude + 180) * columns / 360.0);
        return clamp(index, columns);
    }

    private static int clamp(final int index, final int size) {
        return FastMath.max(0, FastMath.min(size - 1, index));
    }

    /**
     * Local solar time in HHMM form, from UTC shifted by longitude / 15 hours.
     */
    static int localSolarTime(final GroundTrackPoint point) {
        final var utc = point.timestamp().atOffset(ZoneOffset.UTC);
        final var hours = utc.getHour() + utc.getMinute() / 60.0 + point.longitude() / 15.0;
        var minutes = (int) FastMath.round(hours * 60) % MINUTES_PER_DAY;
        if (minutes < 0) {
            minutes += MINUTES_PER_DAY;
        }
        return minutes / 60 * 100 + minutes % 60;
    }

    private record SwathTrack(double halfWidthDeg, List<GroundTrackPoint> points) {
    }
}
