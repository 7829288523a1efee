package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.CalculationResults;
import io.github.jakubt4.eosensor.dto.DeconvolutionMethod;
import io.github.jakubt4.eosensor.dto.GeodeticPosition;
import io.github.jakubt4.eosensor.dto.GroundTrackPoint;
import io.github.jakubt4.eosensor.dto.KernelParameters;
import io.github.jakubt4.eosensor.dto.MtfInputs;
import io.github.jakubt4.eosensor.dto.MtfResults;
import io.github.jakubt4.eosensor.dto.OrbitalElements;
import io.github.jakubt4.eosensor.dto.PsfInputs;
import io.github.jakubt4.eosensor.dto.PsfKernel;
import io.github.jakubt4.eosensor.dto.PsfKernelType;
import io.github.jakubt4.eosensor.dto.PsfResults;
import io.github.jakubt4.eosensor.dto.RevisitGrid;
import io.github.jakubt4.eosensor.dto.SensorInputs;
import io.github.jakubt4.eosensor.dto.TleElements;
import io.github.jakubt4.eosensor.dto.TleRecord;
import io.github.jakubt4.eosensor.service.tle.TleGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for presentation layers, with one method per modeling operation, each delegating
 * to its engine.
 *
 * @see SensorGeometryCalculator
 * @see OpticalTransferFunctionEngine
 * @see OrbitPropagator
 * @see RevisitCoverageAccumulator
 * @see TleGeodeticConverter
 * @see PsfKernelDeconvolver
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImagingAnalysisService {

    private final SensorGeometryCalculator sensorGeometryCalculator;
    private final OpticalTransferFunctionEngine opticalTransferFunctionEngine;
    private final OrbitPropagator orbitPropagator;
    private final RevisitCoverageAccumulator revisitCoverageAccumulator;
    private final TleGeodeticConverter tleGeodeticConverter;
    private final PsfKernelDeconvolver psfKernelDeconvolver;

    public CalculationResults computeSensorGeometry(final SensorInputs inputs) {
        final var results = sensorGeometryCalculator.compute(inputs);
        log.info("Sensor geometry computed — nominal GSD {} m, worst-case GSD {} m",
                String.format("%.2f", results.nominal().centerPixelSize()),
                String.format("%.2f", results.worstCase().centerPixelSize()));
        return results;
    }

    public PsfResults computePSF(final PsfInputs inputs) {
        final var results = opticalTransferFunctionEngine.computePsf(inputs);
        log.info("PSF computed — FWHM {} µm, Strehl {}",
                String.format("%.2f", results.psfFwhm()), String.format("%.3f", results.strehlRatio()));
        return results;
    }

    public MtfResults computeMTF(final MtfInputs inputs) {
        final var results = opticalTransferFunctionEngine.computeMtf(inputs);
        log.info("MTF computed — MTF50 {} cy/mm, Nyquist {} cy/mm",
                String.format("%.2f", results.mtf50()), String.format("%.2f", results.nyquistFrequency()));
        return results;
    }

    public List<GroundTrackPoint> propagateOrbit(final OrbitalElements elements, final double timeSpanHours) {
        final var track = orbitPropagator.propagate(elements, timeSpanHours);
        log.info("Orbit propagated — {} points over {} h", track.size(), timeSpanHours);
        return track;
    }

    public RevisitGrid accumulateRevisits(final List<OrbitalElements> satellites, final double timeSpanHours,
                                          final int gridResolution) {
        final var grid = revisitCoverageAccumulator.accumulate(satellites, timeSpanHours, gridResolution);
        log.info("Revisits accumulated — {} satellites, {}x{} grid, max count {}",
                satellites.size(), grid.rows(), grid.columns(), grid.maxCount());
        return grid;
    }

    public List<GroundTrackPoint> propagateTle(final TleRecord tle, final double timeSpanHours) {
        final var track = orbitPropagator.propagate(tle, timeSpanHours);
        log.info("TLE propagated — [{}], {} points over {} h", tle.satelliteName(), track.size(), timeSpanHours);
        return track;
    }

    public RevisitGrid accumulateTleRevisits(final List<TleRecord> satellites, final double timeSpanHours,
                                             final int gridResolution, final Instant start) {
        final var grid = revisitCoverageAccumulator.accumulateTles(satellites, timeSpanHours, gridResolution,
                start, null);
        log.info("TLE revisits accumulated — {} satellites, {}x{} grid, max count {}",
                satellites.size(), grid.rows(), grid.columns(), grid.maxCount());
        return grid;
    }

    /**
     * Writes one element set per satellite, named {@code <prefix>-<n>} and numbered from
     * {@code firstSatelliteNumber}, all sharing {@code epoch}.
     */
    public List<TleRecord> generateConstellationTles(final String namePrefix, final int firstSatelliteNumber,
                                                     final List<OrbitalElements> satellites, final Instant epoch) {
        final var tles = new ArrayList<TleRecord>(satellites.size());
        for (var i = 0; i < satellites.size(); i++) {
            tles.add(TleGenerator.generate(namePrefix + "-" + (i + 1), firstSatelliteNumber + i,
                    satellites.get(i), epoch));
        }
        log.info("Constellation TLEs generated — {} satellites, epoch {}", tles.size(), epoch);
        return tles;
    }

    public GeodeticPosition tleToGeodetic(final TleElements elements) {
        final var position = tleGeodeticConverter.toGeodetic(elements);
        log.info("TLE converted — lat={} lon={} alt={} km",
                String.format("%.4f", position.latitude()),
                String.format("%.4f", position.longitude()),
                String.format("%.2f", position.altitude()));
        return position;
    }

    public PsfKernel estimatePSFKernel(final PsfKernelType type, final KernelParameters params) {
        final var kernel = psfKernelDeconvolver.estimateKernel(type, params);
        log.info("PSF kernel estimated — {} {}x{}", type, kernel.size(), kernel.size());
        return kernel;
    }

    public double[][] deconvolve(final double[][] channel, final PsfKernel kernel, final int iterations) {
        final var restored = psfKernelDeconvolver.deconvolve(channel, kernel, iterations);
        log.info("Channel deconvolved — {} iterations", iterations);
        return restored;
    }

    public double[][] deconvolve(final double[][] channel, final PsfKernel kernel, final int iterations,
                                 final DeconvolutionMethod method) {
        final var restored = psfKernelDeconvolver.deconvolve(channel, kernel, iterations, method,
                PsfKernelDeconvolver.DEFAULT_REGULARIZATION, PsfKernelDeconvolver.DEFAULT_NOISE_VARIANCE);
        log.info("Channel deconvolved — {}, {} iterations", method, iterations);
        return restored;
    }
}
