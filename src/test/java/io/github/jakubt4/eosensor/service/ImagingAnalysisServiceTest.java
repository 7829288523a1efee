package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.DeconvolutionMethod;
import io.github.jakubt4.eosensor.dto.KernelParameters;
import io.github.jakubt4.eosensor.dto.OrbitalElements;
import io.github.jakubt4.eosensor.dto.PsfKernel;
import io.github.jakubt4.eosensor.dto.PsfKernelType;
import io.github.jakubt4.eosensor.dto.SensorInputs;
import io.github.jakubt4.eosensor.service.tle.TleConversionTrace;
import io.github.jakubt4.eosensor.service.tle.TleParser;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@SpringBootTest(properties = {"eo.orbit.max-samples=200", "eo.reference-scenario.enabled=true"})
class ImagingAnalysisServiceTest {

    private static final String TLE_LINE1 = "1 25544U 98067A   08264.51782528 -.00002182  00000-0 -11606-4 0  2927";
    private static final String TLE_LINE2 = "2 25544  51.6416 247.4627 0006703 130.5360 325.0288 15.72125391563537";

    @Autowired
    private ImagingAnalysisService imagingAnalysisService;

    @MockBean
    private TleConversionTrace tleConversionTrace;

    @Test
    void computesReferenceSensorGeometry() {
        final var inputs = SensorInputs.builder()
                .pixelSize(5.0).pixelCountH(4096).pixelCountV(4096).gsdRequirements(0.5)
                .altitudeMin(500_000).altitudeMax(500_000).focalLength(1000).aperture(300)
                .attitudeAccuracy(0.001).nominalOffNadirAngle(0).maxOffNadirAngle(30).gpsAccuracy(5)
                .build();

        final var results = imagingAnalysisService.computeSensorGeometry(inputs);

        assertThat(results.nominal().centerPixelSize()).isCloseTo(2.5, within(0.05));
        assertThat(results.worstCase().centerPixelSize()).isGreaterThan(results.nominal().centerPixelSize());
    }

    @Test
    void orbitSamplingUsesConfiguredBound() {
        final var track = imagingAnalysisService.propagateOrbit(new OrbitalElements(500, 97.4, 0, 0), 24);

        assertThat(track).hasSize(200);
    }

    @Test
    void accumulatesRevisitsThroughConfiguredPropagator() {
        final var grid = imagingAnalysisService.accumulateRevisits(
                List.of(new OrbitalElements(500, 97.4, 0, 0), new OrbitalElements(500, 97.4, 180, 0)), 12, 18);

        assertThat(grid.rows()).isEqualTo(18);
        assertThat(grid.columns()).isEqualTo(36);
        assertThat(grid.maxCount()).isPositive();
    }

    @Test
    void tleConversionReportsToInjectedTrace() {
        final var position = imagingAnalysisService.tleToGeodetic(TleParser.parse(null, TLE_LINE1, TLE_LINE2).elements());

        assertThat(position.altitude()).isPositive();
        verify(tleConversionTrace).stage(eq("geodetic"), any(double[].class));
    }

    @Test
    void estimatesKernelAndDeconvolves() {
        final var kernel = imagingAnalysisService.estimatePSFKernel(PsfKernelType.GAUSSIAN, KernelParameters.ofSize(5));
        final var channel = new double[][] {{0.1, 0.2}, {0.3, 0.4}};

        assertThat(kernel.sum()).isCloseTo(1.0, within(1e-12));
        assertThat(imagingAnalysisService.deconvolve(channel, PsfKernel.identity(3), 4)).isDeepEqualTo(channel);
    }

    @Test
    void generatedConstellationTlesFeedRevisitAccumulation() {
        final var epoch = Instant.parse("2024-03-01T00:00:00Z");
        final var tles = imagingAnalysisService.generateConstellationTles("EO", 90001,
                List.of(new OrbitalElements(500, 97.4, 0, 0), new OrbitalElements(500, 97.4, 180, 0)), epoch);

        final var grid = imagingAnalysisService.accumulateTleRevisits(tles, 12, 18, epoch);

        assertThat(tles).extracting(tle -> tle.satelliteName()).containsExactly("EO-1", "EO-2");
        assertThat(tles.get(1).line1()).startsWith("1 90002U");
        assertThat(grid.maxCount()).isPositive();
        assertThat(imagingAnalysisService.propagateTle(tles.get(0), 24)).hasSize(200);
    }

    @Test
    void deconvolvesWithSelectedMethod() {
        final var channel = new double[][] {{0.1, 0.2}, {0.3, 0.4}};

        assertThat(imagingAnalysisService.deconvolve(channel, PsfKernel.identity(2), 2, DeconvolutionMethod.BLIND))
                .isDeepEqualTo(channel);
    }
}
