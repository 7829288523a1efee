package io.github.jakubt4.eosensor.service;

import io.github.jakubt4.eosensor.dto.SensorInputs;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SensorGeometryCalculatorTest {

    // 500 km imager, 1 m focal length, 5 um pixels
    private static final SensorInputs REFERENCE = SensorInputs.builder()
            .pixelSize(5.0)
            .pixelCountH(4096)
            .pixelCountV(4096)
            .gsdRequirements(0.5)
            .altitudeMin(500_000)
            .altitudeMax(500_000)
            .focalLength(1000)
            .aperture(300)
            .attitudeAccuracy(0.001)
            .nominalOffNadirAngle(0)
            .maxOffNadirAngle(30)
            .gpsAccuracy(5)
            .build();

    private final SensorGeometryCalculator calculator = new SensorGeometryCalculator();

    @Test
    void nominalCenterPixelIsAboutTwoAndAHalfMeters() {
        final var results = calculator.compute(REFERENCE);

        assertThat(results.nominal().centerPixelSize()).isCloseTo(2.5, within(0.05));
        assertThat(results.nominal().offNadirAngle()).isZero();
    }

    @Test
    void nominalCaseIsEvaluatedAtNadirWhateverTheNominalAngle() {
        final var tilted = REFERENCE.toBuilder().nominalOffNadirAngle(15).build();

        final var results = calculator.compute(tilted);

        assertThat(results.nominal().offNadirAngle()).isZero();
        assertThat(results.nominal().centerPixelSize())
                .isEqualTo(calculator.compute(REFERENCE).nominal().centerPixelSize());
    }

    @Test
    void worstCaseDegradesGroundPixel() {
        final var results = calculator.compute(REFERENCE);

        assertThat(results.worstCase().centerPixelSize()).isGreaterThan(results.nominal().centerPixelSize());
        assertThat(results.worstCase().edgePixelSize()).isGreaterThan(results.nominal().edgePixelSize());
        assertThat(results.worstCase().rssError()).isGreaterThan(results.nominal().rssError());
    }

    @Test
    void edgePixelIsLargerThanCenterPixel() {
        final var results = calculator.compute(REFERENCE);

        assertThat(results.nominal().edgePixelSize()).isGreaterThan(results.nominal().centerPixelSize());
        assertThat(results.worstCase().edgePixelSize()).isGreaterThan(results.worstCase().centerPixelSize());
    }

    @Test
    void derivesOpticsSummary() {
        final var optics = calculator.compute(REFERENCE).optics();

        assertThat(optics.ifov()).isCloseTo(5e-6, within(1e-12));
        assertThat(optics.fNumber()).isCloseTo(1000.0 / 300.0, within(1e-12));
        // 20.48 mm detector behind a 1000 mm lens
        assertThat(optics.horizontalFov()).isCloseTo(1.1735, within(0.001));
        assertThat(optics.verticalFov()).isEqualTo(optics.horizontalFov());
        assertThat(optics.focalLengthForGsd()).isCloseTo(5000.0, within(1e-9));
    }

    @Test
    void pointingErrorsFollowOffNadirAmplification() {
        final var results = calculator.compute(REFERENCE);
        final var nominal = results.nominal();
        final var worst = results.worstCase();

        // 500 km x 0.001 deg
        assertThat(nominal.rollEdgeChange()).isCloseTo(8.7266, within(0.001));
        assertThat(nominal.pitchEdgeChange()).isEqualTo(nominal.rollEdgeChange());
        assertThat(worst.pitchEdgeChange()).isEqualTo(worst.yawEdgeChange());
        assertThat(worst.rollEdgeChange()).isGreaterThan(worst.pitchEdgeChange());
        assertThat(worst.gpsError()).isEqualTo(5.0);

        final var expectedRss = Math.sqrt(worst.rollEdgeChange() * worst.rollEdgeChange()
                + worst.pitchEdgeChange() * worst.pitchEdgeChange()
                + worst.yawEdgeChange() * worst.yawEdgeChange()
                + 25.0);
        assertThat(worst.rssError()).isCloseTo(expectedRss, within(1e-9));
    }

    @Test
    void footprintsAreWiderOffNadir() {
        final var results = calculator.compute(REFERENCE);

        // ~10.24 km swath at nadir
        assertThat(results.nominal().horizontalFootprint()).isCloseTo(10.24, within(0.1));
        assertThat(results.worstCase().horizontalFootprint()).isGreaterThan(results.nominal().horizontalFootprint());
        assertThat(results.nominal().earthCenterAngle()).isPositive();
    }

    @Test
    void metricsMapKeepsDeclarationOrder() {
        final var map = calculator.compute(REFERENCE).nominal().asMap();

        assertThat(map).hasSize(11);
        assertThat(map.keySet()).startsWith("offNadirAngle", "centerPixelSize", "edgePixelSize");
        assertThat(map.keySet()).endsWith("rssError");
    }

    @Test
    void nonPositiveFocalLengthSurfacesAsNonFiniteMetrics() {
        final var results = calculator.compute(REFERENCE.toBuilder().focalLength(0).build());

        assertThat(results.optics().ifov()).isInfinite();
        assertThat(results.nominal().centerPixelSize()).isNaN();
    }
}
