package io.github.jakubt4.eosensor;

import io.github.jakubt4.eosensor.dto.GeometryMetrics;
import io.github.jakubt4.eosensor.dto.SensorInputs;
import io.github.jakubt4.eosensor.service.ImagingAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Logs the geometry of a 500 km, 1 m focal length reference imager at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "eo.reference-scenario.enabled", havingValue = "true")
public class ReferenceScenarioRunner implements CommandLineRunner {

    static final SensorInputs REFERENCE_SENSOR = SensorInputs.builder()
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

    private final ImagingAnalysisService imagingAnalysisService;

    @Override
    public void run(final String... args) {
        try {
            final var results = imagingAnalysisService.computeSensorGeometry(REFERENCE_SENSOR);
            logMetrics("nominal", results.nominal());
            logMetrics("worst-case", results.worstCase());
        } catch (final Exception e) {
            log.error("Reference scenario failed: {}", e.getMessage(), e);
        }
    }

    private static void logMetrics(final String label, final GeometryMetrics metrics) {
        metrics.asMap().forEach((name, value) ->
                log.info("Reference {} — {} = {}", label, name, String.format("%.4f", value)));
    }
}
