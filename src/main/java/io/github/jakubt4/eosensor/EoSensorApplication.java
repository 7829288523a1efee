package io.github.jakubt4.eosensor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * EO Sensor: numerical modeling engine for electro-optical Earth-observation satellites.
 *
 * <p>Covers sensor ground geometry and pointing-error budgets, optical PSF/MTF modeling,
 * circular-orbit ground tracks and revisit coverage, TLE to geodetic conversion, and
 * PSF kernel estimation with image deconvolution.
 *
 * @see io.github.jakubt4.eosensor.service.ImagingAnalysisService
 */
@SpringBootApplication
public class EoSensorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EoSensorApplication.class, args);
    }
}
