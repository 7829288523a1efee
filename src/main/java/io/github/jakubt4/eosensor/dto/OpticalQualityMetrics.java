package io.github.jakubt4.eosensor.dto;

import java.util.List;

/**
 * Qualitative assessment derived from a PSF evaluation.
 *
 * @param imageQuality     grade derived from the Strehl ratio
 * @param limitingFactor   dominant blur contributor
 * @param recommendations  suggested design changes, possibly empty
 * @param performanceScore Strehl ratio as a 0-100 score
 */
public record OpticalQualityMetrics(ImageQuality imageQuality,
                                    LimitingFactor limitingFactor,
                                    List<String> recommendations,
                                    int performanceScore) {

    public OpticalQualityMetrics {
        recommendations = List.copyOf(recommendations);
    }

    public enum ImageQuality {
        EXCELLENT, GOOD, ACCEPTABLE, POOR
    }

    public enum LimitingFactor {
        DIFFRACTION, ABERRATIONS, DEFOCUS, ATMOSPHERE
    }
}
