package io.github.jakubt4.eosensor.dto;

import java.util.List;

/**
 * Sampled MTF curves and derived scalar metrics. All curves share the index of {@link #frequencies()}.
 *
 * @param frequencies        sampled spatial frequencies in cycles/mm
 * @param opticsMtf          diffraction x defocus x atmosphere
 * @param detectorMtf        pixel-aperture sinc scaled by quantum efficiency
 * @param motionMtf          motion-blur sinc
 * @param overallMtf         product of the three components
 * @param sagittalMtf        overall curve derated for the sagittal direction
 * @param tangentialMtf      overall curve derated for the tangential direction
 * @param mtf50              frequency where the overall curve crosses 0.5, or 0 when it never does
 * @param nyquistFrequency   detector Nyquist frequency in cycles/mm
 * @param samplingEfficiency overall MTF at the first sample at or beyond Nyquist, clamped to [0, 1]
 */
public record MtfResults(List<Double> frequencies,
                         List<Double> opticsMtf,
                         List<Double> detectorMtf,
                         List<Double> motionMtf,
                         List<Double> overallMtf,
                         List<Double> sagittalMtf,
                         List<Double> tangentialMtf,
                         double mtf50,
                         double nyquistFrequency,
                         double samplingEfficiency) {

    public MtfResults {
        frequencies = List.copyOf(frequencies);
        opticsMtf = List.copyOf(opticsMtf);
        detectorMtf = List.copyOf(detectorMtf);
        motionMtf = List.copyOf(motionMtf);
        overallMtf = List.copyOf(overallMtf);
        sagittalMtf = List.copyOf(sagittalMtf);
        tangentialMtf = List.copyOf(tangentialMtf);
    }
}
