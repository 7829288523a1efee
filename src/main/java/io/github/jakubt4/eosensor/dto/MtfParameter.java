package io.github.jakubt4.eosensor.dto;

/**
 * Design parameters that {@code suggestImprovements} may propose new values for.
 */
public enum MtfParameter {
    PIXEL_SIZE,
    INTEGRATION_TIME,
    APERTURE,
    DEFOCUS
}
