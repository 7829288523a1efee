package io.github.jakubt4.eosensor.dto;

/**
 * Atmospheric bucket used by the PSF and MTF models.
 */
public enum AtmosphericCondition {

    CLEAR(15.0, 1.5),
    HAZY(25.0, 2.5),
    CLOUDY(40.0, 4.0);

    private final double baseSeeingMicrons;
    private final double seeingArcsec;

    AtmosphericCondition(final double baseSeeingMicrons, final double seeingArcsec) {
        this.baseSeeingMicrons = baseSeeingMicrons;
        this.seeingArcsec = seeingArcsec;
    }

    /**
     * Focal-plane blur FWHM at zenith, in micrometers.
     */
    public double baseSeeingMicrons() {
        return baseSeeingMicrons;
    }

    /**
     * Angular seeing at zenith, in arcseconds.
     */
    public double seeingArcsec() {
        return seeingArcsec;
    }
}
