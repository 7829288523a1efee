package io.github.jakubt4.eosensor.service.tle;

/**
 * Observer for the intermediate stages of a TLE to geodetic conversion.
 *
 * <p>Stages are reported in pipeline order. Implementations must not throw.
 */
@FunctionalInterface
public interface TleConversionTrace {

    TleConversionTrace NO_OP = (stage, values) -> { };

    /**
     * @param stage  stage name, e.g. {@code "semi-major-axis"}
     * @param values stage output; vectors in kilometers, angles in degrees
     */
    void stage(String stage, double... values);
}
