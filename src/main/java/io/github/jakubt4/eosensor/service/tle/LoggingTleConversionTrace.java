package io.github.jakubt4.eosensor.service.tle;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Writes each conversion stage to the log at DEBUG.
 */
@Slf4j
public class LoggingTleConversionTrace implements TleConversionTrace {

    @Override
    public void stage(final String stage, final double... values) {
        if (log.isDebugEnabled()) {
            log.debug("TLE conversion [{}] {}", stage, Arrays.toString(values));
        }
    }
}
