package io.github.jakubt4.eosensor.config;

import io.github.jakubt4.eosensor.service.tle.LoggingTleConversionTrace;
import io.github.jakubt4.eosensor.service.tle.TleConversionTrace;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TraceConfigTest {

    private final TraceConfig config = new TraceConfig();

    @Test
    void defaultsToNoOpTrace() {
        assertThat(config.tleConversionTrace(false)).isSameAs(TleConversionTrace.NO_OP);
    }

    @Test
    void enablesLoggingTrace() {
        assertThat(config.tleConversionTrace(true)).isInstanceOf(LoggingTleConversionTrace.class);
    }
}
