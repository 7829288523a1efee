package io.github.jakubt4.eosensor.config;

import io.github.jakubt4.eosensor.service.tle.LoggingTleConversionTrace;
import io.github.jakubt4.eosensor.service.tle.TleConversionTrace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class TraceConfig {

    @Bean
    public TleConversionTrace tleConversionTrace(@Value("${eo.tle.trace-enabled:false}") final boolean traceEnabled) {
        if (traceEnabled) {
            log.info("TLE conversion tracing enabled");
            return new LoggingTleConversionTrace();
        }
        return TleConversionTrace.NO_OP;
    }
}
