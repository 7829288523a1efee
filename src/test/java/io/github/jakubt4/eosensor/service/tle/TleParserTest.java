package io.github.jakubt4.eosensor.service.tle;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TleParserTest {

    // Valid ISS TLE (epoch 2008-264, checksum-verified)
    private static final String TLE_LINE1 = "1 25544U 98067A   08264.51782528 -.00002182  00000-0 -11606-4 0  2927";
    private static final String TLE_LINE2 = "2 25544  51.6416 247.4627 0006703 130.5360 325.0288 15.72125391563537";

    @Test
    void parsesFixedColumns() {
        final var record = TleParser.parse(TLE_LINE1 + "\n" + TLE_LINE2);
        final var elements = record.elements();

        assertThat(record.satelliteName()).isNull();
        assertThat(elements.epochYear()).isEqualTo(2008);
        assertThat(elements.epochDay()).isCloseTo(264.51782528, within(1e-9));
        assertThat(elements.inclination()).isEqualTo(51.6416);
        assertThat(elements.raan()).isEqualTo(247.4627);
        assertThat(elements.eccentricity()).isEqualTo(0.0006703);
        assertThat(elements.argumentOfPerigee()).isEqualTo(130.5360);
        assertThat(elements.meanAnomaly()).isEqualTo(325.0288);
        assertThat(elements.meanMotion()).isEqualTo(15.72125391);
    }

    @Test
    void readsOptionalNameLine() {
        final var record = TleParser.parse("ISS (ZARYA)\r\n" + TLE_LINE1 + "\r\n" + TLE_LINE2 + "\n");

        assertThat(record.satelliteName()).isEqualTo("ISS (ZARYA)");
        assertThat(record.line1()).isEqualTo(TLE_LINE1);
        assertThat(record.line2()).isEqualTo(TLE_LINE2);
    }

    @Test
    void pivotsTwoDigitEpochYear() {
        final var line1 = TleGenerator.withChecksum("1 25544U 98067A   98264.51782528 -.00002182  00000-0 -11606-4 0  292");

        assertThat(TleParser.parse(null, line1, TLE_LINE2).elements().epochYear()).isEqualTo(1998);
    }

    @Test
    void rejectsWrongLineCount() {
        assertThatThrownBy(() -> TleParser.parse(TLE_LINE1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1 lines");
    }

    @Test
    void rejectsMalformedLines() {
        assertThatThrownBy(() -> TleParser.parse(null, "1 garbage", TLE_LINE2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid TLE format");
    }

    @Test
    void rejectsBadChecksum() {
        final var corrupted = TLE_LINE1.substring(0, TLE_LINE1.length() - 1) + "0";

        assertThatThrownBy(() -> TleParser.parse(null, corrupted, TLE_LINE2))
                .isInstanceOf(RuntimeException.class);
    }
}
