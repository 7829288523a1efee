package io.github.jakubt4.eosensor.service.tle;

import io.github.jakubt4.eosensor.dto.TleElements;
import io.github.jakubt4.eosensor.dto.TleRecord;
import lombok.extern.slf4j.Slf4j;
import org.orekit.propagation.analytical.tle.TLE;

import java.util.Arrays;

/**
 * Reads NORAD two-line element sets, with or without a leading name line.
 *
 * <p>Line format and checksums are checked with Orekit before any field is read. Fields are
 * taken from their fixed columns.
 */
@Slf4j
public final class TleParser {

    // Two-digit epoch years below this belong to the 2000s
    private static final int EPOCH_YEAR_PIVOT = 57;

    private TleParser() {
    }

    /**
     * @throws IllegalArgumentException if the text is not two or three lines or fails the format check
     * @throws org.orekit.errors.OrekitException if a line checksum does not match
     */
    public static TleRecord parse(final String text) {
        final var lines = Arrays.stream(text.strip().split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();

        return switch (lines.size()) {
            case 2 -> parse(null, lines.get(0), lines.get(1));
            case 3 -> parse(lines.get(0), lines.get(1), lines.get(2));
            default -> throw new IllegalArgumentException(
                    "TLE must have two data lines and an optional name line, got " + lines.size() + " lines");
        };
    }

    public static TleRecord parse(final String satelliteName, final String line1, final String line2) {
        if (!TLE.isFormatOK(line1, line2)) {
            throw new IllegalArgumentException("Invalid TLE format:\n" + line1 + "\n" + line2);
        }

        final var twoDigitYear = Integer.parseInt(line1.substring(18, 20).trim());
        final var elements = TleElements.builder()
                .epochYear(twoDigitYear < EPOCH_YEAR_PIVOT ? 2000 + twoDigitYear : 1900 + twoDigitYear)
                .epochDay(field(line1, 20, 32))
                .inclination(field(line2, 8, 16))
                .raan(field(line2, 17, 25))
                .eccentricity(Double.parseDouble("0." + line2.substring(26, 33).trim()))
                .argumentOfPerigee(field(line2, 34, 42))
                .meanAnomaly(field(line2, 43, 51))
                .meanMotion(field(line2, 52, 63))
                .build();

        log.debug("Parsed TLE '{}' — epoch {}/{}, inc={} deg, n={} rev/day",
                satelliteName, elements.epochYear(), elements.epochDay(),
                elements.inclination(), elements.meanMotion());
        return new TleRecord(satelliteName, line1, line2, elements);
    }

    private static double field(final String line, final int begin, final int end) {
        return Double.parseDouble(line.substring(begin, end).trim());
    }
}
