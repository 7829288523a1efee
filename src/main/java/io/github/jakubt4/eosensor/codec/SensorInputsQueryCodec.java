package io.github.jakubt4.eosensor.codec;

import io.github.jakubt4.eosensor.dto.SensorInputs;

import java.math.BigDecimal;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shares {@link SensorInputs} as URL query parameters, one decimal value per field.
 *
 * <p>Altitudes travel in kilometers and are held in meters, so they are scaled by 1000 at
 * this boundary. Unknown parameters are ignored.
 */
public final class SensorInputsQueryCodec {

    static final List<String> FIELDS = List.of(
            "pixelSize", "pixelCountH", "pixelCountV", "gsdRequirements",
            "altitudeMin", "altitudeMax", "focalLength", "aperture",
            "attitudeAccuracy", "nominalOffNadirAngle", "maxOffNadirAngle", "gpsAccuracy");

    private static final double METERS_PER_KM = 1000.0;

    private SensorInputsQueryCodec() {
    }

    public static String encode(final SensorInputs inputs) {
        final var values = new LinkedHashMap<String, Double>();
        values.put("pixelSize", inputs.pixelSize());
        values.put("pixelCountH", inputs.pixelCountH());
        values.put("pixelCountV", inputs.pixelCountV());
        values.put("gsdRequirements", inputs.gsdRequirements());
        values.put("altitudeMin", inputs.altitudeMin() / METERS_PER_KM);
        values.put("altitudeMax", inputs.altitudeMax() / METERS_PER_KM);
        values.put("focalLength", inputs.focalLength());
        values.put("aperture", inputs.aperture());
        values.put("attitudeAccuracy", inputs.attitudeAccuracy());
        values.put("nominalOffNadirAngle", inputs.nominalOffNadirAngle());
        values.put("maxOffNadirAngle", inputs.maxOffNadirAngle());
        values.put("gpsAccuracy", inputs.gpsAccuracy());

        return values.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + URLEncoder.encode(format(entry.getValue()), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    /**
     * @param query query string with or without the leading {@code ?}
     * @throws IllegalArgumentException if a field is missing or not a number
     */
    public static SensorInputs decode(final String query) {
        final var values = parse(query);

        final var missing = FIELDS.stream().filter(field -> !values.containsKey(field)).toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing sensor parameters: " + String.join(", ", missing));
        }

        return SensorInputs.builder()
                .pixelSize(values.get("pixelSize"))
                .pixelCountH(values.get("pixelCountH"))
                .pixelCountV(values.get("pixelCountV"))
                .gsdRequirements(values.get("gsdRequirements"))
                .altitudeMin(values.get("altitudeMin") * METERS_PER_KM)
                .altitudeMax(values.get("altitudeMax") * METERS_PER_KM)
                .focalLength(values.get("focalLength"))
                .aperture(values.get("aperture"))
                .attitudeAccuracy(values.get("attitudeAccuracy"))
                .nominalOffNadirAngle(values.get("nominalOffNadirAngle"))
                .maxOffNadirAngle(values.get("maxOffNadirAngle"))
                .gpsAccuracy(values.get("gpsAccuracy"))
                .build();
    }

    private static Map<String, Double> parse(final String query) {
        final var values = new HashMap<String, Double>();
        final var trimmed = query.startsWith("?") ? query.substring(1) : query;
        if (trimmed.isEmpty()) {
            return values;
        }
        for (final var pair : trimmed.split("&")) {
            final var separator = pair.indexOf('=');
            if (separator < 0) {
                continue;
            }
            final var key = URLDecoder.decode(pair.substring(0, separator), StandardCharsets.UTF_8);
            if (!FIELDS.contains(key)) {
                continue;
            }
            final var raw = URLDecoder.decode(pair.substring(separator + 1), StandardCharsets.UTF_8).trim();
            try {
                final var value = Double.parseDouble(raw);
                if (!Double.isFinite(value)) {
                    throw new IllegalArgumentException("Sensor parameter '" + key + "' is not finite: " + raw);
                }
                values.put(key, value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Sensor parameter '" + key + "' is not a number: " + raw, e);
            }
        }
        return values;
    }

    private static String format(final double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
