package com.sweref.coordsearch.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Outcome of parsing free text into an easting/northing pair.
 * Either a success carrying the pair, or a failure carrying an error key.
 */
@Getter
@ToString
public class ParsedCoordinate {
    private final boolean success;
    private final double easting;
    private final double northing;
    private final InputFormat format;
    private final String sanitizedText;
    private final String warning;
    private final String error;

    private ParsedCoordinate(
            boolean success,
            double easting,
            double northing,
            InputFormat format,
            String sanitizedText,
            String warning,
            String error) {
        this.success = success;
        this.easting = easting;
        this.northing = northing;
        this.format = format;
        this.sanitizedText = sanitizedText;
        this.warning = warning;
        this.error = error;
    }

    public static ParsedCoordinate success(
            double easting, double northing, InputFormat format, String sanitizedText, String warning) {
        return new ParsedCoordinate(true, easting, northing, format, sanitizedText, warning, null);
    }

    public static ParsedCoordinate failure(String errorKey) {
        if (errorKey == null) {
            throw new IllegalArgumentException("Error key must not be null");
        }
        return new ParsedCoordinate(false, Double.NaN, Double.NaN, null, null, null, errorKey);
    }

    public Optional<String> warningKey() {
        return Optional.ofNullable(warning);
    }
}
