package com.sweref.coordsearch.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Verdict on whether a search box entry is coordinates or free text such as an address.
 */
@Getter
@EqualsAndHashCode
@ToString
public class InputClassification {

    public enum Confidence {
        HIGH,
        MEDIUM,
        LOW
    }

    public enum Reason {
        INPUT_TOO_SHORT,
        NOT_TWO_NUMBERS,
        INVALID_NUMBERS,
        ADDRESS_PATTERN_DETECTED,
        UNSUPPORTED_CHARACTERS,
        SWEREF99_RANGE,
        WGS84_RANGE,
        OUT_OF_RANGE
    }

    private final boolean coordinate;
    private final Confidence confidence;
    private final Reason reason;

    public InputClassification(boolean coordinate, Confidence confidence, Reason reason) {
        this.coordinate = coordinate;
        this.confidence = confidence;
        this.reason = reason;
    }

    public static InputClassification rejected(Confidence confidence, Reason reason) {
        return new InputClassification(false, confidence, reason);
    }
}
