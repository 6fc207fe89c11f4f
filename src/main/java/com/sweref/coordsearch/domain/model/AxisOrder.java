package com.sweref.coordsearch.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Resolved assignment of two raw numbers to easting and northing.
 */
@Getter
@EqualsAndHashCode
@ToString
public class AxisOrder {
    private final double easting;
    private final double northing;

    /** {@link CoordinateKeys#WARNING_AMBIGUOUS_ORDER} or null. */
    private final String warning;

    public AxisOrder(double easting, double northing, String warning) {
        this.easting = easting;
        this.northing = northing;
        this.warning = warning;
    }

    public AxisOrder(double easting, double northing) {
        this(easting, northing, null);
    }
}
