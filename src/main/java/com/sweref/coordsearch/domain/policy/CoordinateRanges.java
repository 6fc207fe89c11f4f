package com.sweref.coordsearch.domain.policy;

/**
 * Numeric envelopes and tolerances of the SWEREF 99 coordinate search.
 *
 * The boundary buffer and the precision epsilon are fixed values carried over
 * unchanged; they are not tunable.
 */
public final class CoordinateRanges {

    public static final double MIN_EASTING = 30_000;
    public static final double MAX_EASTING = 800_000;
    public static final double MIN_NORTHING = 5_900_000;
    public static final double MAX_NORTHING = 7_800_000;

    public static final double TM_EASTING_MIN = 300_000;
    public static final double TM_EASTING_MAX = 700_000;
    public static final double ZONE_EASTING_MIN = 50_000;
    public static final double ZONE_EASTING_MAX = 250_000;

    public static final double BOUNDARY_WARNING_BUFFER = 5_000;
    public static final double PRECISION_EPSILON = 1e-3;

    private CoordinateRanges() {
    }

    public static boolean isEasting(double value) {
        return value >= MIN_EASTING && value <= MAX_EASTING;
    }

    public static boolean isNorthing(double value) {
        return value >= MIN_NORTHING && value <= MAX_NORTHING;
    }

    /**
     * Global SWEREF 99 envelope check, independent of any particular projection.
     */
    public static boolean isSweref99Range(double easting, double northing) {
        return isEasting(easting) && isNorthing(northing);
    }
}
