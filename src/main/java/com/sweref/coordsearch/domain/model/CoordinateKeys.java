package com.sweref.coordsearch.domain.model;

/**
 * Opaque error and warning keys shared by every stage of the coordinate search.
 * Rendering them as display text is left to the client.
 */
public final class CoordinateKeys {

    public static final String ERROR_EMPTY = "coordinateErrorEmpty";
    public static final String ERROR_TOO_LONG = "coordinateErrorTooLong";
    public static final String ERROR_PARSE = "coordinateErrorParse";
    public static final String ERROR_NOT_SWEREF = "coordinateErrorNotSweref";
    public static final String ERROR_OUT_OF_RANGE = "coordinateErrorOutOfRange";
    public static final String ERROR_OUT_OF_BOUNDS = "coordinateErrorOutOfBounds";
    public static final String ERROR_INVALID_NUMBER = "coordinateErrorInvalidNumber";
    public static final String ERROR_NO_PROJECTION = "coordinateErrorNoProjection";
    public static final String ERROR_GENERIC = "coordinateErrorGeneric";

    public static final String ERROR_PROJECTION_TIMEOUT = "coordinateErrorProjectionTimeout";
    public static final String ERROR_PROJECTION_LOAD = "coordinateErrorProjectionLoad";
    public static final String ERROR_NO_SPATIAL_REFERENCE = "coordinateErrorNoSpatialReference";
    public static final String ERROR_INVALID_PROJECTION = "coordinateErrorInvalidProjection";
    public static final String ERROR_INVALID_COORDINATES = "coordinateErrorInvalidCoordinates";
    public static final String ERROR_TRANSFORM = "coordinateErrorTransform";

    public static final String WARNING_NEAR_BOUNDARY = "coordinateWarningNearBoundary";
    public static final String WARNING_AMBIGUOUS_ORDER = "coordinateWarningAmbiguousOrder";

    // Internal only, never delivered to a listener
    public static final String SEARCH_OUTDATED = "coordinateSearchOutdated";

    private CoordinateKeys() {
    }
}
