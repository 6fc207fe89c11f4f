package com.sweref.coordsearch.application.port.out;

/**
 * Output port exposing the host map view's current state.
 */
public interface MapViewAccessor {

    /**
     * @return centre longitude in degrees, or null when the map has no usable centre
     */
    Double centerLongitude();

    /**
     * @return wkid of the map's active spatial reference, or null when unavailable
     */
    Integer spatialReferenceId();

    static MapViewAccessor fixed(Double centerLongitude, Integer spatialReferenceId) {
        return new MapViewAccessor() {
            @Override
            public Double centerLongitude() {
                return centerLongitude;
            }

            @Override
            public Integer spatialReferenceId() {
                return spatialReferenceId;
            }
        };
    }
}
