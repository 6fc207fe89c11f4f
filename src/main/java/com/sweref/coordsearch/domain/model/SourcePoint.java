package com.sweref.coordsearch.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Planar point tagged with the EPSG code of the projection it was entered in.
 */
@Getter
@EqualsAndHashCode
@ToString
public class SourcePoint {
    private final double x;
    private final double y;
    private final int spatialReferenceId;

    public SourcePoint(double x, double y, int spatialReferenceId) {
        this.x = x;
        this.y = y;
        this.spatialReferenceId = spatialReferenceId;
    }
}
