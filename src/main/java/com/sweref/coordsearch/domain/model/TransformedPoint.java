package com.sweref.coordsearch.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Point expressed in the map's spatial reference.
 * The spatial reference id may be absent when a projection engine does not tag its output.
 */
@Getter
@EqualsAndHashCode
@ToString
public class TransformedPoint {
    private final double x;
    private final double y;
    private final Integer spatialReferenceId;

    public TransformedPoint(double x, double y, Integer spatialReferenceId) {
        this.x = x;
        this.y = y;
        this.spatialReferenceId = spatialReferenceId;
    }

    public static TransformedPoint of(SourcePoint point) {
        return new TransformedPoint(point.getX(), point.getY(), point.getSpatialReferenceId());
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    public TransformedPoint withSpatialReference(int spatialReferenceId) {
        return new TransformedPoint(x, y, spatialReferenceId);
    }
}
