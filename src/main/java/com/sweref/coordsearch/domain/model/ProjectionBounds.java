package com.sweref.coordsearch.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object representing the planar envelope a projection is valid in.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ProjectionBounds {
    private final double eMin;
    private final double eMax;
    private final double nMin;
    private final double nMax;

    public ProjectionBounds(double eMin, double eMax, double nMin, double nMax) {
        if (eMin > eMax || nMin > nMax) {
            throw new IllegalArgumentException("Bounds minimum must not exceed maximum");
        }
        this.eMin = eMin;
        this.eMax = eMax;
        this.nMin = nMin;
        this.nMax = nMax;
    }

    public boolean containsEasting(double easting) {
        return easting >= eMin && easting <= eMax;
    }

    public boolean containsNorthing(double northing) {
        return northing >= nMin && northing <= nMax;
    }

    public boolean contains(double easting, double northing) {
        return containsEasting(easting) && containsNorthing(northing);
    }

    /**
     * True when the easting lies within {@code buffer} units of the west or east edge.
     */
    public boolean isNearEastingEdge(double easting, double buffer) {
        return Math.abs(easting - eMin) <= buffer || Math.abs(eMax - easting) <= buffer;
    }
}
