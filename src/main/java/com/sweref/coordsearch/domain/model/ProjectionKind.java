package com.sweref.coordsearch.domain.model;

/**
 * Family of a SWEREF 99 projection: the single national TM grid or one of the local zones.
 */
public enum ProjectionKind {
    TM,
    ZONE
}
