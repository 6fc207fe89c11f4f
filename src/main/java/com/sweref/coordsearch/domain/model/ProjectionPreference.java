package com.sweref.coordsearch.domain.model;

/**
 * User preference steering projection detection when several definitions match.
 */
public enum ProjectionPreference {
    AUTO,
    TM,
    ZONE
}
