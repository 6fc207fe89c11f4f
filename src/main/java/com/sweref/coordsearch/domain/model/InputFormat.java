package com.sweref.coordsearch.domain.model;

/**
 * Shape of the coordinate text the user typed.
 */
public enum InputFormat {
    SPACE_SEPARATED,
    COMMA_SEPARATED,
    LABELED,
    UNKNOWN
}
