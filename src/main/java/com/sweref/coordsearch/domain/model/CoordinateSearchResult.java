package com.sweref.coordsearch.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Successful end-to-end coordinate search: the projected map point plus everything
 * the pipeline learned on the way.
 */
@Getter
@Builder
@ToString
public class CoordinateSearchResult {
    private final TransformedPoint point;
    private final Projection projection;
    private final double easting;
    private final double northing;
    private final ValidationResult validation;
    private final InputFormat format;
    private final double confidence;
    private final List<Projection> alternatives;
    private final List<String> warnings;
}
