package com.sweref.coordsearch.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CoordinateSearchResponseDto {

    @JsonProperty("projectionId")
    private String projectionId;

    @JsonProperty("epsg")
    private int epsg;

    @JsonProperty("easting")
    private double easting;

    @JsonProperty("northing")
    private double northing;

    @JsonProperty("x")
    private double x;

    @JsonProperty("y")
    private double y;

    @JsonProperty("spatialReferenceId")
    private Integer spatialReferenceId;

    @JsonProperty("warnings")
    private List<String> warnings;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("format")
    private String format;

    @JsonProperty("alternativeProjectionIds")
    private List<String> alternativeProjectionIds;
}
