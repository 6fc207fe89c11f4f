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
public class DetectionResponseDto {

    @JsonProperty("projectionId")
    private String projectionId;

    @JsonProperty("epsg")
    private Integer epsg;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("alternativeProjectionIds")
    private List<String> alternativeProjectionIds;

    @JsonProperty("warnings")
    private List<String> warnings;
}
