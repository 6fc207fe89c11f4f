package com.sweref.coordsearch.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ProjectionDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("epsg")
    private int epsg;

    @JsonProperty("code")
    private String code;

    @JsonProperty("name")
    private String name;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("zoneId")
    private String zoneId;

    @JsonProperty("centralMeridian")
    private double centralMeridian;

    @JsonProperty("scaleFactor")
    private double scaleFactor;

    @JsonProperty("falseEasting")
    private double falseEasting;

    @JsonProperty("falseNorthing")
    private double falseNorthing;

    @JsonProperty("eMin")
    private double eMin;

    @JsonProperty("eMax")
    private double eMax;

    @JsonProperty("nMin")
    private double nMin;

    @JsonProperty("nMax")
    private double nMax;
}
