package com.sweref.coordsearch.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParseResponseDto {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("easting")
    private Double easting;

    @JsonProperty("northing")
    private Double northing;

    @JsonProperty("format")
    private String format;

    @JsonProperty("sanitizedText")
    private String sanitizedText;

    @JsonProperty("warning")
    private String warning;

    @JsonProperty("error")
    private String error;
}
