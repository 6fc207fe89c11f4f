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
public class ClassificationResponseDto {

    @JsonProperty("isCoordinate")
    private boolean coordinate;

    @JsonProperty("confidence")
    private String confidence;

    @JsonProperty("reason")
    private String reason;
}
