package com.sweref.coordsearch.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Body of a coordinate search. Map fields left out fall back to the configured map view.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CoordinateSearchRequestDto {

    @NotBlank(message = "Search text is required")
    @JsonProperty("text")
    private String text;

    @JsonProperty("preference")
    private ProjectionPreference preference;

    @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
    @JsonProperty("centerLongitude")
    private Double centerLongitude;

    @Positive(message = "Target wkid must be positive")
    @JsonProperty("targetWkid")
    private Integer targetWkid;
}
