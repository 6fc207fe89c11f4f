package com.sweref.coordsearch.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Coordinate-sanitized text next to the general search-term rendering of the same input.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SanitizeResponseDto {

    @JsonProperty("sanitized")
    private String sanitized;

    @JsonProperty("searchTerm")
    private String searchTerm;

    @JsonProperty("suggestable")
    private boolean suggestable;
}
