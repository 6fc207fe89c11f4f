package com.sweref.coordsearch.application.port.in;

import com.sweref.coordsearch.domain.model.DetectionResult;
import com.sweref.coordsearch.domain.model.InputClassification;
import com.sweref.coordsearch.domain.model.ParsedCoordinate;
import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import com.sweref.coordsearch.domain.model.ValidationResult;

import java.util.List;

/**
 * Input port for the individual synchronous stages, used for inline feedback while typing.
 */
public interface InspectCoordinatesUseCase {

    String sanitize(String text);

    String sanitizeSearchTerm(String text);

    boolean isSuggestableTerm(String text);

    ParsedCoordinate parse(String text);

    ParsedCoordinate normalizeCoordinates(double easting, double northing);

    InputClassification classify(String text);

    DetectionResult detectProjection(
            double easting, double northing, Double centerLongitude, ProjectionPreference preference);

    /**
     * @param epsgCode projection to validate against; null validates against the global envelope
     * @throws IllegalArgumentException when the EPSG code is not a supported SWEREF 99 projection
     */
    ValidationResult validate(double easting, double northing, Integer epsgCode);

    List<Projection> listProjections();
}
