package com.sweref.coordsearch.application.service;

import com.sweref.coordsearch.application.port.in.InspectCoordinatesUseCase;
import com.sweref.coordsearch.domain.model.DetectionResult;
import com.sweref.coordsearch.domain.model.InputClassification;
import com.sweref.coordsearch.domain.model.ParsedCoordinate;
import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import com.sweref.coordsearch.domain.model.ValidationResult;
import com.sweref.coordsearch.domain.policy.BoundsValidator;
import com.sweref.coordsearch.domain.policy.CoordinateInputClassifier;
import com.sweref.coordsearch.domain.policy.CoordinateParser;
import com.sweref.coordsearch.domain.policy.InputSanitizer;
import com.sweref.coordsearch.domain.policy.ProjectionCatalog;
import com.sweref.coordsearch.domain.policy.ProjectionDetector;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CoordinateInspectionService implements InspectCoordinatesUseCase {

    private final InputSanitizer sanitizer;
    private final CoordinateParser parser;
    private final CoordinateInputClassifier classifier;
    private final ProjectionDetector detector;
    private final BoundsValidator validator;
    private final int minSearchLength;

    public CoordinateInspectionService(
            InputSanitizer sanitizer,
            CoordinateParser parser,
            CoordinateInputClassifier classifier,
            ProjectionDetector detector,
            BoundsValidator validator,
            @Value("${app.coordinates.min-search-length:3}") int minSearchLength) {
        this.sanitizer = sanitizer;
        this.parser = parser;
        this.classifier = classifier;
        this.detector = detector;
        this.validator = validator;
        this.minSearchLength = minSearchLength;
    }

    @Override
    public String sanitize(String text) {
        return sanitizer.sanitize(text);
    }

    @Override
    public String sanitizeSearchTerm(String text) {
        return sanitizer.sanitizeSearchTerm(text);
    }

    @Override
    public boolean isSuggestableTerm(String text) {
        return sanitizer.sanitizeSearchTerm(text).length() >= minSearchLength;
    }

    @Override
    public ParsedCoordinate parse(String text) {
        return parser.parse(text);
    }

    @Override
    public ParsedCoordinate normalizeCoordinates(double easting, double northing) {
        return parser.normalizeCoordinates(easting, northing);
    }

    @Override
    public InputClassification classify(String text) {
        return classifier.classify(text);
    }

    @Override
    public DetectionResult detectProjection(
            double easting, double northing, Double centerLongitude, ProjectionPreference preference) {
        return detector.detect(easting, northing, centerLongitude,
                preference == null ? ProjectionPreference.AUTO : preference);
    }

    @Override
    public ValidationResult validate(double easting, double northing, Integer epsgCode) {
        Projection projection = null;
        if (epsgCode != null) {
            projection = ProjectionCatalog.byEpsg(epsgCode)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unsupported SWEREF 99 projection: EPSG:" + epsgCode));
        }
        return validator.validate(easting, northing, projection);
    }

    @Override
    public List<Projection> listProjections() {
        return ProjectionCatalog.all();
    }
}
