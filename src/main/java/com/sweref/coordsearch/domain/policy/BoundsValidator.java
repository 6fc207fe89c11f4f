package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.CoordinateKeys;
import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-checks a coordinate pair against the detected projection's bounds, or the global
 * SWEREF 99 envelope when no projection is known.
 */
@Component
public class BoundsValidator {

    public ValidationResult validate(double easting, double northing, Projection projection) {
        if (!Double.isFinite(easting) || !Double.isFinite(northing)) {
            return ValidationResult.invalid(CoordinateKeys.ERROR_INVALID_NUMBER);
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (projection != null && !projection.getBounds().contains(easting, northing)) {
            errors.add(CoordinateKeys.ERROR_OUT_OF_BOUNDS);
        } else if (!CoordinateRanges.isSweref99Range(easting, northing)) {
            errors.add(CoordinateKeys.ERROR_OUT_OF_RANGE);
        }

        if (errors.isEmpty() && projection != null
                && projection.getBounds().isNearEastingEdge(easting, CoordinateRanges.BOUNDARY_WARNING_BUFFER)) {
            warnings.add(CoordinateKeys.WARNING_NEAR_BOUNDARY);
        }
        return new ValidationResult(errors, warnings);
    }
}
