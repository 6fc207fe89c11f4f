package com.sweref.coordsearch.application.mapper;

import com.sweref.coordsearch.api.dto.ClassificationResponseDto;
import com.sweref.coordsearch.api.dto.CoordinateSearchResponseDto;
import com.sweref.coordsearch.api.dto.DetectionResponseDto;
import com.sweref.coordsearch.api.dto.ParseResponseDto;
import com.sweref.coordsearch.api.dto.ProjectionDto;
import com.sweref.coordsearch.api.dto.ValidationResponseDto;
import com.sweref.coordsearch.domain.model.CoordinateSearchResult;
import com.sweref.coordsearch.domain.model.DetectionResult;
import com.sweref.coordsearch.domain.model.InputClassification;
import com.sweref.coordsearch.domain.model.ParsedCoordinate;
import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.ProjectionBounds;
import com.sweref.coordsearch.domain.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class CoordinateMapper {

  public CoordinateSearchResponseDto toDto(CoordinateSearchResult result) {
    Projection projection = result.getProjection();
    return new CoordinateSearchResponseDto(
        projection.getId(),
        projection.getEpsgCode(),
        result.getEasting(),
        result.getNorthing(),
        result.getPoint().getX(),
        result.getPoint().getY(),
        result.getPoint().getSpatialReferenceId(),
        result.getWarnings(),
        result.getConfidence(),
        result.getFormat() == null ? null : result.getFormat().name(),
        ids(result.getAlternatives()));
  }

  public ParseResponseDto toDto(ParsedCoordinate parsed) {
    if (!parsed.isSuccess()) {
      return new ParseResponseDto(false, null, null, null, null, null, parsed.getError());
    }
    return new ParseResponseDto(
        true,
        parsed.getEasting(),
        parsed.getNorthing(),
        parsed.getFormat().name(),
        parsed.getSanitizedText(),
        parsed.getWarning(),
        null);
  }

  public DetectionResponseDto toDto(DetectionResult detection) {
    Projection projection = detection.getProjection();
    return new DetectionResponseDto(
        projection == null ? null : projection.getId(),
        projection == null ? null : projection.getEpsgCode(),
        detection.getConfidence(),
        ids(detection.getAlternatives()),
        detection.getWarnings());
  }

  public ValidationResponseDto toDto(ValidationResult validation) {
    return new ValidationResponseDto(validation.isValid(), validation.getErrors(), validation.getWarnings());
  }

  public ClassificationResponseDto toDto(InputClassification classification) {
    return new ClassificationResponseDto(
        classification.isCoordinate(),
        classification.getConfidence().name(),
        classification.getReason().name());
  }

  public ProjectionDto toDto(Projection projection) {
    ProjectionBounds bounds = projection.getBounds();
    return new ProjectionDto(
        projection.getId(),
        projection.getEpsgCode(),
        projection.getCode(),
        projection.getName(),
        projection.getKind().name(),
        projection.getZoneId(),
        projection.getCentralMeridian(),
        projection.getScaleFactor(),
        projection.getFalseEasting(),
        projection.getFalseNorthing(),
        bounds.getEMin(),
        bounds.getEMax(),
        bounds.getNMin(),
        bounds.getNMax());
  }

  private static List<String> ids(List<Projection> projections) {
    return projections == null ? List.of() : projections.stream().map(Projection::getId).toList();
  }
}
