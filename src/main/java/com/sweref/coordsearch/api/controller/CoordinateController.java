package com.sweref.coordsearch.api.controller;

import com.sweref.coordsearch.api.dto.ClassificationResponseDto;
import com.sweref.coordsearch.api.dto.CoordinateSearchRequestDto;
import com.sweref.coordsearch.api.dto.CoordinateSearchResponseDto;
import com.sweref.coordsearch.api.dto.DetectionResponseDto;
import com.sweref.coordsearch.api.dto.ParseResponseDto;
import com.sweref.coordsearch.api.dto.ProjectionDto;
import com.sweref.coordsearch.api.dto.SanitizeResponseDto;
import com.sweref.coordsearch.api.dto.ValidationResponseDto;
import com.sweref.coordsearch.application.mapper.CoordinateMapper;
import com.sweref.coordsearch.application.port.in.InspectCoordinatesUseCase;
import com.sweref.coordsearch.application.port.in.SearchCoordinatesUseCase;
import com.sweref.coordsearch.domain.model.CoordinateSearchResult;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Controller for the coordinate search endpoints.
 * The inspection endpoints expose the individual stages for inline feedback while typing.
 */
@RestController
@RequestMapping("/coordinates")
@Validated
public class CoordinateController {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateController.class);

    private final SearchCoordinatesUseCase searchCoordinatesUseCase;
    private final InspectCoordinatesUseCase inspectCoordinatesUseCase;
    private final CoordinateMapper coordinateMapper;

    public CoordinateController(
            SearchCoordinatesUseCase searchCoordinatesUseCase,
            InspectCoordinatesUseCase inspectCoordinatesUseCase,
            CoordinateMapper coordinateMapper) {
        this.searchCoordinatesUseCase = searchCoordinatesUseCase;
        this.inspectCoordinatesUseCase = inspectCoordinatesUseCase;
        this.coordinateMapper = coordinateMapper;
    }

    /**
     * POST /coordinates/search
     *
     * Parses, detects, validates and projects the text into the map's spatial reference.
     * Failures surface as 422 with the error key.
     */
    @PostMapping("/search")
    public ResponseEntity<CoordinateSearchResponseDto> search(@Valid @RequestBody CoordinateSearchRequestDto request) {
        logger.info("Coordinate search: preference={}, targetWkid={}", request.getPreference(), request.getTargetWkid());

        CoordinateSearchResult result;
        try {
            result = searchCoordinatesUseCase.searchOnce(
                    request.getText(),
                    request.getPreference(),
                    request.getCenterLongitude(),
                    request.getTargetWkid()).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return ResponseEntity.ok(coordinateMapper.toDto(result));
    }

    @GetMapping("/sanitize")
    public ResponseEntity<SanitizeResponseDto> sanitize(@RequestParam("text") String text) {
        return ResponseEntity.ok(new SanitizeResponseDto(
                inspectCoordinatesUseCase.sanitize(text),
                inspectCoordinatesUseCase.sanitizeSearchTerm(text),
                inspectCoordinatesUseCase.isSuggestableTerm(text)));
    }

    @GetMapping("/parse")
    public ResponseEntity<ParseResponseDto> parse(@RequestParam("text") String text) {
        return ResponseEntity.ok(coordinateMapper.toDto(inspectCoordinatesUseCase.parse(text)));
    }

    /**
     * GET /coordinates/classify?text=...
     *
     * Tells the host whether the text should go to coordinate search or to geocoding.
     */
    @GetMapping("/classify")
    public ResponseEntity<ClassificationResponseDto> classify(@RequestParam("text") String text) {
        return ResponseEntity.ok(coordinateMapper.toDto(inspectCoordinatesUseCase.classify(text)));
    }

    @GetMapping("/detect")
    public ResponseEntity<DetectionResponseDto> detect(
            @RequestParam("easting") double easting,
            @RequestParam("northing") double northing,
            @RequestParam(value = "centerLongitude", required = false) Double centerLongitude,
            @RequestParam(value = "preference", defaultValue = "AUTO") ProjectionPreference preference) {
        return ResponseEntity.ok(coordinateMapper.toDto(
                inspectCoordinatesUseCase.detectProjection(easting, northing, centerLongitude, preference)));
    }

    @GetMapping("/validate")
    public ResponseEntity<ValidationResponseDto> validate(
            @RequestParam("easting") double easting,
            @RequestParam("northing") double northing,
            @RequestParam(value = "epsg", required = false) Integer epsg) {
        return ResponseEntity.ok(coordinateMapper.toDto(
                inspectCoordinatesUseCase.validate(easting, northing, epsg)));
    }

    @GetMapping("/projections")
    public ResponseEntity<List<ProjectionDto>> projections() {
        return ResponseEntity.ok(inspectCoordinatesUseCase.listProjections().stream()
                .map(coordinateMapper::toDto)
                .toList());
    }
}
