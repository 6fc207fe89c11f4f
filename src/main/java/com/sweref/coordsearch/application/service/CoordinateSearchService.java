package com.sweref.coordsearch.application.service;

import com.sweref.coordsearch.application.port.in.SearchCoordinatesUseCase;
import com.sweref.coordsearch.application.port.out.MapViewAccessor;
import com.sweref.coordsearch.domain.model.CoordinateSearchResult;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import com.sweref.coordsearch.domain.policy.BoundsValidator;
import com.sweref.coordsearch.domain.policy.CoordinateParser;
import com.sweref.coordsearch.domain.policy.ProjectionDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

@Service
public class CoordinateSearchService implements SearchCoordinatesUseCase {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateSearchService.class);

    private final CoordinateParser parser;
    private final ProjectionDetector detector;
    private final BoundsValidator validator;
    private final CoordinateTransformService transformService;
    private final MapViewAccessor mapView;
    private final ProjectionPreference defaultPreference;
    private final Duration debounce;

    public CoordinateSearchService(
            CoordinateParser parser,
            ProjectionDetector detector,
            BoundsValidator validator,
            CoordinateTransformService transformService,
            MapViewAccessor mapView,
            @Value("${app.coordinates.default-preference:AUTO}") ProjectionPreference defaultPreference,
            @Value("${app.coordinates.debounce-ms:300}") long debounceMs) {
        this.parser = parser;
        this.detector = detector;
        this.validator = validator;
        this.transformService = transformService;
        this.mapView = mapView;
        this.defaultPreference = defaultPreference;
        this.debounce = Duration.ofMillis(debounceMs);
    }

    @Override
    public CoordinateSearchSequencer openSession(ProjectionPreference preference, CoordinateSearchListener listener) {
        return newSequencer(mapView, preference, listener);
    }

    @Override
    public CoordinateSearchDebouncer openDebouncedSession(
            ProjectionPreference preference, CoordinateSearchListener listener) {
        return new CoordinateSearchDebouncer(
                newSequencer(mapView, preference, listener), debounce, Schedulers.parallel());
    }

    @Override
    public CompletableFuture<CoordinateSearchResult> searchOnce(
            String text, ProjectionPreference preference, Double centerLongitude, Integer targetSpatialReferenceId) {
        MapViewAccessor view = MapViewAccessor.fixed(
                centerLongitude != null ? centerLongitude : mapView.centerLongitude(),
                targetSpatialReferenceId != null ? targetSpatialReferenceId : mapView.spatialReferenceId());
        logger.info("Standalone coordinate search (preference {}, target wkid {})",
                preference == null ? defaultPreference : preference, view.spatialReferenceId());
        return newSequencer(view, preference, CoordinateSearchListener.NONE).searchCoordinates(text);
    }

    private CoordinateSearchSequencer newSequencer(
            MapViewAccessor view, ProjectionPreference preference, CoordinateSearchListener listener) {
        return new CoordinateSearchSequencer(
                parser,
                detector,
                validator,
                transformService,
                view,
                preference == null ? defaultPreference : preference,
                listener);
    }
}
