package com.sweref.coordsearch.application.port.in;

import com.sweref.coordsearch.application.service.CoordinateSearchDebouncer;
import com.sweref.coordsearch.application.service.CoordinateSearchListener;
import com.sweref.coordsearch.application.service.CoordinateSearchSequencer;
import com.sweref.coordsearch.domain.model.CoordinateSearchResult;
import com.sweref.coordsearch.domain.model.ProjectionPreference;

import java.util.concurrent.CompletableFuture;

/**
 * Input port for end-to-end coordinate search: parse, detect, validate and project.
 */
public interface SearchCoordinatesUseCase {

    /**
     * Opens a search session for one search box. Only the outcome of the most recent
     * call on the returned sequencer is ever delivered to the listener.
     */
    CoordinateSearchSequencer openSession(ProjectionPreference preference, CoordinateSearchListener listener);

    /**
     * Same as {@link #openSession} with a debounce stage in front, for type-as-you-go input.
     */
    CoordinateSearchDebouncer openDebouncedSession(ProjectionPreference preference, CoordinateSearchListener listener);

    /**
     * Runs a single standalone search. Map values left null fall back to the configured map view.
     *
     * @return future completed with the result, or exceptionally with
     *         {@link CoordinateSearchSequencer.CoordinateSearchException}
     */
    CompletableFuture<CoordinateSearchResult> searchOnce(
            String text, ProjectionPreference preference, Double centerLongitude, Integer targetSpatialReferenceId);
}
