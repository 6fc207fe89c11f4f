package com.sweref.coordsearch.application.service;

import com.sweref.coordsearch.application.port.out.MapViewAccessor;
import com.sweref.coordsearch.application.service.CoordinateTransformService.CoordinateTransformException;
import com.sweref.coordsearch.domain.model.CoordinateKeys;
import com.sweref.coordsearch.domain.model.CoordinateSearchResult;
import com.sweref.coordsearch.domain.model.DetectionResult;
import com.sweref.coordsearch.domain.model.ParsedCoordinate;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import com.sweref.coordsearch.domain.model.TransformedPoint;
import com.sweref.coordsearch.domain.model.ValidationResult;
import com.sweref.coordsearch.domain.policy.BoundsValidator;
import com.sweref.coordsearch.domain.policy.CoordinateParser;
import com.sweref.coordsearch.domain.policy.ProjectionDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Runs the parse, detect, validate and transform pipeline for one search box.
 *
 * Every call takes a new sequence number. A call whose number is no longer the latest
 * when it reaches a checkpoint stops there, completes with {@link StaleSearchException}
 * and never reaches the listener. The last check and the listener callback happen under
 * one lock, so a newer call cannot start between them.
 */
public class CoordinateSearchSequencer {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateSearchSequencer.class);

    private final CoordinateParser parser;
    private final ProjectionDetector detector;
    private final BoundsValidator validator;
    private final CoordinateTransformService transformService;
    private final MapViewAccessor mapView;
    private final ProjectionPreference preference;
    private final CoordinateSearchListener listener;

    private final AtomicLong sequence = new AtomicLong();
    private final Object deliveryLock = new Object();

    public CoordinateSearchSequencer(
            CoordinateParser parser,
            ProjectionDetector detector,
            BoundsValidator validator,
            CoordinateTransformService transformService,
            MapViewAccessor mapView,
            ProjectionPreference preference,
            CoordinateSearchListener listener) {
        this.parser = parser;
        this.detector = detector;
        this.validator = validator;
        this.transformService = transformService;
        this.mapView = mapView;
        this.preference = preference == null ? ProjectionPreference.AUTO : preference;
        this.listener = listener == null ? CoordinateSearchListener.NONE : listener;
    }

    /**
     * Searches for the coordinates typed into the box.
     *
     * @return future completed with the result, exceptionally with
     *         {@link CoordinateSearchException} when the search failed, or exceptionally with
     *         {@link StaleSearchException} when a newer search superseded this one
     */
    public CompletableFuture<CoordinateSearchResult> searchCoordinates(String input) {
        long current;
        synchronized (deliveryLock) {
            current = sequence.incrementAndGet();
        }
        logger.debug("Coordinate search #{} started", current);

        try {
            ParsedCoordinate parsed = parser.parse(input);
            ensureCurrent(current);
            if (!parsed.isSuccess()) {
                return fail(current, parsed.getError(), List.of());
            }

            Set<String> warnings = new LinkedHashSet<>();
            parsed.warningKey().ifPresent(warnings::add);

            double easting = parsed.getEasting();
            double northing = parsed.getNorthing();
            DetectionResult detection = detector.detect(easting, northing, mapView.centerLongitude(), preference);
            ensureCurrent(current);
            if (!detection.isDetected()) {
                return fail(current, CoordinateKeys.ERROR_NO_PROJECTION, warnings);
            }
            warnings.addAll(detection.getWarnings());

            ValidationResult validation = validator.validate(easting, northing, detection.getProjection());
            ensureCurrent(current);
            if (!validation.isValid()) {
                return fail(current, validation.getErrors().get(0), warnings);
            }
            warnings.addAll(validation.getWarnings());

            Integer target = mapView.spatialReferenceId();
            return transformService.transform(easting, northing, detection.getProjection(), target)
                    .handle((point, error) -> error == null
                            ? deliver(current, buildResult(parsed, detection, validation, point, warnings))
                            : fail(current, errorKeyOf(current, error), warnings))
                    .thenCompose(Function.identity());
        } catch (StaleSearchException e) {
            logger.debug("Coordinate search #{} superseded by #{}", current, sequence.get());
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            logger.error("Coordinate search #{} failed unexpectedly", current, e);
            return fail(current, CoordinateKeys.ERROR_GENERIC, List.of());
        }
    }

    /**
     * Sequence number of the most recently started search.
     */
    public long currentSequence() {
        return sequence.get();
    }

    private void ensureCurrent(long current) {
        if (current != sequence.get()) {
            throw new StaleSearchException(current);
        }
    }

    private CompletableFuture<CoordinateSearchResult> deliver(long current, CoordinateSearchResult result) {
        synchronized (deliveryLock) {
            if (current != sequence.get()) {
                logger.debug("Dropping result of superseded coordinate search #{}", current);
                return CompletableFuture.failedFuture(new StaleSearchException(current));
            }
            try {
                listener.onSuccess(result);
            } catch (RuntimeException e) {
                logger.error("Coordinate search listener failed on success of #{}", current, e);
            }
        }
        logger.info("Coordinate search #{} resolved to {} at {}",
                current, result.getProjection().getCode(), result.getPoint());
        return CompletableFuture.completedFuture(result);
    }

    private CompletableFuture<CoordinateSearchResult> fail(long current, String errorKey, Collection<String> warnings) {
        List<String> context = List.copyOf(warnings);
        synchronized (deliveryLock) {
            if (current != sequence.get()) {
                logger.debug("Dropping error {} of superseded coordinate search #{}", errorKey, current);
                return CompletableFuture.failedFuture(new StaleSearchException(current));
            }
            try {
                listener.onError(errorKey, context);
            } catch (RuntimeException e) {
                logger.error("Coordinate search listener failed on error of #{}", current, e);
            }
        }
        logger.debug("Coordinate search #{} failed with {}", current, errorKey);
        return CompletableFuture.failedFuture(new CoordinateSearchException(errorKey, context));
    }

    private static CoordinateSearchResult buildResult(
            ParsedCoordinate parsed,
            DetectionResult detection,
            ValidationResult validation,
            TransformedPoint point,
            Set<String> warnings) {
        return CoordinateSearchResult.builder()
                .point(point)
                .projection(detection.getProjection())
                .easting(parsed.getEasting())
                .northing(parsed.getNorthing())
                .validation(validation)
                .format(parsed.getFormat())
                .confidence(detection.getConfidence())
                .alternatives(detection.getAlternatives())
                .warnings(new ArrayList<>(warnings))
                .build();
    }

    private static String errorKeyOf(long current, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CoordinateTransformException transformException) {
            return transformException.getErrorKey();
        }
        logger.error("Coordinate search #{} transform failed unexpectedly", current, cause);
        return CoordinateKeys.ERROR_GENERIC;
    }

    static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Completion of a search that a newer search superseded. Internal; never reported to users.
     */
    public static class StaleSearchException extends RuntimeException {
        private final long sequence;

        public StaleSearchException(long sequence) {
            super(CoordinateKeys.SEARCH_OUTDATED);
            this.sequence = sequence;
        }

        public long getSequence() {
            return sequence;
        }
    }

    /**
     * Failed search. The error key is the one delivered to the listener.
     */
    public static class CoordinateSearchException extends RuntimeException {
        private final String errorKey;
        private final List<String> warnings;

        public CoordinateSearchException(String errorKey, List<String> warnings) {
            super(errorKey);
            this.errorKey = errorKey;
            this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }

        public String getErrorKey() {
            return errorKey;
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }
}
