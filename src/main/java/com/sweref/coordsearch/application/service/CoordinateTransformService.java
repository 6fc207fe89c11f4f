package com.sweref.coordsearch.application.service;

import com.sweref.coordsearch.application.port.out.ProjectionEngine;
import com.sweref.coordsearch.domain.model.CoordinateKeys;
import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.SourcePoint;
import com.sweref.coordsearch.domain.model.TransformedPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Projects a SWEREF 99 point into the map's spatial reference.
 *
 * The projection module is only loaded when the source and target references differ.
 */
@Service
public class CoordinateTransformService {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateTransformService.class);

    private final ProjectionEngine projectionEngine;
    private final ProjectionModuleLoader moduleLoader;

    public CoordinateTransformService(ProjectionEngine projectionEngine, ProjectionModuleLoader moduleLoader) {
        this.projectionEngine = projectionEngine;
        this.moduleLoader = moduleLoader;
    }

    /**
     * @param targetSpatialReferenceId wkid of the map; null fails with
     *                                 {@link CoordinateKeys#ERROR_NO_SPATIAL_REFERENCE}
     * @return future of the projected point; failures complete it with a
     *         {@link CoordinateTransformException}
     */
    public CompletableFuture<TransformedPoint> transform(
            double easting, double northing, Projection projection, Integer targetSpatialReferenceId) {
        if (targetSpatialReferenceId == null) {
            return CompletableFuture.failedFuture(new CoordinateTransformException(
                    CoordinateKeys.ERROR_NO_SPATIAL_REFERENCE, "Map spatial reference is unavailable"));
        }

        SourcePoint source;
        try {
            source = createSourcePoint(easting, northing, projection);
        } catch (CoordinateTransformException e) {
            return CompletableFuture.failedFuture(e);
        }

        int target = targetSpatialReferenceId;
        if (source.getSpatialReferenceId() == target) {
            logger.debug("Source already in spatial reference {}, no transform needed", target);
            return CompletableFuture.completedFuture(TransformedPoint.of(source));
        }

        return moduleLoader.ensureLoaded(projectionEngine)
                .thenApply(ignored -> project(source, target));
    }

    /**
     * Tags the pair with the projection's EPSG code.
     */
    public SourcePoint createSourcePoint(double easting, double northing, Projection projection) {
        if (projection == null || projection.getEpsgCode() <= 0) {
            throw new CoordinateTransformException(
                    CoordinateKeys.ERROR_INVALID_PROJECTION, "Projection has no usable EPSG code");
        }
        if (!Double.isFinite(easting) || !Double.isFinite(northing)) {
            throw new CoordinateTransformException(
                    CoordinateKeys.ERROR_INVALID_COORDINATES, "Coordinates must be finite");
        }
        return new SourcePoint(easting, northing, projection.getEpsgCode());
    }

    private TransformedPoint project(SourcePoint source, int target) {
        TransformedPoint projected;
        try {
            projected = projectionEngine.project(source, target);
        } catch (CoordinateTransformException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CoordinateTransformException(
                    CoordinateKeys.ERROR_TRANSFORM, "Projection to " + target + " failed", e);
        }

        if (projected == null || !projected.isFinite()) {
            throw new CoordinateTransformException(
                    CoordinateKeys.ERROR_TRANSFORM, "Projection to " + target + " produced no finite point");
        }
        if (projected.getSpatialReferenceId() == null) {
            projected = projected.withSpatialReference(target);
        }
        logger.debug("Projected {} to {}", source, projected);
        return projected;
    }

    /**
     * Exception raised when loading the projection module or projecting a point fails.
     * Carries the error key reported to the user.
     */
    public static class CoordinateTransformException extends RuntimeException {
        private final String errorKey;

        public CoordinateTransformException(String errorKey, String message) {
            super(message);
            this.errorKey = errorKey;
        }

        public CoordinateTransformException(String errorKey, String message, Throwable cause) {
            super(message, cause);
            this.errorKey = errorKey;
        }

        public String getErrorKey() {
            return errorKey;
        }
    }
}
