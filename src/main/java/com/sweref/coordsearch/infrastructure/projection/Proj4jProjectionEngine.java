package com.sweref.coordsearch.infrastructure.projection;

import com.sweref.coordsearch.application.port.out.ProjectionEngine;
import com.sweref.coordsearch.application.service.CoordinateTransformService.CoordinateTransformException;
import com.sweref.coordsearch.domain.model.CoordinateKeys;
import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.SourcePoint;
import com.sweref.coordsearch.domain.model.TransformedPoint;
import com.sweref.coordsearch.domain.policy.ProjectionCatalog;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Projection engine backed by proj4j.
 *
 * {@link #load()} registers the SWEREF 99 projections, WGS 84 and Web Mercator.
 * Transforms are created per call since proj4j transforms keep per-call state.
 */
@Component
public class Proj4jProjectionEngine implements ProjectionEngine {

    private static final Logger logger = LoggerFactory.getLogger(Proj4jProjectionEngine.class);

    static final int WGS84 = 4326;
    static final int WEB_MERCATOR = 3857;
    static final int WEB_MERCATOR_LEGACY = 102100;

    private static final String WGS84_PARAMETERS = "+proj=longlat +datum=WGS84 +no_defs";
    private static final String WEB_MERCATOR_PARAMETERS =
            "+proj=merc +a=6378137 +b=6378137 +lat_ts=0 +lon_0=0 +x_0=0 +y_0=0 +k=1 +units=m"
                    + " +nadgrids=@null +wktext +no_defs";

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private final Map<Integer, CoordinateReferenceSystem> registry = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> load() {
        return CompletableFuture.runAsync(this::registerDefinitions);
    }

    @Override
    public TransformedPoint project(SourcePoint point, int targetSpatialReferenceId) {
        if (registry.isEmpty()) {
            throw new CoordinateTransformException(
                    CoordinateKeys.ERROR_PROJECTION_LOAD, "Projection engine has not been loaded");
        }
        CoordinateReferenceSystem source = registry.get(point.getSpatialReferenceId());
        if (source == null) {
            throw new CoordinateTransformException(
                    CoordinateKeys.ERROR_INVALID_PROJECTION,
                    "Unsupported source projection EPSG:" + point.getSpatialReferenceId());
        }
        CoordinateReferenceSystem target = registry.get(targetSpatialReferenceId);
        if (target == null) {
            throw new CoordinateTransformException(
                    CoordinateKeys.ERROR_TRANSFORM, "Unsupported target spatial reference " + targetSpatialReferenceId);
        }

        try {
            CoordinateTransform transform = transformFactory.createTransform(source, target);
            ProjCoordinate result = new ProjCoordinate();
            transform.transform(new ProjCoordinate(point.getX(), point.getY()), result);
            return new TransformedPoint(result.x, result.y, targetSpatialReferenceId);
        } catch (Proj4jException e) {
            throw new CoordinateTransformException(
                    CoordinateKeys.ERROR_TRANSFORM,
                    "proj4j failed projecting to " + targetSpatialReferenceId, e);
        }
    }

    public boolean supports(int spatialReferenceId) {
        return registry.containsKey(spatialReferenceId);
    }

    private void registerDefinitions() {
        for (Projection projection : ProjectionCatalog.all()) {
            register(projection.getEpsgCode(), projection.getCode(), toParameters(projection));
        }
        register(WGS84, "EPSG:4326", WGS84_PARAMETERS);
        register(WEB_MERCATOR, "EPSG:3857", WEB_MERCATOR_PARAMETERS);
        register(WEB_MERCATOR_LEGACY, "ESRI:102100", WEB_MERCATOR_PARAMETERS);
        logger.info("Registered {} coordinate reference systems", registry.size());
    }

    private void register(int spatialReferenceId, String name, String parameters) {
        registry.put(spatialReferenceId, crsFactory.createFromParameters(name, parameters));
    }

    static String toParameters(Projection projection) {
        return String.format(Locale.ROOT,
                "+proj=tmerc +lat_0=0 +lon_0=%s +k=%s +x_0=%s +y_0=%s +ellps=GRS80"
                        + " +towgs84=0,0,0,0,0,0,0 +units=m +no_defs",
                format(projection.getCentralMeridian()),
                format(projection.getScaleFactor()),
                format(projection.getFalseEasting()),
                format(projection.getFalseNorthing()));
    }

    private static String format(double value) {
        return value == Math.rint(value)
                ? Long.toString((long) value)
                : Double.toString(value);
    }
}
