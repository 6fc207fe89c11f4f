package com.sweref.coordsearch.infrastructure.map;

import com.sweref.coordsearch.application.port.out.MapViewAccessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Map view state taken from configuration, for hosts without a live map.
 */
@Component
public class ConfiguredMapViewAccessor implements MapViewAccessor {

    private final Integer spatialReferenceId;
    private final Double centerLongitude;

    public ConfiguredMapViewAccessor(
            @Value("${app.map.spatial-reference-wkid:3857}") Integer spatialReferenceId,
            @Value("${app.map.center-longitude:#{null}}") Double centerLongitude) {
        this.spatialReferenceId = spatialReferenceId;
        this.centerLongitude = centerLongitude;
    }

    @Override
    public Double centerLongitude() {
        if (centerLongitude == null || !Double.isFinite(centerLongitude)) {
            return null;
        }
        return centerLongitude;
    }

    @Override
    public Integer spatialReferenceId() {
        return spatialReferenceId;
    }
}
