package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.CoordinateKeys;
import com.sweref.coordsearch.domain.model.DetectionResult;
import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Matches an easting/northing pair against the SWEREF 99 projection table.
 *
 * Zone candidates are found by the shared zone envelope only; when several match they are
 * ranked by how close their central meridian is to the map centre longitude.
 */
@Component
public class ProjectionDetector {

    private static final Logger logger = LoggerFactory.getLogger(ProjectionDetector.class);

    static final double CONFIDENCE_PREFERRED_ZONE = 1.0;
    static final double CONFIDENCE_PREFERRED_TM = 0.9;
    static final double CONFIDENCE_SINGLE_ZONE = 1.0;
    static final double CONFIDENCE_RANKED_ZONE = 0.85;
    static final double CONFIDENCE_UNRANKED_ZONE = 0.7;
    static final double CONFIDENCE_TM_FALLBACK = 0.6;

    /**
     * @param mapCenterLongitude map centre longitude in degrees, null when unknown
     * @param preference         null is treated as {@link ProjectionPreference#AUTO}
     */
    public DetectionResult detect(
            double easting, double northing, Double mapCenterLongitude, ProjectionPreference preference) {
        ProjectionPreference effective = preference == null ? ProjectionPreference.AUTO : preference;
        Double longitude = usableLongitude(mapCenterLongitude);

        boolean tmLikely = easting >= CoordinateRanges.TM_EASTING_MIN && easting <= CoordinateRanges.TM_EASTING_MAX;
        boolean zoneLikely = easting >= CoordinateRanges.ZONE_EASTING_MIN
                && easting <= CoordinateRanges.ZONE_EASTING_MAX;
        List<Projection> zoneCandidates = zoneLikely ? findMatchingZones(easting, northing) : List.of();

        logger.debug("Detecting projection for E={} N={} (tmLikely={}, zoneCandidates={}, lon={}, preference={})",
                easting, northing, tmLikely, zoneCandidates.size(), longitude, effective);

        if (effective == ProjectionPreference.ZONE && !zoneCandidates.isEmpty()) {
            List<Projection> ranked = rank(zoneCandidates, longitude);
            return build(ranked.get(0), CONFIDENCE_PREFERRED_ZONE, ranked.subList(1, ranked.size()), easting);
        }
        if (effective == ProjectionPreference.TM && tmLikely) {
            return build(ProjectionCatalog.SWEREF99_TM, CONFIDENCE_PREFERRED_TM, zoneCandidates, easting);
        }
        if (zoneCandidates.size() == 1) {
            return build(zoneCandidates.get(0), CONFIDENCE_SINGLE_ZONE, List.of(), easting);
        }
        if (zoneCandidates.size() > 1) {
            List<Projection> ranked = rank(zoneCandidates, longitude);
            double confidence = longitude == null ? CONFIDENCE_UNRANKED_ZONE : CONFIDENCE_RANKED_ZONE;
            return build(ranked.get(0), confidence, ranked.subList(1, ranked.size()), easting);
        }
        if (tmLikely) {
            return build(ProjectionCatalog.SWEREF99_TM, CONFIDENCE_TM_FALLBACK, List.of(), easting);
        }
        return DetectionResult.none(CoordinateKeys.ERROR_NO_PROJECTION);
    }

    private List<Projection> findMatchingZones(double easting, double northing) {
        List<Projection> matches = new ArrayList<>();
        for (Projection zone : ProjectionCatalog.zones()) {
            if (zone.getBounds().contains(easting, northing)) {
                matches.add(zone);
            }
        }
        return matches;
    }

    /**
     * Nearest zone by meridian first, then by meridian distance. Table order when the
     * longitude is unknown.
     */
    private List<Projection> rank(List<Projection> candidates, Double longitude) {
        if (candidates.isEmpty() || longitude == null) {
            return candidates;
        }
        Projection target = ProjectionCatalog.nearestZone(longitude);
        List<Projection> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator
                .comparing((Projection zone) -> !zone.equals(target))
                .thenComparingDouble(zone -> Math.abs(zone.getCentralMeridian() - longitude)));
        return ranked;
    }

    private DetectionResult build(
            Projection projection, double confidence, List<Projection> alternatives, double easting) {
        List<String> warnings = projection.getBounds()
                .isNearEastingEdge(easting, CoordinateRanges.BOUNDARY_WARNING_BUFFER)
                ? List.of(CoordinateKeys.WARNING_NEAR_BOUNDARY)
                : List.of();
        return new DetectionResult(projection, confidence, alternatives, warnings);
    }

    private static Double usableLongitude(Double longitude) {
        if (longitude == null || !Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            return null;
        }
        return longitude;
    }
}
