package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.ProjectionBounds;
import com.sweref.coordsearch.domain.model.ProjectionKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed table of supported SWEREF 99 projections: the national TM grid and twelve local zones.
 *
 * All zones share one bounds envelope and differ only by central meridian. Detection
 * relies on that, so per-zone geometry must not be introduced here on its own.
 */
public final class ProjectionCatalog {

    public static final ProjectionBounds ZONE_BOUNDS = new ProjectionBounds(50_000, 250_000, 6_100_000, 7_700_000);

    public static final Projection SWEREF99_TM = new Projection(
            "sweref99-tm",
            3006,
            "SWEREF 99 TM",
            ProjectionKind.TM,
            null,
            15,
            0.9996,
            500_000,
            0,
            new ProjectionBounds(300_000, 700_000, 6_100_000, 7_700_000));

    private static final List<Projection> ZONES = List.of(
            zone("12 00", 3007, 12),
            zone("13 30", 3008, 13.5),
            zone("15 00", 3009, 15),
            zone("16 30", 3010, 16.5),
            zone("18 00", 3011, 18),
            zone("14 15", 3012, 14.25),
            zone("15 45", 3013, 15.75),
            zone("17 15", 3014, 17.25),
            zone("18 45", 3015, 18.75),
            zone("20 15", 3016, 20.25),
            zone("21 45", 3017, 21.75),
            zone("23 15", 3018, 23.25));

    private static final List<Projection> ALL;
    private static final Map<Integer, Projection> BY_EPSG;

    static {
        List<Projection> all = new ArrayList<>();
        all.add(SWEREF99_TM);
        all.addAll(ZONES);
        ALL = Collections.unmodifiableList(all);

        Map<Integer, Projection> byEpsg = new LinkedHashMap<>();
        for (Projection projection : ALL) {
            byEpsg.put(projection.getEpsgCode(), projection);
        }
        BY_EPSG = Collections.unmodifiableMap(byEpsg);
    }

    private ProjectionCatalog() {
    }

    private static Projection zone(String zoneId, int epsg, double centralMeridian) {
        return new Projection(
                "sweref99-" + zoneId.replaceAll("\\s+", "").toLowerCase(),
                epsg,
                "SWEREF 99 " + zoneId,
                ProjectionKind.ZONE,
                zoneId,
                centralMeridian,
                1.0,
                150_000,
                0,
                ZONE_BOUNDS);
    }

    /**
     * TM first, then the zones in table order.
     */
    public static List<Projection> all() {
        return ALL;
    }

    public static List<Projection> zones() {
        return ZONES;
    }

    public static Optional<Projection> byEpsg(int epsgCode) {
        return Optional.ofNullable(BY_EPSG.get(epsgCode));
    }

    /**
     * Zone whose central meridian is closest to the longitude. Ties go to the earlier table entry.
     */
    public static Projection nearestZone(double longitude) {
        Projection nearest = ZONES.get(0);
        double minDiff = Double.POSITIVE_INFINITY;
        for (Projection zone : ZONES) {
            double diff = Math.abs(zone.getCentralMeridian() - longitude);
            if (diff < minDiff) {
                nearest = zone;
                minDiff = diff;
            }
        }
        return nearest;
    }
}
