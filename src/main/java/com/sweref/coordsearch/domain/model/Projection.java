package com.sweref.coordsearch.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable SWEREF 99 projection definition.
 *
 * Identity is the EPSG code; the table of definitions lives in
 * {@link com.sweref.coordsearch.domain.policy.ProjectionCatalog}.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(of = {"id", "epsgCode"})
public class Projection {

    private final String id;

    @EqualsAndHashCode.Include
    private final int epsgCode;

    private final String name;
    private final ProjectionKind kind;

    /** Zone label such as "18 00"; null for the TM projection. */
    private final String zoneId;

    private final double centralMeridian;
    private final double scaleFactor;
    private final double falseEasting;
    private final double falseNorthing;
    private final ProjectionBounds bounds;

    public Projection(
            String id,
            int epsgCode,
            String name,
            ProjectionKind kind,
            String zoneId,
            double centralMeridian,
            double scaleFactor,
            double falseEasting,
            double falseNorthing,
            ProjectionBounds bounds) {
        if (id == null || name == null || kind == null || bounds == null) {
            throw new IllegalArgumentException("Projection id, name, kind and bounds must not be null");
        }
        this.id = id;
        this.epsgCode = epsgCode;
        this.name = name;
        this.kind = kind;
        this.zoneId = zoneId;
        this.centralMeridian = centralMeridian;
        this.scaleFactor = scaleFactor;
        this.falseEasting = falseEasting;
        this.falseNorthing = falseNorthing;
        this.bounds = bounds;
    }

    public String getCode() {
        return "EPSG:" + epsgCode;
    }

    public boolean isZone() {
        return kind == ProjectionKind.ZONE;
    }
}
