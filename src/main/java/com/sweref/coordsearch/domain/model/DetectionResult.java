package com.sweref.coordsearch.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Projection chosen for a coordinate pair, with a heuristic confidence in [0, 1].
 */
@Getter
@ToString
public class DetectionResult {
    private final Projection projection;
    private final double confidence;
    private final List<Projection> alternatives;
    private final List<String> warnings;

    public DetectionResult(
            Projection projection, double confidence, List<Projection> alternatives, List<String> warnings) {
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1");
        }
        this.projection = projection;
        this.confidence = confidence;
        this.alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static DetectionResult none(String warning) {
        return new DetectionResult(null, 0, List.of(), List.of(warning));
    }

    public boolean isDetected() {
        return projection != null;
    }
}
