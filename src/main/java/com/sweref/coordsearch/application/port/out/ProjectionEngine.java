package com.sweref.coordsearch.application.port.out;

import com.sweref.coordsearch.domain.model.SourcePoint;
import com.sweref.coordsearch.domain.model.TransformedPoint;

import java.util.concurrent.CompletableFuture;

/**
 * Output port for the projection-computation module.
 *
 * {@link #load()} prepares the module asynchronously and may be slow; {@link #project}
 * is synchronous and may only be called once a load has completed.
 */
public interface ProjectionEngine {

    CompletableFuture<Void> load();

    /**
     * Projects a point into the target spatial reference.
     *
     * @return the projected point; its spatial reference id may be null
     */
    TransformedPoint project(SourcePoint point, int targetSpatialReferenceId);
}
