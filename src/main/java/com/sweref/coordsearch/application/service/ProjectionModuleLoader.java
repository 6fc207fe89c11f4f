package com.sweref.coordsearch.application.service;

import com.sweref.coordsearch.application.port.out.ProjectionEngine;
import com.sweref.coordsearch.application.service.CoordinateTransformService.CoordinateTransformException;
import com.sweref.coordsearch.domain.model.CoordinateKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Memoizes projection module loads, keyed by engine instance.
 *
 * Concurrent requesters share one in-flight load. A requester claims the load by
 * registering a placeholder future before the load starts, so "load started but not yet
 * registered" is never observable. A load that times out or fails is evicted before the
 * failure is published, and the next request starts a fresh attempt.
 */
@Component
public class ProjectionModuleLoader {

    private static final Logger logger = LoggerFactory.getLogger(ProjectionModuleLoader.class);

    private final ConcurrentMap<ProjectionEngine, CompletableFuture<Void>> loads = new ConcurrentHashMap<>();
    private final Duration loadTimeout;
    private final Scheduler scheduler;

    @Autowired
    public ProjectionModuleLoader(@Value("${app.coordinates.projection-load-timeout-ms:5000}") long loadTimeoutMs) {
        this(Duration.ofMillis(loadTimeoutMs), Schedulers.boundedElastic());
    }

    public ProjectionModuleLoader(Duration loadTimeout, Scheduler scheduler) {
        this.loadTimeout = loadTimeout;
        this.scheduler = scheduler;
    }

    /**
     * @return future that completes once the engine is loaded, or exceptionally with a
     *         {@link CoordinateTransformException} on timeout or load failure
     */
    public CompletableFuture<Void> ensureLoaded(ProjectionEngine engine) {
        if (engine == null) {
            return CompletableFuture.failedFuture(new CoordinateTransformException(
                    CoordinateKeys.ERROR_PROJECTION_LOAD, "Projection module unavailable"));
        }

        CompletableFuture<Void> pending = new CompletableFuture<>();
        CompletableFuture<Void> existing = loads.putIfAbsent(engine, pending);
        if (existing != null) {
            return existing;
        }

        logger.info("Loading projection module {} (timeout {} ms)",
                engine.getClass().getSimpleName(), loadTimeout.toMillis());

        Mono.defer(() -> Mono.fromFuture(engine.load()))
                .subscribeOn(scheduler)
                .timeout(loadTimeout, scheduler)
                .subscribe(
                        ignored -> {
                        },
                        error -> {
                            loads.remove(engine, pending);
                            CoordinateTransformException failure = toLoadFailure(error);
                            logger.warn("Projection module load failed with {}, evicted for retry",
                                    failure.getErrorKey(), error);
                            pending.completeExceptionally(failure);
                        },
                        () -> {
                            logger.info("Projection module {} loaded", engine.getClass().getSimpleName());
                            pending.complete(null);
                        });
        return pending;
    }

    public boolean isLoaded(ProjectionEngine engine) {
        CompletableFuture<Void> load = loads.get(engine);
        return load != null && load.isDone() && !load.isCompletedExceptionally();
    }

    /**
     * Forgets every memoized load.
     */
    public void clear() {
        loads.clear();
    }

    private static CoordinateTransformException toLoadFailure(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof CoordinateTransformException transformException) {
            return transformException;
        }
        if (cause instanceof TimeoutException) {
            return new CoordinateTransformException(
                    CoordinateKeys.ERROR_PROJECTION_TIMEOUT, "Projection module load timed out", cause);
        }
        return new CoordinateTransformException(
                CoordinateKeys.ERROR_PROJECTION_LOAD, "Projection module load failed", cause);
    }
}
