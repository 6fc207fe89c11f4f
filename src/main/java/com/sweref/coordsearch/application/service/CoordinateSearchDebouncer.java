package com.sweref.coordsearch.application.service;

import com.sweref.coordsearch.application.service.CoordinateSearchSequencer.StaleSearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Holds back keystroke-level input until the box has been quiet for the configured period,
 * then hands the latest text to the session's sequencer.
 */
public class CoordinateSearchDebouncer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateSearchDebouncer.class);

    private final CoordinateSearchSequencer sequencer;
    private final Sinks.Many<String> inputs = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable subscription;

    public CoordinateSearchDebouncer(CoordinateSearchSequencer sequencer, Duration quietPeriod, Scheduler timer) {
        this.sequencer = sequencer;
        this.subscription = inputs.asFlux()
                .sampleTimeout(input -> Mono.delay(quietPeriod, timer))
                .subscribe(this::run, error -> logger.error("Coordinate input stream failed", error));
    }

    /**
     * Records the box's current text. Earlier text still waiting out the quiet period is discarded.
     */
    public synchronized void submit(String input) {
        Sinks.EmitResult result = inputs.tryEmitNext(input == null ? "" : input);
        if (result.isFailure()) {
            logger.warn("Coordinate input dropped: {}", result);
        }
    }

    public CoordinateSearchSequencer getSequencer() {
        return sequencer;
    }

    @Override
    public synchronized void close() {
        subscription.dispose();
        inputs.tryEmitComplete();
    }

    private void run(String input) {
        sequencer.searchCoordinates(input).whenComplete((result, error) -> {
            if (error != null && CoordinateSearchSequencer.unwrap(error) instanceof StaleSearchException) {
                logger.debug("Debounced coordinate search superseded");
            }
        });
    }
}
