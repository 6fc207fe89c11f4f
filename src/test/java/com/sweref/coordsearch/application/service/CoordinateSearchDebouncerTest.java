package com.sweref.coordsearch.application.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CoordinateSearchDebouncerTest {

    private static final Duration QUIET_PERIOD = Duration.ofMillis(300);

    @Mock
    private CoordinateSearchSequencer sequencer;

    private VirtualTimeScheduler scheduler;
    private CoordinateSearchDebouncer debouncer;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        debouncer = new CoordinateSearchDebouncer(sequencer, QUIET_PERIOD, scheduler);
    }

    @AfterEach
    void tearDown() {
        debouncer.close();
        scheduler.dispose();
    }

    @Test
    void testSubmit_Burst_OnlyLastInputSearched() {
        when(sequencer.searchCoordinates(anyString())).thenReturn(CompletableFuture.completedFuture(null));

        debouncer.submit("5");
        debouncer.submit("500000");
        debouncer.submit("500000 6500000");
        scheduler.advanceTimeBy(QUIET_PERIOD);

        verify(sequencer, times(1)).searchCoordinates("500000 6500000");
        verify(sequencer, never()).searchCoordinates("5");
        verify(sequencer, never()).searchCoordinates("500000");
    }

    @Test
    void testSubmit_InputWithinQuietPeriod_RestartsTimer() {
        when(sequencer.searchCoordinates(anyString())).thenReturn(CompletableFuture.completedFuture(null));

        debouncer.submit("500000");
        scheduler.advanceTimeBy(Duration.ofMillis(299));
        debouncer.submit("500000 6500000");
        scheduler.advanceTimeBy(Duration.ofMillis(299));

        verify(sequencer, never()).searchCoordinates(anyString());

        scheduler.advanceTimeBy(Duration.ofMillis(1));
        verify(sequencer, times(1)).searchCoordinates("500000 6500000");
    }

    @Test
    void testSubmit_SeparatedInputs_EachSearched() {
        when(sequencer.searchCoordinates(anyString())).thenReturn(CompletableFuture.completedFuture(null));

        debouncer.submit("500000 6500000");
        scheduler.advanceTimeBy(QUIET_PERIOD);
        debouncer.submit(null);
        scheduler.advanceTimeBy(QUIET_PERIOD);

        verify(sequencer).searchCoordinates("500000 6500000");
        verify(sequencer).searchCoordinates("");
    }

    @Test
    void testClose_PendingInputDiscarded() {
        debouncer.submit("500000 6500000");
        debouncer.close();
        scheduler.advanceTimeBy(QUIET_PERIOD);

        verify(sequencer, never()).searchCoordinates(anyString());
    }
}
