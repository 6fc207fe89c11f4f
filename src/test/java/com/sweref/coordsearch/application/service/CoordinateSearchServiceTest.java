package com.sweref.coordsearch.application.service;

import com.sweref.coordsearch.application.port.out.MapViewAccessor;
import com.sweref.coordsearch.domain.model.CoordinateSearchResult;
import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import com.sweref.coordsearch.domain.model.TransformedPoint;
import com.sweref.coordsearch.domain.policy.BoundsValidator;
import com.sweref.coordsearch.domain.policy.ProjectionCatalog;
import com.sweref.coordsearch.domain.policy.ProjectionDetector;
import com.sweref.coordsearch.module.test.support.TestFixtures;
import com.sweref.coordsearch.module.test.support.TestFixtures.Inputs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CoordinateSearchServiceTest {

    @Mock
    private CoordinateTransformService transformService;

    private CoordinateSearchService service;

    @BeforeEach
    void setUp() {
        service = new CoordinateSearchService(
                TestFixtures.parser(),
                new ProjectionDetector(),
                new BoundsValidator(),
                transformService,
                MapViewAccessor.fixed(20.3, 3857),
                ProjectionPreference.AUTO,
                300);
    }

    @Test
    void testSearchOnce_NoOverrides_UsesConfiguredMapView() throws Exception {
        when(transformService.transform(anyDouble(), anyDouble(), any(Projection.class), eq(3857)))
                .thenReturn(CompletableFuture.completedFuture(new TransformedPoint(1, 2, 3857)));

        CoordinateSearchResult result = service.searchOnce("150000 6500000", null, null, null)
                .get(1, TimeUnit.SECONDS);

        assertThat(result.getProjection().getEpsgCode()).isEqualTo(3016);
    }

    @Test
    void testSearchOnce_Overrides_TakePrecedence() throws Exception {
        when(transformService.transform(anyDouble(), anyDouble(), any(Projection.class), eq(3006)))
                .thenReturn(CompletableFuture.completedFuture(new TransformedPoint(150000, 6500000, 3006)));

        CoordinateSearchResult result = service.searchOnce("150000 6500000", ProjectionPreference.ZONE, 12.1, 3006)
                .get(1, TimeUnit.SECONDS);

        assertThat(result.getProjection().getEpsgCode()).isEqualTo(3007);
        assertThat(result.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void testOpenSession_EachSessionSequencedIndependently() throws Exception {
        when(transformService.transform(anyDouble(), anyDouble(), any(Projection.class), eq(3857)))
                .thenReturn(CompletableFuture.completedFuture(new TransformedPoint(1, 2, 3857)));

        CoordinateSearchSequencer first = service.openSession(null, null);
        CoordinateSearchSequencer second = service.openSession(ProjectionPreference.TM, null);

        first.searchCoordinates(Inputs.TM_SPACE).get(1, TimeUnit.SECONDS);
        CoordinateSearchResult result = second.searchCoordinates(Inputs.TM_SPACE).get(1, TimeUnit.SECONDS);

        assertThat(first.currentSequence()).isEqualTo(1);
        assertThat(result.getProjection()).isEqualTo(ProjectionCatalog.SWEREF99_TM);
        assertThat(result.getConfidence()).isEqualTo(0.9);
        verify(transformService, times(2))
                .transform(anyDouble(), anyDouble(), any(Projection.class), eq(3857));
    }

    @Test
    void testOpenDebouncedSession_QuietInput_DeliveredThroughSequencer() throws Exception {
        when(transformService.transform(anyDouble(), anyDouble(), any(Projection.class), eq(3857)))
                .thenReturn(CompletableFuture.completedFuture(new TransformedPoint(1, 2, 3857)));
        CompletableFuture<CoordinateSearchResult> delivered = new CompletableFuture<>();
        CoordinateSearchListener listener = new CoordinateSearchListener() {
            @Override
            public void onSuccess(CoordinateSearchResult result) {
                delivered.complete(result);
            }

            @Override
            public void onError(String errorKey, List<String> warnings) {
                delivered.completeExceptionally(new IllegalStateException(errorKey));
            }
        };

        try (CoordinateSearchDebouncer debouncer = service.openDebouncedSession(null, listener)) {
            debouncer.submit(Inputs.TM_SPACE);

            CoordinateSearchResult result = delivered.get(5, TimeUnit.SECONDS);

            assertThat(result.getPoint()).isEqualTo(new TransformedPoint(1, 2, 3857));
            assertThat(debouncer.getSequencer().currentSequence()).isEqualTo(1);
        }
    }
}
