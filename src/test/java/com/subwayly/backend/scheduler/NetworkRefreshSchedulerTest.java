package com.subwayly.backend.scheduler;

import com.subwayly.backend.exception.EmptyDatasetException;
import com.subwayly.backend.exception.UpstreamFetchException;
import com.subwayly.backend.network.SampleNetworks;
import com.subwayly.backend.service.SubwayNetworkService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NetworkRefreshSchedulerTest {

    @Mock
    private SubwayNetworkService networkService;

    @InjectMocks
    private NetworkRefreshScheduler scheduler;

    @Test
    void testPreloadOnStart_Disabled_DoesNotFetch() {
        // Given
        ReflectionTestUtils.setField(scheduler, "preload", false);

        // When
        scheduler.preloadOnStart();

        // Then
        verifyNoInteractions(networkService);
    }

    @Test
    void testPreloadOnStart_Enabled_RefreshesOnce() {
        // Given
        ReflectionTestUtils.setField(scheduler, "preload", true);
        when(networkService.hasNetwork()).thenReturn(false);
        when(networkService.refresh()).thenReturn(SampleNetworks.downtown());

        // When
        scheduler.preloadOnStart();

        // Then
        verify(networkService, times(1)).refresh();
    }

    @Test
    void testPreloadOnStart_AlreadyLoaded_SkipsSecondFetch() {
        // Given: the startup report already built the snapshot lazily
        ReflectionTestUtils.setField(scheduler, "preload", true);
        when(networkService.hasNetwork()).thenReturn(true);

        // When
        scheduler.preloadOnStart();

        // Then
        verify(networkService, never()).refresh();
    }

    @Test
    void testScheduleRefresh_FetchFails_DoesNotPropagate() {
        // Given
        when(networkService.refresh()).thenThrow(new UpstreamFetchException("MBTA request for routes failed with status 503"));

        // When / Then
        assertDoesNotThrow(() -> scheduler.scheduleRefresh());
        verify(networkService, times(1)).refresh();
    }

    @Test
    void testPreloadOnStart_EmptyDataset_DoesNotPropagate() {
        ReflectionTestUtils.setField(scheduler, "preload", true);
        when(networkService.hasNetwork()).thenReturn(false);
        when(networkService.refresh()).thenThrow(new EmptyDatasetException("MBTA returned no routes for types [0, 1]"));

        assertDoesNotThrow(() -> scheduler.preloadOnStart());
    }
}
