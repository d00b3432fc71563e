package com.todayatsg.backend.startup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.todayatsg.backend.config.IngestionProperties;
import com.todayatsg.backend.ingestion.IngestionRunService;
import com.todayatsg.backend.model.dto.IngestionRunStatus;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IngestionSchedulerTest {

    @Mock
    private IngestionRunService runService;

    private final IngestionProperties properties = new IngestionProperties();

    @Test
    void weeklyRunUsesTheComprehensiveLimit() {
        when(runService.startAllSources(IngestionRunService.TRIGGER_WEEKLY, 1000))
                .thenReturn(new IngestionRunStatus("run-1", IngestionRunService.TRIGGER_WEEKLY, 1000, List.of()));

        new IngestionScheduler(runService, properties).weeklyRun();

        verify(runService).startAllSources(IngestionRunService.TRIGGER_WEEKLY, 1000);
    }

    @Test
    void skipsWhileAnotherRunIsActive() {
        when(runService.hasActiveRun()).thenReturn(true);

        boolean started = new IngestionScheduler(runService, properties).trigger(IngestionRunService.TRIGGER_DAILY, 500);

        assertThat(started).isFalse();
        verify(runService, never()).startAllSources(anyString(), anyInt());
    }

    @Test
    void disabledScheduleDoesNothing() {
        properties.getSchedule().setEnabled(false);

        new IngestionScheduler(runService, properties).dailyRun();

        verify(runService, never()).hasActiveRun();
    }

    @Test
    void failureToStartIsContained() {
        when(runService.startAllSources(IngestionRunService.TRIGGER_DAILY, 500))
                .thenThrow(new IllegalStateException("no sources"));

        assertThat(new IngestionScheduler(runService, properties).trigger(IngestionRunService.TRIGGER_DAILY, 500))
                .isFalse();
    }
}
