package com.recordplatform.schemashift.scheduler;

import com.recordplatform.schemashift.dto.SweepResult;
import com.recordplatform.schemashift.exception.EventStoreException;
import com.recordplatform.schemashift.service.orchestration.ChangeOrchestrator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchemaChangeSweepSchedulerTest {

    @Mock
    private ChangeOrchestrator changeOrchestrator;

    @InjectMocks
    private SchemaChangeSweepScheduler scheduler;

    @Test
    void runsTheGlobalSweep() {
        when(changeOrchestrator.processUnprocessedEvents()).thenReturn(SweepResult.builder().processed(2).build());

        scheduler.sweepUnprocessedEvents();

        verify(changeOrchestrator).processUnprocessedEvents();
    }

    @Test
    void storeOutageDoesNotKillTheScheduler() {
        when(changeOrchestrator.processUnprocessedEvents())
                .thenThrow(new EventStoreException("read failed", new RuntimeException("down")));

        assertThatCode(() -> scheduler.sweepUnprocessedEvents()).doesNotThrowAnyException();
    }
}
