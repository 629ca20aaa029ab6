package com.landingzone.orchestrator.service;

import com.landingzone.orchestrator.model.PipelineRun;
import com.landingzone.orchestrator.model.RunStatus;
import com.landingzone.orchestrator.repository.PipelineRunRepository;
import com.landingzone.orchestrator.repository.StepExecutionRepository;
import com.landingzone.orchestrator.support.FakeClock;
import com.landingzone.orchestrator.support.TestRuns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PipelineRunService. Repositories are Mockito mocks.
 */
@ExtendWith(MockitoExtension.class)
class PipelineRunServiceTest {

    static final Instant BOOT = Instant.parse("2024-06-01T06:00:00Z");

    @Mock PipelineRunRepository   runRepo;
    @Mock StepExecutionRepository stepRepo;

    FakeClock          clock;
    PipelineRunService service;

    @BeforeEach
    void setUp() {
        clock   = new FakeClock(BOOT);
        service = new PipelineRunService(runRepo, stepRepo, clock);
    }

    // ------------------------------------------------------------------
    // create / list
    // ------------------------------------------------------------------

    @Test
    void create_persistsPendingRun() {
        when(runRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        PipelineRun run = service.create("gcsarchive", 6);

        assertThat(run.getStatus()).isEqualTo(RunStatus.PENDING);
        assertThat(run.getPipelineName()).isEqualTo("gcsarchive");
        assertThat(run.getStepCount()).isEqualTo(6);
        verify(runRepo).save(run);
    }

    @Test
    void list_withoutStatus_returnsEverything() {
        List<PipelineRun> all = List.of(TestRuns.runWithId("p", 1));
        when(runRepo.findAllByOrderByCreatedAtDesc()).thenReturn(all);

        assertThat(service.list(null)).isSameAs(all);
        verify(runRepo, never()).findByStatusOrderByCreatedAtDesc(any());
    }

    @Test
    void list_withStatus_filters() {
        service.list(RunStatus.TIMED_OUT);

        verify(runRepo).findByStatusOrderByCreatedAtDesc(RunStatus.TIMED_OUT);
        verify(runRepo, never()).findAllByOrderByCreatedAtDesc();
    }

    // ------------------------------------------------------------------
    // abort
    // ------------------------------------------------------------------

    @Test
    void abort_runningRun_markedFailed() {
        PipelineRun run = TestRuns.runWithId("p", 3);
        run.start(BOOT);
        run.advanceTo(0);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));
        clock.advance(Duration.ofSeconds(42));

        service.abort(run.getId(), "Aborted: database unreachable");

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getErrorDetail()).isEqualTo("Aborted: database unreachable");
        assertThat(run.getFinishedAt()).isEqualTo(BOOT.plusSeconds(42));
        verify(runRepo).save(run);
    }

    @Test
    void abort_finishedRun_leftAlone() {
        PipelineRun run = TestRuns.runWithId("p", 1);
        run.start(BOOT);
        run.succeed(BOOT);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        service.abort(run.getId(), "Aborted");

        assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        verify(runRepo, never()).save(any());
    }

    @Test
    void abort_unknownRun_noOp() {
        UUID id = UUID.randomUUID();
        when(runRepo.findById(id)).thenReturn(Optional.empty());

        service.abort(id, "Aborted");

        verify(runRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // recoverInterruptedRuns
    // ------------------------------------------------------------------

    @Test
    void recover_closesRunsLeftByPreviousProcess() {
        PipelineRun running = TestRuns.runWithId("p", 6);
        running.start(BOOT.minusSeconds(600));
        running.advanceTo(0);
        running.advanceTo(1);
        PipelineRun pending = TestRuns.runWithId("p", 6);

        when(runRepo.findByStatusInAndCreatedAtBefore(
                eq(EnumSet.of(RunStatus.PENDING, RunStatus.RUNNING)), eq(BOOT)))
                .thenReturn(List.of(running, pending));

        service.recoverInterruptedRuns();

        assertThat(running.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(running.getFailedStepIndex()).isEqualTo(1);
        assertThat(running.getErrorDetail()).startsWith("Interrupted");
        assertThat(pending.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(pending.getFailedStepIndex()).isNull();
        verify(runRepo).save(running);
        verify(runRepo).save(pending);
    }

    @Test
    void recover_nothingStale_savesNothing() {
        when(runRepo.findByStatusInAndCreatedAtBefore(any(), any())).thenReturn(List.of());

        service.recoverInterruptedRuns();

        verify(runRepo, never()).save(any());
    }
}
