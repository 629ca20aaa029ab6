package com.landingzone.orchestrator.service;

import com.landingzone.orchestrator.engine.StepChainExecutor;
import com.landingzone.orchestrator.model.PipelineRun;
import com.landingzone.orchestrator.model.RunStatus;
import com.landingzone.orchestrator.pipeline.ExecutionSite;
import com.landingzone.orchestrator.pipeline.JobSpec;
import com.landingzone.orchestrator.pipeline.PipelineDefinition;
import com.landingzone.orchestrator.pipeline.PipelineDefinitionFactory;
import com.landingzone.orchestrator.pipeline.Step;
import com.landingzone.orchestrator.support.TestRuns;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineTriggerTest {

    @Mock PipelineDefinitionFactory definitions;
    @Mock StepChainExecutor         executor;
    @Mock PipelineRunService        runService;

    PipelineTrigger trigger;

    final List<Step> steps = List.of(Step.submitJob("job_a",
            new JobSpec("job-a", List.of("SELECT 1")), new ExecutionSite("p", "r", "c")));

    @BeforeEach
    void setUp() {
        trigger = new PipelineTrigger(definitions, executor, runService, 1);
        when(definitions.build()).thenReturn(new PipelineDefinition("gcsarchive", steps));
    }

    @AfterEach
    void tearDown() {
        trigger.shutdown();
    }

    @Test
    void trigger_returnsPendingRunAndExecutesItOnWorker() {
        PipelineRun created = TestRuns.runWithId("gcsarchive", 1);
        PipelineRun loaded  = TestRuns.runWithId("gcsarchive", 1);
        TestRuns.setId(loaded, created.getId());
        when(runService.create("gcsarchive", 1)).thenReturn(created);
        when(runService.findById(created.getId())).thenReturn(Optional.of(loaded));

        PipelineRun returned = trigger.trigger();

        assertThat(returned).isSameAs(created);
        assertThat(returned.getStatus()).isEqualTo(RunStatus.PENDING);
        verify(executor, timeout(2000)).execute(loaded, steps);
    }

    @Test
    void trigger_workerCrashes_runAborted() {
        PipelineRun created = TestRuns.runWithId("gcsarchive", 1);
        when(runService.create("gcsarchive", 1)).thenReturn(created);
        when(runService.findById(created.getId())).thenReturn(Optional.of(created));
        when(executor.execute(any(), any())).thenThrow(new IllegalStateException("connection pool exhausted"));

        trigger.trigger();

        verify(runService, timeout(2000)).abort(eq(created.getId()), startsWith("Aborted: connection pool"));
    }

    @Test
    void runNow_executesOnCallingThread() {
        PipelineRun finished = TestRuns.runWithId("gcsarchive", 1);
        when(executor.run("gcsarchive", steps)).thenReturn(finished);

        assertThat(trigger.runNow()).isSameAs(finished);
        verify(runService, never()).create(any(), anyInt());
    }
}
