package com.landingzone.orchestrator.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Construction rules of the step value types.
 */
class StepTest {

    final ExecutionSite site = new ExecutionSite("p", "r", "c");

    @Test
    void step_kindWithoutItsParameters_rejected() {
        assertThatThrownBy(() -> new Step("s", StepKind.SUBMIT_JOB, null, new JobSpec("j", List.of("q")), null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing its parameters");
        assertThatThrownBy(() -> new Step("s", StepKind.ARCHIVE, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Step.sense(" ", new SenseCondition("b", "p", Duration.ofSeconds(1), Duration.ofSeconds(1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void senseCondition_intervalMustBePositiveAndWithinTimeout() {
        assertThatThrownBy(() -> new SenseCondition("b", "p", Duration.ZERO, Duration.ofSeconds(10)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SenseCondition("b", "p", Duration.ofSeconds(60), Duration.ofSeconds(30)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds timeout");
        assertThatThrownBy(() -> new SenseCondition("", "p", Duration.ofSeconds(1), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void senseCondition_nullPrefixMeansWholeBucket() {
        assertThat(new SenseCondition("b", null, Duration.ofSeconds(1), Duration.ofSeconds(1)).describe())
                .isEqualTo("gs://b/");
    }

    @Test
    void jobSpec_defaultsAndDefensiveCopies() {
        List<String> queries = new ArrayList<>(List.of("SELECT 1"));
        JobSpec spec = new JobSpec("j", null, queries, null);
        queries.add("SELECT 2");

        assertThat(spec.type()).isEqualTo(JobType.HIVE);
        assertThat(spec.queries()).containsExactly("SELECT 1");
        assertThat(spec.properties()).isEmpty();
        assertThat(new JobSpec("j", List.of(" ", "")).hasBody()).isFalse();
    }

    @Test
    void jobSpec_forRunAppendsShortRunId() {
        UUID runId = UUID.fromString("1b4e28ba-2fa1-11d2-883f-0016d3cca427");

        JobSpec spec = new JobSpec("create-hive-db", List.of("q")).forRun(runId);

        assertThat(spec.jobId()).isEqualTo("create-hive-db-1b4e28ba");
        assertThat(spec.queries()).containsExactly("q");
    }

    @Test
    void pipelineDefinition_copiesSteps() {
        List<Step> steps = new ArrayList<>(List.of(Step.submitJob("a", new JobSpec("a", List.of("q")), site)));
        PipelineDefinition def = new PipelineDefinition("p", steps);
        steps.clear();

        assertThat(def.steps()).hasSize(1);
    }
}
