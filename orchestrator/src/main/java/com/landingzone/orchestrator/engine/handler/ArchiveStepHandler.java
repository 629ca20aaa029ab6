package com.landingzone.orchestrator.engine.handler;

import com.landingzone.orchestrator.engine.Archiver;
import com.landingzone.orchestrator.engine.ExecutionResult;
import com.landingzone.orchestrator.engine.StepContext;
import com.landingzone.orchestrator.engine.StepHandler;
import com.landingzone.orchestrator.pipeline.ArchiveSpec;
import com.landingzone.orchestrator.pipeline.Step;
import com.landingzone.orchestrator.pipeline.StepKind;
import org.springframework.stereotype.Component;

@Component
public class ArchiveStepHandler implements StepHandler {

    private final Archiver archiver;

    public ArchiveStepHandler(Archiver archiver) {
        this.archiver = archiver;
    }

    @Override public StepKind kind() { return StepKind.ARCHIVE; }

    @Override
    public ExecutionResult execute(Step step, StepContext ctx) {
        ArchiveSpec spec = step.archive();
        return archiver.archive(spec.source(), spec.destination(), spec.failWhenEmpty());
    }
}
