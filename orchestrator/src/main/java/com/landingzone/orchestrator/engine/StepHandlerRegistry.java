package com.landingzone.orchestrator.engine;

import com.landingzone.orchestrator.pipeline.Step;
import com.landingzone.orchestrator.pipeline.StepKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a step to the handler registered for its kind.
 *
 * All {@link StepHandler} beans are collected at startup via constructor
 * injection. Every kind must be covered exactly once, otherwise the
 * application refuses to start.
 *
 * <p>Every call is timed and counted:
 * <pre>
 *   landing.step.duration{kind}
 *   landing.step.calls{kind, status="ok|failed|timed_out"}
 * </pre>
 */
@Component
public class StepHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepHandlerRegistry.class);

    private final Map<StepKind, StepHandler> handlers = new EnumMap<>(StepKind.class);
    private final MeterRegistry meterRegistry;

    public StepHandlerRegistry(List<StepHandler> allHandlers, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (StepHandler handler : allHandlers) {
            StepHandler previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for step kind " + handler.kind()
                        + ": " + previous.getClass().getSimpleName()
                        + " and " + handler.getClass().getSimpleName());
            }
            log.info("Registered {} for step kind {}", handler.getClass().getSimpleName(), handler.kind());
        }
        for (StepKind kind : StepKind.values()) {
            if (!handlers.containsKey(kind)) {
                throw new IllegalStateException("No handler registered for step kind " + kind);
            }
        }
    }

    /**
     * Run one step and return its result. Never throws for handler failures:
     * an unexpected exception becomes a FAILED result carrying its message.
     */
    public ExecutionResult execute(Step step, StepContext ctx) {
        StepHandler handler = handlers.get(step.kind());
        String kindTag = step.kind().name().toLowerCase();

        Timer.Sample sample = Timer.start(meterRegistry);
        ExecutionResult result;
        try {
            result = handler.execute(step, ctx);
            if (result == null) {
                result = ExecutionResult.failed(ErrorKind.failureOf(step.kind()),
                        "Handler for step '" + step.name() + "' returned no result");
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error in step '{}' ({}): {}", step.name(), step.kind(), e.getMessage(), e);
            result = ExecutionResult.failed(ErrorKind.failureOf(step.kind()),
                    "Unexpected error in step '" + step.name() + "': " + e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("landing.step.duration", "kind", kindTag));
        }
        meterRegistry.counter("landing.step.calls",
                "kind", kindTag, "status", result.status().name().toLowerCase()).increment();
        return result;
    }
}
