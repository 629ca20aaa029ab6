package com.landingzone.orchestrator.api;

import com.landingzone.orchestrator.api.dto.RunResponse;
import com.landingzone.orchestrator.api.dto.StepExecutionResponse;
import com.landingzone.orchestrator.model.RunStatus;
import com.landingzone.orchestrator.service.PipelineRunService;
import com.landingzone.orchestrator.service.PipelineTrigger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for triggering and reporting pipeline runs.
 *
 * <pre>
 *   POST /runs              start one run of the configured pipeline
 *   GET  /runs              list runs, newest first (optional ?status=FAILED)
 *   GET  /runs/{id}         current state of a run
 *   GET  /runs/{id}/steps   steps executed so far, with their results
 * </pre>
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final PipelineTrigger    trigger;
    private final PipelineRunService runService;

    public RunController(PipelineTrigger trigger, PipelineRunService runService) {
        this.trigger    = trigger;
        this.runService = runService;
    }

    /**
     * Start a run. Returns 201 with the PENDING run; poll GET /runs/{id}
     * for progress.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs
     */
    @PostMapping
    public ResponseEntity<RunResponse> trigger() {
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(trigger.trigger()));
    }

    @GetMapping
    public List<RunResponse> list(@RequestParam(required = false) RunStatus status) {
        return runService.list(status).stream()
                .map(RunResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return runService.findById(id)
                .map(RunResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/steps")
    public List<StepExecutionResponse> getSteps(@PathVariable UUID id) {
        runService.findById(id).orElseThrow(() -> notFound(id));
        return runService.getSteps(id).stream()
                .map(StepExecutionResponse::from)
                .toList();
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id);
    }
}
