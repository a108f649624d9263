package com.delta.warmup.placement.api;

import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.model.PlacementTest;
import com.delta.warmup.placement.model.ScheduledEntry;
import com.delta.warmup.placement.model.SubmittedTest;
import com.delta.warmup.placement.model.TestSummary;
import com.delta.warmup.placement.service.TestOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class PlacementTestController {
    private final TestOrchestratorService orchestrator;

    public PlacementTestController(TestOrchestratorService orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/api/tests")
    @ResponseStatus(HttpStatus.CREATED)
    public SubmittedTest submit(
        @RequestHeader(DomainController.OWNER_HEADER) String ownerId,
        @RequestBody SubmitTestRequest request
    ) {
        if (request == null || request.domainId() == null || request.domainId().isBlank()) {
            throw new ValidationException("domainId is required");
        }
        return orchestrator.submitTest(ownerId, request.domainId(), request.provider());
    }

    @GetMapping("/api/tests/{id}")
    public PlacementTest get(
        @RequestHeader(DomainController.OWNER_HEADER) String ownerId,
        @PathVariable("id") String id
    ) {
        return orchestrator.getTest(ownerId, id);
    }

    @PostMapping("/api/tests/{id}/poll")
    public ResponseEntity<?> poll(
        @RequestHeader(DomainController.OWNER_HEADER) String ownerId,
        @PathVariable("id") String id
    ) {
        orchestrator.getTest(ownerId, id);
        TestSummary summary = orchestrator.pollResults(id);
        if (summary == null) {
            PlacementTest test = orchestrator.getTest(id);
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("testId", test.id(), "status", test.status().name()));
        }
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/api/schedules")
    @ResponseStatus(HttpStatus.CREATED)
    public ScheduledEntry schedule(
        @RequestHeader(DomainController.OWNER_HEADER) String ownerId,
        @RequestBody ScheduleTestRequest request
    ) {
        if (request == null || request.domainId() == null || request.domainId().isBlank()) {
            throw new ValidationException("domainId is required");
        }
        return orchestrator.scheduleTest(ownerId, request.domainId(), request.scheduledFor());
    }

    @GetMapping("/api/schedules")
    public List<ScheduledEntry> listScheduled() {
        return orchestrator.listScheduledTests();
    }

    @DeleteMapping("/api/schedules/{id}")
    public ScheduledEntry cancel(@PathVariable("id") String id) {
        return orchestrator.cancelScheduledTest(id);
    }
}
