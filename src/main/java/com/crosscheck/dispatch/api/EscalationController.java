package com.crosscheck.dispatch.api;

import com.crosscheck.core.escalation.HumanApprovalGateway;
import com.crosscheck.core.model.Escalation;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.registry.AlreadyResolvedException;
import com.crosscheck.core.registry.EscalationNotFoundException;
import com.crosscheck.core.registry.TaskNotFoundException;
import com.crosscheck.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for the human-oversight channel: list escalations and resolve them.
 */
@RestController
@RequestMapping("/api/v1/escalations")
public class EscalationController {

    private static final Logger log = LoggerFactory.getLogger(EscalationController.class);

    private final TaskRegistry registry;
    private final HumanApprovalGateway gateway;

    public EscalationController(TaskRegistry registry, HumanApprovalGateway gateway) {
        this.registry = registry;
        this.gateway = gateway;
    }

    /**
     * GET /api/v1/escalations: Escalations awaiting a decision, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<EscalationView>> open() {
        return ResponseEntity.ok(registry.openEscalations().stream().map(EscalationView::from).toList());
    }

    /**
     * GET /api/v1/escalations/{taskId}: Every escalation of a task.
     */
    @GetMapping("/{taskId}")
    public ResponseEntity<List<EscalationView>> history(@PathVariable String taskId) {
        if (registry.find(taskId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(registry.escalationHistory(taskId).stream().map(EscalationView::from).toList());
    }

    /**
     * POST /api/v1/escalations/{taskId}/resolution: Submit a reviewer decision.
     * The decision is applied asynchronously; 409 if no escalation is open.
     */
    @PostMapping("/{taskId}/resolution")
    public ResponseEntity<Map<String, Object>> resolve(@PathVariable String taskId,
                                                       @RequestBody ResolutionRequest request) {
        if (request.resolution() == null || request.resolution().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "resolution is required"));
        }
        Resolution resolution;
        try {
            resolution = Resolution.valueOf(request.resolution().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid resolution: " + request.resolution()));
        }
        String reviewer = request.reviewer() != null && !request.reviewer().isBlank() ? request.reviewer() : "anonymous";

        Escalation escalation;
        try {
            escalation = gateway.submitResolution(taskId, resolution, reviewer, request.note());
        } catch (TaskNotFoundException | EscalationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AlreadyResolvedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
        log.info("Resolution {} for task {} submitted by {}", resolution, taskId, reviewer);
        return ResponseEntity.accepted().body(Map.of(
                "task_id", taskId,
                "escalation_id", escalation.id(),
                "resolution", resolution.name()
        ));
    }
}
