package com.crosscheck.dispatch.api;

import com.crosscheck.core.engine.OrchestrationEngine;
import com.crosscheck.core.model.Task;
import com.crosscheck.core.model.TaskState;
import com.crosscheck.core.registry.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for task submission, inspection and cancellation.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final OrchestrationEngine engine;

    public TaskController(OrchestrationEngine engine) {
        this.engine = engine;
    }

    /**
     * POST /api/v1/tasks: Submit a task. Assignment and validation run asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody TaskRequest request) {
        Task task;
        try {
            task = engine.submit(request.toSubmission());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        log.info("Accepted task {} for component {}", task.id(), task.componentId());
        return ResponseEntity.accepted().body(Map.of(
                "task_id", task.id(),
                "state", task.state().name()
        ));
    }

    /**
     * GET /api/v1/tasks: List tasks, optionally filtered by state.
     */
    @GetMapping
    public ResponseEntity<?> list(@RequestParam(name = "state", required = false) String state) {
        TaskState filter = null;
        if (state != null && !state.isBlank()) {
            try {
                filter = TaskState.valueOf(state.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid state: " + state));
            }
        }
        return ResponseEntity.ok(engine.list(filter).stream().map(TaskView::from).toList());
    }

    /**
     * GET /api/v1/tasks/{id}: Task state, attempt history and terminal reason.
     */
    @GetMapping("/{id}")
    public ResponseEntity<TaskView> get(@PathVariable String id) {
        return engine.find(id)
                .map(task -> ResponseEntity.ok(TaskView.from(task)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/tasks/{id}: Cancel a task. 409 if it already finished.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id,
                                                      @RequestParam(name = "reason", required = false) String reason) {
        Optional<Task> cancelled;
        try {
            cancelled = engine.cancel(id, reason);
        } catch (TaskNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
        if (cancelled.isEmpty()) {
            String state = engine.find(id).map(t -> t.state().name()).orElse("UNKNOWN");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", "Task " + id + " already finished",
                    "state", state
            ));
        }
        return ResponseEntity.accepted().body(Map.of(
                "task_id", id,
                "state", cancelled.get().state().name()
        ));
    }
}
