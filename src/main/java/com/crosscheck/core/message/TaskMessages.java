package com.crosscheck.core.message;

import com.crosscheck.core.model.Task;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the payloads that hand a task's current attempt to its producer or validator.
 */
public final class TaskMessages {

    /** Input key under which accumulated validator feedback is merged. */
    public static final String FEEDBACK_KEY = "feedback";

    private TaskMessages() {}

    public static TaskAssignment assignment(Task task) {
        List<String> feedback = task.failureFeedback();
        Map<String, Object> input = new LinkedHashMap<>(task.input());
        if (!feedback.isEmpty()) {
            input.put(FEEDBACK_KEY, feedback);
        }
        return new TaskAssignment(task.round(), task.currentAttemptNumber(), task.componentId(),
                input, task.criteria(), feedback);
    }

    public static ValidationRequest validationRequest(Task task) {
        return new ValidationRequest(task.round(), task.currentAttemptNumber(), task.componentId(),
                task.artifact(), task.criteria(), task.failureFeedback());
    }
}
