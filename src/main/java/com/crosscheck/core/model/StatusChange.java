package com.crosscheck.core.model;

import java.time.Instant;

/**
 * One entry of a task's status trail, appended by the registry on every state change.
 *
 * @param from    previous state, null for the entry recorded at creation
 * @param to      state entered
 * @param agentId agent holding the task across the change, if any
 * @param at      when the change was applied
 */
public record StatusChange(
    TaskState from,
    TaskState to,
    String agentId,
    Instant at
) {}
