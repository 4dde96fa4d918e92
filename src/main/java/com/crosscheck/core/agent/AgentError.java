package com.crosscheck.core.agent;

/**
 * Error reported by an agent that could not produce or judge an artifact.
 *
 * @param code    short machine-readable code
 * @param message human-readable detail
 */
public record AgentError(String code, String message) {
}
