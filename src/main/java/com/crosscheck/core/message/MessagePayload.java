package com.crosscheck.core.message;

/**
 * Marker for the typed payload records carried by a {@link Message}.
 * Each implementation corresponds to exactly one {@link MessageType}.
 */
public interface MessagePayload {
}
