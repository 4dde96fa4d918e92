package com.crosscheck.core.model;

/**
 * Assignment precedence among PENDING tasks. Declared from most to least urgent.
 */
public enum TaskPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
