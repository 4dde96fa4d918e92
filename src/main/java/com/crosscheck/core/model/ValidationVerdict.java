package com.crosscheck.core.model;

/**
 * Outcome of a single validation attempt.
 */
public enum ValidationVerdict {
    PASS,
    FAIL
}
