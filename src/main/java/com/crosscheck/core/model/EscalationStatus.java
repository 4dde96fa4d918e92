package com.crosscheck.core.model;

public enum EscalationStatus {
    OPEN,
    RESOLVED
}
