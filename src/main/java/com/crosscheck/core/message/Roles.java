package com.crosscheck.core.message;

/**
 * Well-known recipient roles of the orchestration components.
 */
public final class Roles {

    public static final String ORCHESTRATOR = "orchestrator";
    public static final String VALIDATION_LOOP = "validation-loop";
    public static final String ESCALATION_MANAGER = "escalation-manager";
    public static final String HUMAN_OVERSIGHT = "human-oversight";

    private Roles() {
    }
}
