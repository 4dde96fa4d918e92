package com.crosscheck.core.registry;

public class EscalationNotFoundException extends RuntimeException {

    public EscalationNotFoundException(String message) {
        super(message);
    }
}
