package com.crosscheck.core.message;

import com.crosscheck.core.model.ValidationVerdict;

/**
 * Validator to validation loop: the verdict for one attempt. The validator is the message sender.
 */
public record ValidationResult(
    int round,
    int attemptNumber,
    ValidationVerdict verdict,
    String feedback
) implements MessagePayload {
}
