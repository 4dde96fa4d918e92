package com.crosscheck.core.agent;

import com.crosscheck.core.model.ValidationVerdict;

public record ValidationOutcome(ValidationVerdict verdict, String feedback) {

    public static ValidationOutcome pass(String feedback) {
        return new ValidationOutcome(ValidationVerdict.PASS, feedback);
    }

    public static ValidationOutcome fail(String feedback) {
        return new ValidationOutcome(ValidationVerdict.FAIL, feedback);
    }
}
