package com.crosscheck.core.escalation;

import com.crosscheck.core.model.EscalationReason;
import com.crosscheck.core.model.ValidationAttempt;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Classifies the failure pattern of an exhausted validation loop.
 * <p>
 * Only the last {@code window} failures are considered. If they all share one normalized
 * reason the producer is deadlocked on it ({@link EscalationReason#REPEATED_SAME_FAILURE});
 * otherwise the failures are {@link EscalationReason#DIVERGENT_FAILURE}.
 */
@Service
public class FailurePatternAnalyzer {

    static final String UNSPECIFIED = "unspecified";

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\p{Punct}]+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    /**
     * Lower-cases the feedback and collapses runs of whitespace and punctuation to a single
     * underscore, so "Missing error handling." and "missing_error_handling" compare equal.
     */
    public static String normalize(String feedback) {
        if (feedback == null || feedback.isBlank()) {
            return UNSPECIFIED;
        }
        String collapsed = SEPARATORS.matcher(feedback.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        String trimmed = EDGE_UNDERSCORES.matcher(collapsed).replaceAll("");
        return trimmed.isEmpty() ? UNSPECIFIED : trimmed;
    }

    public FailurePattern analyze(List<ValidationAttempt> history, int window) {
        List<String> failures = new ArrayList<>();
        for (ValidationAttempt attempt : history) {
            if (attempt.failed()) {
                failures.add(normalize(attempt.feedback()));
            }
        }
        List<String> reasons = failures.subList(Math.max(0, failures.size() - Math.max(window, 1)), failures.size());

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String reason : reasons) {
            counts.merge(reason, 1, Integer::sum);
        }
        String mostCommon = null;
        int mostCommonCount = 0;
        for (var entry : counts.entrySet()) {
            if (entry.getValue() > mostCommonCount) {
                mostCommon = entry.getKey();
                mostCommonCount = entry.getValue();
            }
        }

        EscalationReason classification = counts.size() == 1
                ? EscalationReason.REPEATED_SAME_FAILURE
                : EscalationReason.DIVERGENT_FAILURE;
        boolean oscillating = isOscillating(reasons);
        List<String> distinct = List.copyOf(counts.keySet());

        return new FailurePattern(classification, List.copyOf(reasons), distinct, mostCommon, mostCommonCount,
                oscillating, recommend(classification, distinct, mostCommon, reasons.size(), oscillating));
    }

    /**
     * True when some reason matches the one two failures back but differs from the one in between.
     */
    static boolean isOscillating(List<String> reasons) {
        for (int i = 2; i < reasons.size(); i++) {
            String current = reasons.get(i);
            if (current.equals(reasons.get(i - 2)) && !current.equals(reasons.get(i - 1))) {
                return true;
            }
        }
        return false;
    }

    private static String recommend(EscalationReason classification, List<String> distinct, String mostCommon,
                                    int failures, boolean oscillating) {
        if (classification == EscalationReason.REPEATED_SAME_FAILURE) {
            return String.format("All %d attempts failed with '%s'. The producer cannot resolve this on its own: "
                    + "FORCE_ACCEPT if the finding is a false positive, RETRY_RESET after changing the input, "
                    + "otherwise ABORT.", failures, mostCommon);
        }
        if (oscillating) {
            return String.format("Fixes alternate between %s, which suggests conflicting criteria. "
                    + "Clarify the criteria before a RETRY_RESET.", String.join(" and ", distinct));
        }
        return String.format("%d attempts raised %d different issues (most common: '%s'). "
                + "The criteria may be unclear; review them before a RETRY_RESET.", failures, distinct.size(), mostCommon);
    }
}
