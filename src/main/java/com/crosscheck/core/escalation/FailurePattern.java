package com.crosscheck.core.escalation;

import com.crosscheck.core.model.EscalationReason;

import java.util.List;

/**
 * Result of analysing the failed attempts that led to an escalation.
 *
 * @param classification   advisory classification
 * @param reasons          normalized reasons of the analysed failures, oldest first
 * @param distinctReasons  distinct normalized reasons in first-seen order
 * @param mostCommonReason most frequent reason, ties going to the earliest; null without failures
 * @param mostCommonCount  occurrences of {@code mostCommonReason}
 * @param oscillating      whether the reasons alternate A-B-A
 * @param recommendation   suggestion for the human reviewer
 */
public record FailurePattern(
    EscalationReason classification,
    List<String> reasons,
    List<String> distinctReasons,
    String mostCommonReason,
    int mostCommonCount,
    boolean oscillating,
    String recommendation
) {}
