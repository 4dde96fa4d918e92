package com.crosscheck.core.agent;

import com.crosscheck.core.model.Artifact;

import java.util.List;

/**
 * External collaborator that does the actual judging behind a {@link ValidatorAgent}.
 */
@FunctionalInterface
public interface ValidatorJudgment {

    Judgment judge(Artifact artifact, List<String> criteria);

    record Judgment(boolean pass, String feedback) {}
}
