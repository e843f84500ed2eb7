package org.javai.partlinker.library;

import java.util.Optional;

/**
 * Outcome of a full pipeline run.
 *
 * @param plan the classification
 * @param commit the commit result, absent when the run stopped before committing
 * @param lastStage the last stage that ran
 */
public record ReconcileOutcome(ReconciliationPlan plan, Optional<CommitResult> commit, ReconcileStage lastStage) {
}
