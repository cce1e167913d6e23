package uk.gegc.studyscheduler.features.repetition.application;

import java.time.Instant;
import java.util.List;

/**
 * Due set of one learner at one instant.
 *
 * @param dueCardIds due cards in queue order
 * @param nextDueAt  earliest due instant among cards not yet due, null when there is none
 * @param takenAt    instant the snapshot was computed for
 */
public record ReviewQueueSnapshot(List<String> dueCardIds, Instant nextDueAt, Instant takenAt) {

    public ReviewQueueSnapshot {
        dueCardIds = List.copyOf(dueCardIds);
    }

    public static ReviewQueueSnapshot empty(Instant takenAt) {
        return new ReviewQueueSnapshot(List.of(), null, takenAt);
    }

    public int dueCount() {
        return dueCardIds.size();
    }

    public boolean hasDueCards() {
        return !dueCardIds.isEmpty();
    }
}
