package uk.gegc.studyscheduler.shared.persistence;

import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.session.domain.model.ReviewSession;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;
import uk.gegc.studyscheduler.shared.exception.PersistenceUnavailableException;

import java.time.Instant;
import java.util.List;

/**
 * Narrow persistence contract of the scheduler core. The store owns the authoritative copy of
 * every learner's card states, streak record and session history.
 * <p>
 * Implementations report storage failures as {@link PersistenceUnavailableException}.
 * Concurrent streak updates are detected with optimistic versioning and reported as
 * {@link org.springframework.dao.OptimisticLockingFailureException} so callers can retry.
 */
public interface LearnerStateStore {

    List<CardState> loadCardStates(String learnerId);

    /**
     * Inserts or replaces the state of one card. Last writer wins.
     */
    void saveCardState(String learnerId, CardState state);

    /**
     * @return the stored record, or {@link StreakRecord#empty()} when the learner has none yet
     */
    StreakRecord loadStreak(String learnerId);

    void saveStreak(String learnerId, StreakRecord record);

    void appendSession(ReviewSession session);

    /**
     * Start instants of the learner's completed sessions, oldest first.
     */
    List<Instant> loadActivityInstants(String learnerId);
}
