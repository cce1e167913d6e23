package uk.gegc.studyscheduler.shared.persistence.jpa;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.session.domain.model.ReviewSession;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;
import uk.gegc.studyscheduler.shared.exception.PersistenceUnavailableException;
import uk.gegc.studyscheduler.shared.persistence.LearnerStateStore;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Learner state store on Spring Data JPA. Each call runs in the caller's transaction when there is
 * one, otherwise in the repositories' own.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaLearnerStateStore implements LearnerStateStore {

    private final CardStateEntityRepository cardStateRepository;
    private final StreakRecordEntityRepository streakRecordRepository;
    private final ReviewSessionEntityRepository reviewSessionRepository;

    @Override
    public List<CardState> loadCardStates(String learnerId) {
        return guarded("load card states", () -> cardStateRepository.findByLearnerId(learnerId).stream()
                .map(this::toCardState)
                .toList());
    }

    @Override
    public void saveCardState(String learnerId, CardState state) {
        guarded("save card state", () -> {
            CardStateEntity entity = cardStateRepository.findByLearnerIdAndCardId(learnerId, state.cardId())
                    .orElseGet(() -> {
                        CardStateEntity created = new CardStateEntity();
                        created.setLearnerId(learnerId);
                        created.setCardId(state.cardId());
                        return created;
                    });
            entity.setEaseFactor(state.easeFactor());
            entity.setIntervalDays(state.intervalDays());
            entity.setRepetitions(state.repetitions());
            entity.setDueAt(state.dueAt());
            entity.setLastReviewedAt(state.lastReviewedAt());
            return cardStateRepository.save(entity);
        });
    }

    @Override
    public StreakRecord loadStreak(String learnerId) {
        return guarded("load streak", () -> streakRecordRepository.findById(learnerId)
                .map(entity -> new StreakRecord(
                        entity.getLastActivityDate(),
                        entity.getCurrentStreak(),
                        entity.getLongestStreak()))
                .orElseGet(StreakRecord::empty));
    }

    @Override
    public void saveStreak(String learnerId, StreakRecord record) {
        guarded("save streak", () -> {
            StreakRecordEntity entity = streakRecordRepository.findById(learnerId)
                    .orElseGet(() -> {
                        StreakRecordEntity created = new StreakRecordEntity();
                        created.setLearnerId(learnerId);
                        return created;
                    });
            entity.setLastActivityDate(record.lastActivityDate());
            entity.setCurrentStreak(record.currentStreak());
            entity.setLongestStreak(record.longestStreak());
            return streakRecordRepository.save(entity);
        });
    }

    @Override
    public void appendSession(ReviewSession session) {
        guarded("append session", () -> {
            ReviewSessionEntity entity = new ReviewSessionEntity();
            entity.setSessionId(session.getSessionId());
            entity.setLearnerId(session.getLearnerId());
            entity.setSessionType(session.getSessionType());
            entity.setStartTime(session.getStartTime());
            entity.setEndTime(session.getEndTime());
            entity.setDurationMinutes(session.getDurationMinutes());
            entity.setPlannedDurationMinutes(session.getPlannedDurationMinutes());
            entity.setCompleted(session.isCompleted());
            entity.setCardsReviewed(session.getCardsReviewed());
            entity.setBreaksTaken(session.getBreaksTaken());
            entity.setClockAnomaly(session.isClockAnomaly());
            return reviewSessionRepository.save(entity);
        });
    }

    @Override
    public List<Instant> loadActivityInstants(String learnerId) {
        return guarded("load activity", () -> reviewSessionRepository.findCompletedStartTimes(learnerId));
    }

    private CardState toCardState(CardStateEntity entity) {
        return CardState.builder()
                .cardId(entity.getCardId())
                .easeFactor(entity.getEaseFactor())
                .intervalDays(entity.getIntervalDays())
                .repetitions(entity.getRepetitions())
                .dueAt(entity.getDueAt())
                .lastReviewedAt(entity.getLastReviewedAt())
                .build();
    }

    private <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (OptimisticLockingFailureException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.warn("Learner state store failed to {}: {}", operation, e.getMessage());
            throw new PersistenceUnavailableException("Failed to " + operation, e);
        }
    }
}
