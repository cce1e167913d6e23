package uk.gegc.studyscheduler.features.streak.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.studyscheduler.features.streak.application.StreakHistoryCalculator;
import uk.gegc.studyscheduler.features.streak.application.StreakService;
import uk.gegc.studyscheduler.features.streak.application.StreakTracker;
import uk.gegc.studyscheduler.features.streak.config.StreakProperties;
import uk.gegc.studyscheduler.features.streak.domain.exception.OutOfOrderActivityException;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;
import uk.gegc.studyscheduler.shared.exception.PersistenceUnavailableException;
import uk.gegc.studyscheduler.shared.persistence.LearnerStateStore;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.function.Supplier;

@Slf4j
@Service
public class StreakServiceImpl implements StreakService {

    private final Clock clock;
    private final LearnerStateStore learnerStateStore;
    private final StreakTracker streakTracker;
    private final StreakHistoryCalculator streakHistoryCalculator;
    private final StreakProperties streakProperties;
    private final StreakService self;

    public StreakServiceImpl(Clock clock,
                             LearnerStateStore learnerStateStore,
                             StreakTracker streakTracker,
                             StreakHistoryCalculator streakHistoryCalculator,
                             StreakProperties streakProperties,
                             @Lazy StreakService self) {
        this.clock = clock;
        this.learnerStateStore = learnerStateStore;
        this.streakTracker = streakTracker;
        this.streakHistoryCalculator = streakHistoryCalculator;
        this.streakProperties = streakProperties;
        this.self = self;
    }

    @Override
    public StreakRecord recordActivity(String learnerId, Instant activityAt, ZoneId zone) {
        return withRetry(() -> self.recordActivityTx(learnerId, activityAt, zone));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public StreakRecord recordActivityTx(String learnerId, Instant activityAt, ZoneId zone) {
        StreakRecord current = learnerStateStore.loadStreak(learnerId);
        LocalDate activityDate = activityAt.atZone(zone).toLocalDate();

        StreakRecord updated;
        try {
            updated = streakTracker.recordActivity(current, activityDate);
        } catch (OutOfOrderActivityException e) {
            log.warn("Ignoring out-of-order activity learnerId={} activityDate={} lastActivityDate={}",
                    learnerId, e.getActivityDate(), e.getLastActivityDate());
            return current;
        }

        if (updated.equals(current)) {
            return current;
        }
        learnerStateStore.saveStreak(learnerId, updated);
        log.info("Streak updated learnerId={} date={} current={} longest={}",
                learnerId, activityDate, updated.currentStreak(), updated.longestStreak());
        return updated;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isStreakAtRisk(String learnerId, ZoneId zone) {
        StreakRecord record = learnerStateStore.loadStreak(learnerId);
        ZonedDateTime localNow = ZonedDateTime.now(clock.withZone(zone));
        return streakTracker.isStreakAtRisk(record, localNow, streakProperties.getAtRiskAfter());
    }

    @Override
    public StreakRecord rebuildFromHistory(String learnerId, ZoneId zone) {
        return withRetry(() -> self.rebuildFromHistoryTx(learnerId, zone));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public StreakRecord rebuildFromHistoryTx(String learnerId, ZoneId zone) {
        List<Instant> activity = learnerStateStore.loadActivityInstants(learnerId);
        LocalDate today = LocalDate.now(clock.withZone(zone));
        StreakRecord rebuilt = streakHistoryCalculator.fromActivity(activity, zone, today);
        learnerStateStore.saveStreak(learnerId, rebuilt);
        log.info("Streak rebuilt learnerId={} sessions={} current={} longest={}",
                learnerId, activity.size(), rebuilt.currentStreak(), rebuilt.longestStreak());
        return rebuilt;
    }

    private <T> T withRetry(Supplier<T> action) {
        int maxRetries = Math.max(1, streakProperties.getMaxWriteAttempts());
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return action.get();
            } catch (OptimisticLockingFailureException e) {
                if (attempt == maxRetries - 1) throw e;
                log.debug("Streak write conflict, retrying attempt={}", attempt + 1);
                sleepBackoff(attempt + 1);
            } catch (DataIntegrityViolationException e) {
                // concurrent first insert of the same learner's record; the next attempt updates it
                if (attempt == maxRetries - 1) {
                    throw new PersistenceUnavailableException("Streak record insert kept conflicting", e);
                }
                log.debug("Streak insert conflict, retrying attempt={}", attempt + 1);
                sleepBackoff(attempt + 1);
            } catch (TransactionException e) {
                throw new PersistenceUnavailableException("Streak transaction failed", e);
            }
        }
        throw new IllegalStateException("Retry loop exhausted unexpectedly");
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(50L * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
