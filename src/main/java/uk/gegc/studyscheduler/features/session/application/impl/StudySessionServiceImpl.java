package uk.gegc.studyscheduler.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import uk.gegc.studyscheduler.features.session.application.ActiveStudySession;
import uk.gegc.studyscheduler.features.session.application.BreakReminderRequest;
import uk.gegc.studyscheduler.features.session.application.SessionTickResult;
import uk.gegc.studyscheduler.features.session.application.SessionTimer;
import uk.gegc.studyscheduler.features.session.application.StudySessionService;
import uk.gegc.studyscheduler.features.session.application.event.BreakReminderRequestedEvent;
import uk.gegc.studyscheduler.features.session.application.event.StudySessionCompletedEvent;
import uk.gegc.studyscheduler.features.session.config.SessionTimerProperties;
import uk.gegc.studyscheduler.features.session.domain.model.ReviewSession;
import uk.gegc.studyscheduler.features.session.domain.model.SessionType;
import uk.gegc.studyscheduler.features.streak.application.StreakService;
import uk.gegc.studyscheduler.shared.exception.PersistenceUnavailableException;
import uk.gegc.studyscheduler.shared.persistence.LearnerStateStore;
import uk.gegc.studyscheduler.shared.scheduling.RecurringTickScheduler;
import uk.gegc.studyscheduler.shared.scheduling.TickHandle;

import java.time.Clock;
import java.time.ZoneId;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class StudySessionServiceImpl implements StudySessionService {

    private final Clock clock;
    private final SessionTimerProperties properties;
    private final RecurringTickScheduler tickScheduler;
    private final LearnerStateStore learnerStateStore;
    private final StreakService streakService;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public ActiveStudySession start(String learnerId, SessionType type, Integer plannedDurationMinutes, ZoneId zone) {
        String sessionId = UUID.randomUUID().toString();
        SessionTimer timer = new SessionTimer(clock, properties, sessionId, learnerId, type, plannedDurationMinutes);
        ActiveStudySession active = new ActiveStudySession(learnerId, zone, timer, this::closeSession);
        timer.start();

        TickHandle handle = tickScheduler.scheduleEvery(
                "session-" + sessionId, properties.getPollInterval(), () -> onTick(active));
        active.attachTickHandle(handle);
        log.info("Study session started learnerId={} sessionId={} type={}", learnerId, sessionId, type);
        return active;
    }

    @Override
    public ReviewSession complete(ActiveStudySession active) {
        return finish(active, true);
    }

    @Override
    public ReviewSession abandon(ActiveStudySession active) {
        return finish(active, false);
    }

    @Override
    public void retryPersist(ActiveStudySession active) {
        if (active.isRunning()) {
            throw new IllegalStateException("Session is still running");
        }
        if (!active.isPersisted()) {
            persist(active, active.snapshot());
        }
    }

    void onTick(ActiveStudySession active) {
        SessionTickResult result;
        try {
            result = active.tick();
        } catch (RuntimeException e) {
            active.releaseTick();
            throw e;
        }

        for (BreakReminderRequest request : result.breakReminders()) {
            log.info("Break reminder learnerId={} sessionId={} continuousActive={}",
                    request.learnerId(), request.sessionId(), request.continuousActive());
            eventPublisher.publishEvent(new BreakReminderRequestedEvent(request));
        }
        if (result.autoCompleted()) {
            active.releaseTick();
            persist(active, active.snapshot());
        }
    }

    private ReviewSession finish(ActiveStudySession active, boolean completed) {
        ReviewSession session;
        try {
            session = active.finishTimer(completed);
        } finally {
            active.releaseTick();
        }
        persist(active, session);
        return session;
    }

    private void closeSession(ActiveStudySession active) {
        try {
            if (active.isRunning()) {
                finish(active, false);
            }
        } finally {
            active.releaseTick();
        }
    }

    private void persist(ActiveStudySession active, ReviewSession session) {
        if (!active.isSessionAppended()) {
            try {
                learnerStateStore.appendSession(session);
            } catch (PersistenceUnavailableException e) {
                log.warn("Session kept in memory for retry sessionId={}: {}", session.getSessionId(), e.getMessage());
                throw e;
            }
            active.markSessionAppended();
        }

        if (session.isCompleted() && !active.isStreakRecorded()) {
            try {
                streakService.recordActivity(session.getLearnerId(), session.getStartTime(), active.getZone());
            } catch (PersistenceUnavailableException | OptimisticLockingFailureException e) {
                log.warn("Streak activity kept for retry sessionId={}: {}", session.getSessionId(), e.getMessage());
                throw e;
            }
            active.markStreakRecorded();
            eventPublisher.publishEvent(new StudySessionCompletedEvent(session));
        }
    }
}
