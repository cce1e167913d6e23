package uk.gegc.studyscheduler.features.session.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.studyscheduler.features.session.config.SessionTimerProperties;
import uk.gegc.studyscheduler.features.session.domain.model.PauseReason;
import uk.gegc.studyscheduler.features.session.domain.model.ReviewSession;
import uk.gegc.studyscheduler.features.session.domain.model.SessionState;
import uk.gegc.studyscheduler.features.session.domain.model.SessionType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State machine of one study session: IDLE, ACTIVE, PAUSED (back and forth), COMPLETED.
 * <p>
 * Time is read only from the injected clock, and only when an operation runs, so a test can move
 * the clock and call {@link #tick()} to replay hours in milliseconds. Not thread-safe; callers
 * serialize access.
 */
@Slf4j
public class SessionTimer {

    private final Clock clock;
    private final SessionTimerProperties properties;
    private final ReviewSession session = new ReviewSession();

    private SessionState state = SessionState.IDLE;
    private PauseReason pauseReason;
    private Instant activeSince;
    private Instant pausedSince;
    private Instant lastInteractionAt;
    private Duration totalPaused = Duration.ZERO;
    private int stretch;
    private int remindersInStretch;
    private boolean breakReminderShown;

    public SessionTimer(Clock clock,
                        SessionTimerProperties properties,
                        String sessionId,
                        String learnerId,
                        SessionType sessionType,
                        Integer plannedDurationMinutes) {
        this.clock = clock;
        this.properties = properties;
        session.setSessionId(sessionId);
        session.setLearnerId(learnerId);
        session.setSessionType(sessionType);
        session.setPlannedDurationMinutes(plannedDurationMinutes);
    }

    public void start() {
        requireState(SessionState.IDLE, "start");
        Instant now = clock.instant();
        session.setStartTime(now);
        activeSince = now;
        lastInteractionAt = now;
        stretch = 1;
        state = SessionState.ACTIVE;
        log.debug("Session started sessionId={} type={}", session.getSessionId(), session.getSessionType());
    }

    public void pause(PauseReason reason) {
        requireState(SessionState.ACTIVE, "pause");
        pausedSince = clock.instant();
        pauseReason = reason;
        remindersInStretch = 0;
        breakReminderShown = false;
        if (reason == PauseReason.USER) {
            session.setBreaksTaken(session.getBreaksTaken() + 1);
        }
        state = SessionState.PAUSED;
    }

    public void resume() {
        requireState(SessionState.PAUSED, "resume");
        Instant now = clock.instant();
        totalPaused = totalPaused.plus(nonNegative(Duration.between(pausedSince, now)));
        pausedSince = null;
        pauseReason = null;
        activeSince = now;
        lastInteractionAt = now;
        stretch++;
        state = SessionState.ACTIVE;
    }

    /**
     * Marks learner activity. Activity after an inactivity auto-pause resumes the session.
     */
    public void recordInteraction() {
        if (state == SessionState.PAUSED && pauseReason == PauseReason.INACTIVITY) {
            resume();
            return;
        }
        if (state == SessionState.ACTIVE) {
            lastInteractionAt = clock.instant();
        }
    }

    public void recordCardReviewed() {
        if (state != SessionState.ACTIVE && state != SessionState.PAUSED) {
            throw new IllegalStateException("Cannot record a review in state " + state);
        }
        session.setCardsReviewed(session.getCardsReviewed() + 1);
        recordInteraction();
    }

    public void dismissBreakReminder() {
        breakReminderShown = false;
    }

    /**
     * Advances the monitor to the current clock instant. Auto-completion wins over auto-pause,
     * which wins over break reminders.
     */
    public SessionTickResult tick() {
        if (state != SessionState.ACTIVE && state != SessionState.PAUSED) {
            return SessionTickResult.nothing();
        }
        Instant now = clock.instant();

        if (!Duration.between(session.getStartTime(), now).minus(properties.getTimeoutCeiling()).isNegative()) {
            log.info("Session reached timeout ceiling sessionId={}", session.getSessionId());
            finish(true);
            return new SessionTickResult(List.of(), false, true);
        }
        if (state == SessionState.PAUSED) {
            return SessionTickResult.nothing();
        }

        if (!Duration.between(lastInteractionAt, now).minus(properties.getInactivityTimeout()).isNegative()) {
            log.debug("Session auto-paused for inactivity sessionId={}", session.getSessionId());
            pause(PauseReason.INACTIVITY);
            return new SessionTickResult(List.of(), true, false);
        }

        Duration continuous = nonNegative(Duration.between(activeSince, now));
        long crossings = continuous.dividedBy(properties.getBreakThreshold());
        List<BreakReminderRequest> reminders = new ArrayList<>();
        while (remindersInStretch < crossings) {
            remindersInStretch++;
            reminders.add(new BreakReminderRequest(
                    session.getSessionId(),
                    session.getLearnerId(),
                    remindersInStretch,
                    stretch,
                    properties.getBreakThreshold().multipliedBy(remindersInStretch),
                    now));
        }
        if (!reminders.isEmpty()) {
            breakReminderShown = true;
        }
        return new SessionTickResult(reminders, false, false);
    }

    public ReviewSession complete() {
        requireRunning("complete");
        finish(true);
        return session.copy();
    }

    public ReviewSession abandon() {
        requireRunning("abandon");
        finish(false);
        return session.copy();
    }

    public SessionState getState() {
        return state;
    }

    public PauseReason getPauseReason() {
        return pauseReason;
    }

    public boolean isBreakReminderShown() {
        return breakReminderShown;
    }

    public ReviewSession snapshot() {
        return session.copy();
    }

    private void finish(boolean completed) {
        Instant end = clock.instant();
        if (state == SessionState.PAUSED) {
            totalPaused = totalPaused.plus(nonNegative(Duration.between(pausedSince, end)));
        }
        session.setEndTime(end);
        session.setCompleted(completed);
        session.setDurationMinutes(computeDurationMinutes(session.getStartTime(), end));
        state = SessionState.COMPLETED;
        log.info("Session finished sessionId={} completed={} durationMinutes={} cardsReviewed={}",
                session.getSessionId(), completed, session.getDurationMinutes(), session.getCardsReviewed());
    }

    private int computeDurationMinutes(Instant start, Instant end) {
        if (end.isBefore(start)) {
            session.setClockAnomaly(true);
            log.warn("Clock moved backwards during session sessionId={} start={} end={}",
                    session.getSessionId(), start, end);
            return 0;
        }
        Duration active = Duration.between(start, end).minus(totalPaused);
        if (active.isNegative()) {
            session.setClockAnomaly(true);
            log.warn("Paused time exceeds session span sessionId={}", session.getSessionId());
            return 0;
        }
        long minutes = (active.toSeconds() + 30) / 60;
        if (minutes > properties.getMaxDurationMinutes()) {
            log.info("Session duration clamped sessionId={} computedMinutes={} maxMinutes={}",
                    session.getSessionId(), minutes, properties.getMaxDurationMinutes());
            return properties.getMaxDurationMinutes();
        }
        return (int) minutes;
    }

    private void requireState(SessionState expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + operation + " a session in state " + state);
        }
    }

    private void requireRunning(String operation) {
        if (state != SessionState.ACTIVE && state != SessionState.PAUSED) {
            throw new IllegalStateException("Cannot " + operation + " a session in state " + state);
        }
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }
}
