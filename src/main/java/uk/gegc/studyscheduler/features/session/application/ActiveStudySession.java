package uk.gegc.studyscheduler.features.session.application;

import uk.gegc.studyscheduler.features.session.domain.model.PauseReason;
import uk.gegc.studyscheduler.features.session.domain.model.ReviewSession;
import uk.gegc.studyscheduler.features.session.domain.model.SessionState;
import uk.gegc.studyscheduler.shared.scheduling.TickHandle;

import java.time.ZoneId;
import java.util.function.Consumer;

/**
 * A running session together with its recurring tick. User calls and tick calls are serialized
 * on this object. Closing a session that is still running abandons it.
 */
public class ActiveStudySession implements AutoCloseable {

    private final String learnerId;
    private final ZoneId zone;
    private final SessionTimer timer;
    private final Consumer<ActiveStudySession> onClose;
    private TickHandle tickHandle;
    private boolean sessionAppended;
    private boolean streakRecorded;

    public ActiveStudySession(String learnerId, ZoneId zone, SessionTimer timer, Consumer<ActiveStudySession> onClose) {
        this.learnerId = learnerId;
        this.zone = zone;
        this.timer = timer;
        this.onClose = onClose;
    }

    public String getLearnerId() {
        return learnerId;
    }

    public ZoneId getZone() {
        return zone;
    }

    public synchronized SessionState getState() {
        return timer.getState();
    }

    public synchronized ReviewSession snapshot() {
        return timer.snapshot();
    }

    public synchronized boolean isBreakReminderShown() {
        return timer.isBreakReminderShown();
    }

    public synchronized void pause() {
        timer.pause(PauseReason.USER);
    }

    public synchronized void resume() {
        timer.resume();
    }

    public synchronized void recordInteraction() {
        timer.recordInteraction();
    }

    public synchronized void recordCardReviewed() {
        timer.recordCardReviewed();
    }

    public synchronized void dismissBreakReminder() {
        timer.dismissBreakReminder();
    }

    public synchronized boolean isRunning() {
        SessionState state = timer.getState();
        return state == SessionState.ACTIVE || state == SessionState.PAUSED;
    }

    /**
     * True once the session row is stored and, for a completed session, its streak activity is
     * recorded.
     */
    public synchronized boolean isPersisted() {
        return sessionAppended && (streakRecorded || !timer.snapshot().isCompleted());
    }

    public synchronized boolean isSessionAppended() {
        return sessionAppended;
    }

    public synchronized boolean isStreakRecorded() {
        return streakRecorded;
    }

    public synchronized SessionTickResult tick() {
        return timer.tick();
    }

    public synchronized ReviewSession finishTimer(boolean completed) {
        return completed ? timer.complete() : timer.abandon();
    }

    public synchronized void attachTickHandle(TickHandle handle) {
        this.tickHandle = handle;
    }

    public synchronized void markSessionAppended() {
        this.sessionAppended = true;
    }

    public synchronized void markStreakRecorded() {
        this.streakRecorded = true;
    }

    public synchronized TickHandle getTickHandle() {
        return tickHandle;
    }

    public void releaseTick() {
        TickHandle handle = getTickHandle();
        if (handle != null) {
            handle.close();
        }
    }

    @Override
    public void close() {
        onClose.accept(this);
    }
}
