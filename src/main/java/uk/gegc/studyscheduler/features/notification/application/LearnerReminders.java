package uk.gegc.studyscheduler.features.notification.application;

import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPrefs;
import uk.gegc.studyscheduler.shared.scheduling.TickHandle;

import java.util.function.Consumer;

/**
 * Reminder registration of one learner. Closing it stops the poll and detaches the learner.
 */
public class LearnerReminders implements AutoCloseable {

    private final String learnerId;
    private final NotificationScheduler scheduler;
    private final Consumer<LearnerReminders> onClose;
    private volatile NotificationPrefs prefs;
    private volatile TickHandle tickHandle;
    private volatile boolean closed;

    public LearnerReminders(String learnerId,
                            NotificationPrefs prefs,
                            NotificationScheduler scheduler,
                            Consumer<LearnerReminders> onClose) {
        this.learnerId = learnerId;
        this.prefs = prefs;
        this.scheduler = scheduler;
        this.onClose = onClose;
    }

    public String getLearnerId() {
        return learnerId;
    }

    public NotificationScheduler getScheduler() {
        return scheduler;
    }

    public NotificationPrefs getPrefs() {
        return prefs;
    }

    public void updatePrefs(NotificationPrefs prefs) {
        this.prefs = prefs;
    }

    public boolean isActive() {
        TickHandle handle = tickHandle;
        return handle != null && handle.isActive();
    }

    void attachTickHandle(TickHandle tickHandle) {
        this.tickHandle = tickHandle;
        if (closed) {
            tickHandle.close();
        }
    }

    @Override
    public void close() {
        closed = true;
        TickHandle handle = tickHandle;
        if (handle != null) {
            handle.close();
        }
        onClose.accept(this);
    }
}
