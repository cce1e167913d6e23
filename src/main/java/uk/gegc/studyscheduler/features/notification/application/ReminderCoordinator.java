package uk.gegc.studyscheduler.features.notification.application;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import uk.gegc.studyscheduler.features.notification.config.NotificationProperties;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPrefs;
import uk.gegc.studyscheduler.features.notification.domain.model.PendingNotification;
import uk.gegc.studyscheduler.features.repetition.application.ReviewQueueBuilder;
import uk.gegc.studyscheduler.features.repetition.application.ReviewQueueSnapshot;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.session.application.event.BreakReminderRequestedEvent;
import uk.gegc.studyscheduler.features.session.application.event.StudySessionCompletedEvent;
import uk.gegc.studyscheduler.features.streak.application.StreakTracker;
import uk.gegc.studyscheduler.features.streak.config.StreakProperties;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;
import uk.gegc.studyscheduler.shared.exception.PersistenceUnavailableException;
import uk.gegc.studyscheduler.shared.persistence.LearnerStateStore;
import uk.gegc.studyscheduler.shared.scheduling.RecurringTickScheduler;
import uk.gegc.studyscheduler.shared.scheduling.TickHandle;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the reminder poll of every attached learner and routes session events to the right
 * learner schedule.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderCoordinator {

    private final Clock clock;
    private final LearnerStateStore learnerStateStore;
    private final ReviewQueueBuilder reviewQueueBuilder;
    private final StreakTracker streakTracker;
    private final StreakProperties streakProperties;
    private final NotificationProperties notificationProperties;
    private final NotificationDispatchService dispatchService;
    private final RecurringTickScheduler tickScheduler;

    private final Map<String, LearnerReminders> attached = new ConcurrentHashMap<>();

    public LearnerReminders attach(String learnerId, NotificationPrefs prefs) {
        NotificationScheduler scheduler = new NotificationScheduler(
                notificationProperties, streakTracker, streakProperties.getAtRiskAfter());
        LearnerReminders reminders = new LearnerReminders(learnerId, prefs, scheduler,
                closed -> attached.remove(closed.getLearnerId(), closed));

        TickHandle handle = tickScheduler.scheduleEvery(
                "reminders-" + learnerId, notificationProperties.getPollInterval(), () -> poll(reminders));
        reminders.attachTickHandle(handle);

        // visible only once its tick is attached
        LearnerReminders previous = attached.put(learnerId, reminders);
        if (previous != null) {
            previous.close();
        }
        log.info("Reminders attached learnerId={}", learnerId);
        return reminders;
    }

    /**
     * One reminder pass: reload learner state, recompute the schedule, fire what is due.
     *
     * @return number of notifications delivered
     */
    public int poll(LearnerReminders reminders) {
        String learnerId = reminders.getLearnerId();
        Instant now = Instant.now(clock);

        StreakRecord streak;
        List<CardState> states;
        try {
            streak = learnerStateStore.loadStreak(learnerId);
            states = learnerStateStore.loadCardStates(learnerId);
        } catch (PersistenceUnavailableException e) {
            log.warn("Skipping reminder poll learnerId={}: {}", learnerId, e.getMessage());
            return 0;
        }

        ReviewQueueSnapshot snapshot = reviewQueueBuilder.snapshot(states, now);
        NotificationPrefs prefs = reminders.getPrefs();
        List<PendingNotification> pending = reminders.getScheduler().computePending(streak, snapshot, now, prefs);
        return dispatchService.dispatchDue(reminders.getScheduler(), pending, now, prefs);
    }

    public boolean isAttached(String learnerId) {
        return attached.containsKey(learnerId);
    }

    @EventListener
    public void onBreakReminder(BreakReminderRequestedEvent event) {
        LearnerReminders reminders = attached.get(event.request().learnerId());
        if (reminders == null) {
            log.debug("No reminders attached for learnerId={}, break reminder not scheduled", event.request().learnerId());
            return;
        }
        reminders.getScheduler().enqueueBreakReminder(event.request());
        poll(reminders);
    }

    @EventListener
    public void onSessionCompleted(StudySessionCompletedEvent event) {
        LearnerReminders reminders = attached.get(event.session().getLearnerId());
        if (reminders == null) {
            return;
        }
        reminders.getScheduler().enqueueSessionComplete(event.session());
        poll(reminders);
    }

    @PreDestroy
    public void detachAll() {
        new ArrayList<>(attached.values()).forEach(LearnerReminders::close);
    }
}
