package uk.gegc.studyscheduler.features.notification.application;

import uk.gegc.studyscheduler.features.notification.config.NotificationProperties;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationKind;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPayload;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPrefs;
import uk.gegc.studyscheduler.features.notification.domain.model.PendingNotification;
import uk.gegc.studyscheduler.features.repetition.application.ReviewQueueSnapshot;
import uk.gegc.studyscheduler.features.session.application.BreakReminderRequest;
import uk.gegc.studyscheduler.features.session.domain.model.ReviewSession;
import uk.gegc.studyscheduler.features.streak.application.StreakTracker;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Notification schedule of one learner. Holds only what must survive between polls: which entries
 * already fired, when the last due-cards notification went out, and break/session events waiting
 * to be announced.
 * <p>
 * {@link #computePending} is idempotent: calling it again with the same inputs returns the same
 * entries, and an entry passed to {@link #claim} or {@link #markFired} is never returned again.
 * Fired identities that can no longer match (due sets that changed, streak reminders of past
 * days, session events older than a day) are forgotten on the next computation.
 */
public class NotificationScheduler {

    private static final Comparator<PendingNotification> FIRE_ORDER = Comparator
            .comparing(PendingNotification::fireAt)
            .thenComparing(PendingNotification::kind);

    private final NotificationProperties properties;
    private final StreakTracker streakTracker;
    private final LocalTime atRiskAfter;

    private static final Duration SESSION_EVENT_RETENTION = Duration.ofDays(1);

    private final Map<String, FiredEntry> firedIdentities = new HashMap<>();
    private final Map<String, BreakReminderRequest> pendingBreaks = new LinkedHashMap<>();
    private final Map<String, ReviewSession> pendingCompletions = new LinkedHashMap<>();
    private Instant lastDueCardsFiredAt;

    public NotificationScheduler(NotificationProperties properties, StreakTracker streakTracker, LocalTime atRiskAfter) {
        this.properties = properties;
        this.streakTracker = streakTracker;
        this.atRiskAfter = atRiskAfter;
    }

    public synchronized void enqueueBreakReminder(BreakReminderRequest request) {
        pendingBreaks.putIfAbsent(breakKey(request), request);
    }

    public synchronized void enqueueSessionComplete(ReviewSession session) {
        pendingCompletions.putIfAbsent("session:" + session.getSessionId(), session);
    }

    public synchronized List<PendingNotification> computePending(StreakRecord streak,
                                                                 ReviewQueueSnapshot queue,
                                                                 Instant now,
                                                                 NotificationPrefs prefs) {
        pruneFired(queue, now, prefs);
        if (!prefs.enabled()) {
            return List.of();
        }
        List<PendingNotification> pending = new ArrayList<>();

        if (prefs.allows(NotificationKind.DUE_CARDS_READY)) {
            addDueCards(pending, queue, now);
        }
        if (prefs.allows(NotificationKind.STREAK_AT_RISK)) {
            addStreakAtRisk(pending, streak, now, prefs);
        }
        if (prefs.allows(NotificationKind.BREAK_REMINDER)) {
            pendingBreaks.forEach((key, request) -> pending.add(breakReminder(key, request)));
        } else {
            pendingBreaks.clear();
        }
        if (prefs.allows(NotificationKind.SESSION_COMPLETE)) {
            pendingCompletions.forEach((key, session) -> pending.add(sessionComplete(key, session)));
        } else {
            pendingCompletions.clear();
        }

        return pending.stream()
                .filter(entry -> !firedIdentities.containsKey(entry.identity()))
                .sorted(FIRE_ORDER)
                .toList();
    }

    /**
     * Marks the entry fired unless another caller already did.
     *
     * @return true when this caller owns the entry and may deliver it
     */
    public synchronized boolean claim(PendingNotification notification, Instant firedAt) {
        if (firedIdentities.containsKey(notification.identity())) {
            return false;
        }
        firedIdentities.put(notification.identity(),
                new FiredEntry(notification.kind(), notification.dedupKey(), firedAt));
        switch (notification.kind()) {
            case DUE_CARDS_READY -> lastDueCardsFiredAt = firedAt;
            case BREAK_REMINDER -> pendingBreaks.remove(notification.dedupKey());
            case SESSION_COMPLETE -> pendingCompletions.remove(notification.dedupKey());
            default -> {
            }
        }
        return true;
    }

    public synchronized void markFired(PendingNotification notification, Instant firedAt) {
        claim(notification, firedAt);
    }

    public synchronized boolean hasFired(NotificationKind kind, String dedupKey) {
        return firedIdentities.containsKey(kind.name() + ":" + dedupKey);
    }

    synchronized int firedCount() {
        return firedIdentities.size();
    }

    private void pruneFired(ReviewQueueSnapshot queue, Instant now, NotificationPrefs prefs) {
        Set<String> liveDueKeys = new HashSet<>();
        if (queue.hasDueCards()) {
            liveDueKeys.add("due:" + dueSetKey(queue.dueCardIds()));
        }
        if (queue.nextDueAt() != null) {
            liveDueKeys.add("due-at:" + queue.nextDueAt().toEpochMilli());
        }
        String todayStreakKey = "streak:" + now.atZone(prefs.zone()).toLocalDate();
        Instant sessionCutoff = now.minus(SESSION_EVENT_RETENTION);

        firedIdentities.values().removeIf(fired -> switch (fired.kind()) {
            case DUE_CARDS_READY -> !liveDueKeys.contains(fired.dedupKey());
            case STREAK_AT_RISK -> !todayStreakKey.equals(fired.dedupKey());
            case BREAK_REMINDER, SESSION_COMPLETE -> fired.firedAt().isBefore(sessionCutoff);
        });
    }

    private void addDueCards(List<PendingNotification> pending, ReviewQueueSnapshot queue, Instant now) {
        Instant cooldownEnd = lastDueCardsFiredAt == null
                ? now
                : lastDueCardsFiredAt.plus(properties.getDueCardsCooldown());

        if (queue.hasDueCards()) {
            int count = queue.dueCount();
            pending.add(new PendingNotification(
                    latest(now, cooldownEnd),
                    NotificationKind.DUE_CARDS_READY,
                    "due:" + dueSetKey(queue.dueCardIds()),
                    new NotificationPayload(
                            "Cards due for review",
                            count == 1
                                    ? "You have 1 flashcard ready to review."
                                    : "You have " + count + " flashcards ready to review.",
                            NotificationKind.DUE_CARDS_READY.getTag(),
                            properties.getReviewUrl(),
                            Map.of("dueCount", String.valueOf(count)))));
        } else if (queue.nextDueAt() != null) {
            pending.add(new PendingNotification(
                    latest(queue.nextDueAt(), cooldownEnd),
                    NotificationKind.DUE_CARDS_READY,
                    "due-at:" + queue.nextDueAt().toEpochMilli(),
                    new NotificationPayload(
                            "Cards due for review",
                            "Flashcards are ready to review.",
                            NotificationKind.DUE_CARDS_READY.getTag(),
                            properties.getReviewUrl(),
                            Map.of())));
        }
    }

    private void addStreakAtRisk(List<PendingNotification> pending, StreakRecord streak, Instant now, NotificationPrefs prefs) {
        ZonedDateTime localNow = now.atZone(prefs.zone());
        LocalDate today = localNow.toLocalDate();
        ZonedDateTime thresholdToday = today.atTime(atRiskAfter).atZone(prefs.zone());
        ZonedDateTime fireAt = localNow.isBefore(thresholdToday) ? thresholdToday : localNow;

        if (!streakTracker.isStreakAtRisk(streak, fireAt, atRiskAfter)) {
            return;
        }
        int days = streak.currentStreak();
        pending.add(new PendingNotification(
                fireAt.toInstant(),
                NotificationKind.STREAK_AT_RISK,
                "streak:" + today,
                new NotificationPayload(
                        "Don't break your streak",
                        "You're on a " + days + "-day streak. Study today to keep it going.",
                        NotificationKind.STREAK_AT_RISK.getTag(),
                        properties.getReviewUrl(),
                        Map.of("currentStreak", String.valueOf(days)))));
    }

    private PendingNotification breakReminder(String key, BreakReminderRequest request) {
        long minutes = request.continuousActive().toMinutes();
        return new PendingNotification(
                request.requestedAt(),
                NotificationKind.BREAK_REMINDER,
                key,
                new NotificationPayload(
                        "Time for a break",
                        "You've been studying for " + minutes + " minutes. A short break helps you remember more.",
                        NotificationKind.BREAK_REMINDER.getTag(),
                        null,
                        Map.of("sessionId", request.sessionId())));
    }

    private PendingNotification sessionComplete(String key, ReviewSession session) {
        Instant fireAt = session.getEndTime() != null ? session.getEndTime() : session.getStartTime();
        return new PendingNotification(
                fireAt,
                NotificationKind.SESSION_COMPLETE,
                key,
                new NotificationPayload(
                        "Session complete",
                        "You studied for " + session.getDurationMinutes() + " minutes and reviewed "
                                + session.getCardsReviewed() + " cards.",
                        NotificationKind.SESSION_COMPLETE.getTag(),
                        null,
                        Map.of("sessionId", session.getSessionId())));
    }

    private static String breakKey(BreakReminderRequest request) {
        return "break:" + request.sessionId() + ":" + request.stretch() + ":" + request.crossingIndex();
    }

    private static String dueSetKey(List<String> dueCardIds) {
        String joined = String.join("\n", dueCardIds.stream().sorted().toList());
        return UUID.nameUUIDFromBytes(joined.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static Instant latest(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private record FiredEntry(NotificationKind kind, String dedupKey, Instant firedAt) {
    }
}
