package uk.gegc.studyscheduler.features.notification.domain.model;

import java.time.Instant;

/**
 * One entry of a learner's notification schedule. {@code kind} plus {@code dedupKey} identify the
 * entry: once fired it is never produced again.
 */
public record PendingNotification(Instant fireAt, NotificationKind kind, String dedupKey, NotificationPayload payload) {

    public String identity() {
        return kind.name() + ":" + dedupKey;
    }
}
