package uk.gegc.studyscheduler.features.notification.application;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPrefs;
import uk.gegc.studyscheduler.features.notification.domain.model.PendingNotification;

import java.time.Instant;
import java.util.List;

/**
 * Delivers the entries of a schedule whose time has come. Undeliverable entries are dropped and
 * logged; nothing here throws back into the poll that called it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatchService {

    private final NotificationDispatcher notificationDispatcher;
    private final MeterRegistry meterRegistry;

    /**
     * @return number of notifications handed to the dispatcher
     */
    public int dispatchDue(NotificationScheduler scheduler,
                           List<PendingNotification> pending,
                           Instant now,
                           NotificationPrefs prefs) {
        int delivered = 0;
        for (PendingNotification notification : pending) {
            if (notification.fireAt().isAfter(now)) {
                continue;
            }

            if (prefs.isQuietAt(now)) {
                if (notification.kind().isTimeSensitive() && scheduler.claim(notification, now)) {
                    countDropped(notification, "quiet-hours");
                }
                // non time-sensitive kinds wait for the end of quiet hours
                continue;
            }

            // a concurrent poll of the same learner may have taken the entry already
            if (!scheduler.claim(notification, now)) {
                continue;
            }

            if (!notificationDispatcher.isSupported() || !notificationDispatcher.isEnabled()) {
                countDropped(notification, "unavailable");
                continue;
            }

            try {
                notificationDispatcher.show(notification.kind(), notification.payload());
                meterRegistry.counter("study.notifications.dispatched", "kind", notification.kind().name()).increment();
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Failed to show notification kind={} key={}: {}",
                        notification.kind(), notification.dedupKey(), e.getMessage());
                countDropped(notification, "error");
            }
        }
        return delivered;
    }

    private void countDropped(PendingNotification notification, String reason) {
        log.debug("Dropped notification kind={} key={} reason={}", notification.kind(), notification.dedupKey(), reason);
        meterRegistry.counter("study.notifications.dropped", "kind", notification.kind().name(), "reason", reason)
                .increment();
    }
}
