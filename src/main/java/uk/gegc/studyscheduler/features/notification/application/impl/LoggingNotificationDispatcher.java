package uk.gegc.studyscheduler.features.notification.application.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.studyscheduler.features.notification.application.NotificationDispatcher;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationKind;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPayload;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPermission;

/**
 * Fallback dispatcher used when the host registers no channel of its own.
 */
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public boolean isSupported() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public NotificationPermission requestPermission() {
        return NotificationPermission.GRANTED;
    }

    @Override
    public void show(NotificationKind kind, NotificationPayload payload) {
        log.info("Notification kind={} tag={} title='{}' body='{}'", kind, payload.tag(), payload.title(), payload.body());
    }
}
