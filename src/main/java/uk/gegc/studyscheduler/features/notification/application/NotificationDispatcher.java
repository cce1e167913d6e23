package uk.gegc.studyscheduler.features.notification.application;

import uk.gegc.studyscheduler.features.notification.domain.model.NotificationKind;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPayload;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPermission;

/**
 * Host-side delivery channel (browser, OS, push). Permission prompts are owned by the host UI;
 * the scheduler only checks {@link #isSupported()} and {@link #isEnabled()} before {@link #show}.
 */
public interface NotificationDispatcher {

    boolean isSupported();

    boolean isEnabled();

    NotificationPermission requestPermission();

    void show(NotificationKind kind, NotificationPayload payload);
}
