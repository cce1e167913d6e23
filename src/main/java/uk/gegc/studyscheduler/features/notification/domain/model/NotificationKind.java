package uk.gegc.studyscheduler.features.notification.domain.model;

import lombok.Getter;

@Getter
public enum NotificationKind {
    DUE_CARDS_READY("due-cards", false),
    STREAK_AT_RISK("streak-reminder", false),
    BREAK_REMINDER("break-reminder", true),
    SESSION_COMPLETE("session-complete", true);

    /**
     * Tag shared by notifications of this kind, so a newer one replaces an older one on the device.
     */
    private final String tag;

    /**
     * Time-sensitive notifications are dropped rather than deferred during quiet hours.
     */
    private final boolean timeSensitive;

    NotificationKind(String tag, boolean timeSensitive) {
        this.tag = tag;
        this.timeSensitive = timeSensitive;
    }
}
