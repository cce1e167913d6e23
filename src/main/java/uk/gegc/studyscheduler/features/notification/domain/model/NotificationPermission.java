package uk.gegc.studyscheduler.features.notification.domain.model;

public enum NotificationPermission {
    GRANTED,
    DENIED,
    DEFAULT
}
