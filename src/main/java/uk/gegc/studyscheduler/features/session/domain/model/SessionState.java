package uk.gegc.studyscheduler.features.session.domain.model;

public enum SessionState {
    IDLE,
    ACTIVE,
    PAUSED,
    COMPLETED
}
