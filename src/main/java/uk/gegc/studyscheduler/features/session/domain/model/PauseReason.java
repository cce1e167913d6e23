package uk.gegc.studyscheduler.features.session.domain.model;

public enum PauseReason {
    USER,
    INACTIVITY
}
