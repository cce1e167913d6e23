package uk.gegc.studyscheduler.features.session.domain.model;

public enum SessionType {
    POMODORO,
    CUSTOM,
    REVIEW,
    CHAT,
    PODCAST,
    MINDMAP,
    VIDEO,
    WRITING,
    EXAM
}
