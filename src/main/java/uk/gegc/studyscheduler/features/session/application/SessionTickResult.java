package uk.gegc.studyscheduler.features.session.application;

import java.util.List;

public record SessionTickResult(List<BreakReminderRequest> breakReminders, boolean autoPaused, boolean autoCompleted) {

    private static final SessionTickResult NOTHING = new SessionTickResult(List.of(), false, false);

    public SessionTickResult {
        breakReminders = List.copyOf(breakReminders);
    }

    public static SessionTickResult nothing() {
        return NOTHING;
    }
}
