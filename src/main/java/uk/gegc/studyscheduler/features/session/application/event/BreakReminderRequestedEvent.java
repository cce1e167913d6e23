package uk.gegc.studyscheduler.features.session.application.event;

import uk.gegc.studyscheduler.features.session.application.BreakReminderRequest;

public record BreakReminderRequestedEvent(BreakReminderRequest request) {
}
