package uk.gegc.studyscheduler.features.session.application.event;

import uk.gegc.studyscheduler.features.session.domain.model.ReviewSession;

/**
 * Published once a session finishes as completed (not abandoned) and has been handed to the store.
 */
public record StudySessionCompletedEvent(ReviewSession session) {
}
