package uk.gegc.studyscheduler.features.session.application;

import uk.gegc.studyscheduler.features.session.domain.model.ReviewSession;
import uk.gegc.studyscheduler.features.session.domain.model.SessionType;

import java.time.ZoneId;

public interface StudySessionService {

    /**
     * Starts a session and its recurring tick. The returned session must be completed, abandoned
     * or closed; each of these releases the tick.
     */
    ActiveStudySession start(String learnerId, SessionType type, Integer plannedDurationMinutes, ZoneId zone);

    ReviewSession complete(ActiveStudySession session);

    ReviewSession abandon(ActiveStudySession session);

    /**
     * Writes a finished session the store rejected earlier.
     */
    void retryPersist(ActiveStudySession session);
}
