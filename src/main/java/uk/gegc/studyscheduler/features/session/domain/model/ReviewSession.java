package uk.gegc.studyscheduler.features.session.domain.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
public class ReviewSession {

    private String sessionId;

    private String learnerId;

    private SessionType sessionType;

    private Instant startTime;

    private Instant endTime;

    private int durationMinutes;

    private Integer plannedDurationMinutes;

    private boolean completed;

    private int cardsReviewed;

    /**
     * Pauses the learner took themselves; inactivity auto-pauses are not counted.
     */
    private int breaksTaken;

    /**
     * Set when the clock moved backwards across the session and the duration was forced to 0.
     */
    private boolean clockAnomaly;

    public ReviewSession copy() {
        ReviewSession copy = new ReviewSession();
        copy.setSessionId(sessionId);
        copy.setLearnerId(learnerId);
        copy.setSessionType(sessionType);
        copy.setStartTime(startTime);
        copy.setEndTime(endTime);
        copy.setDurationMinutes(durationMinutes);
        copy.setPlannedDurationMinutes(plannedDurationMinutes);
        copy.setCompleted(completed);
        copy.setCardsReviewed(cardsReviewed);
        copy.setBreaksTaken(breaksTaken);
        copy.setClockAnomaly(clockAnomaly);
        return copy;
    }
}
