package uk.gegc.studyscheduler.shared.persistence.jpa;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.studyscheduler.features.session.domain.model.SessionType;

import java.time.Instant;

@Entity
@Getter
@Setter
@Table(name = "review_session")
public class ReviewSessionEntity {

    @Id
    @Column(name = "session_id", updatable = false, nullable = false, length = 64)
    private String sessionId;

    @Column(name = "learner_id", nullable = false, length = 64)
    private String learnerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_type", nullable = false, length = 20)
    private SessionType sessionType;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    @Column(name = "planned_duration_minutes")
    private Integer plannedDurationMinutes;

    @Column(name = "completed", nullable = false)
    private Boolean completed;

    @Column(name = "cards_reviewed", nullable = false)
    private Integer cardsReviewed;

    @Column(name = "breaks_taken", nullable = false)
    private Integer breaksTaken;

    @Column(name = "clock_anomaly", nullable = false)
    private Boolean clockAnomaly;
}
