package uk.gegc.studyscheduler.shared.persistence.jpa;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Getter
@Setter
@Table(name = "streak_record")
public class StreakRecordEntity {

    @Id
    @Column(name = "learner_id", updatable = false, nullable = false, length = 64)
    private String learnerId;

    @Column(name = "last_activity_date")
    private LocalDate lastActivityDate;

    @Column(name = "current_streak", nullable = false)
    private Integer currentStreak;

    @Column(name = "longest_streak", nullable = false)
    private Integer longestStreak;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
