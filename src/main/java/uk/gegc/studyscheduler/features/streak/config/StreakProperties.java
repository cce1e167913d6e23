package uk.gegc.studyscheduler.features.streak.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalTime;

@Data
@Component
@ConfigurationProperties(prefix = "study.streak")
public class StreakProperties {

    /**
     * Learner-local time of day from which a live streak without activity today counts as at risk.
     * Default: 18:00
     */
    private LocalTime atRiskAfter = LocalTime.of(18, 0);

    /**
     * Attempts for the streak read-modify-write when a concurrent device wins the version check.
     */
    private int maxWriteAttempts = 3;
}
