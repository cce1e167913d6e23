package uk.gegc.studyscheduler.features.session.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Timings of the session timer and break monitor.
 */
@Data
@Component
@ConfigurationProperties(prefix = "study.session")
public class SessionTimerProperties {

    /**
     * Interval between timer ticks.
     * Default: 60 seconds
     */
    private Duration pollInterval = Duration.ofSeconds(60);

    /**
     * Continuous active time after which a break reminder is raised, and again at every multiple.
     * Default: 25 minutes
     */
    private Duration breakThreshold = Duration.ofMinutes(25);

    /**
     * Time without learner interaction after which an active session pauses itself.
     * Default: 5 minutes
     */
    private Duration inactivityTimeout = Duration.ofMinutes(5);

    /**
     * Wall-clock age at which a running session is completed automatically.
     * Default: 4 hours
     */
    private Duration timeoutCeiling = Duration.ofHours(4);

    /**
     * Upper bound of a recorded session duration.
     * Default: 240 minutes
     */
    private int maxDurationMinutes = 240;
}
