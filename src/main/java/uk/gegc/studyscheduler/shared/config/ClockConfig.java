package uk.gegc.studyscheduler.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of "now" for the scheduler core.
 * <p>
 * Every component that needs the current instant takes this Clock instead of calling
 * {@code Instant.now()}, so tests can drive time forward deterministically.
 */
@Configuration
public class ClockConfig {

    /**
     * Zone of the application clock. Learner-local calendar logic takes the learner's own
     * zone explicitly and does not depend on this value.
     */
    @Value("${study.timezone:UTC}")
    private String timezone;

    @Bean
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
