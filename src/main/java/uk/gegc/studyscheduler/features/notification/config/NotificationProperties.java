package uk.gegc.studyscheduler.features.notification.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "study.notification")
public class NotificationProperties {

    /**
     * Interval between reminder polls of an attached learner.
     * Default: 60 seconds
     */
    private Duration pollInterval = Duration.ofSeconds(60);

    /**
     * Minimum gap between two due-cards notifications.
     * Default: 4 hours
     */
    private Duration dueCardsCooldown = Duration.ofHours(4);

    /**
     * Link opened from a due-cards or streak notification.
     */
    private String reviewUrl = "/flashcards/review";
}
