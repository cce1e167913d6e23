package uk.gegc.studyscheduler.features.repetition.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "study.repetition")
public class RepetitionProperties {

    /**
     * Cap applied when a caller asks for the review queue without its own limit.
     * Default: 100 cards
     */
    @Positive
    private int defaultQueueLimit = 100;
}
