package uk.gegc.studyscheduler.features.repetition.application;

import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;

import java.time.Duration;
import java.time.Instant;

/**
 * Rough recall probability of a card, modelled as exponential decay over its current interval.
 */
@Component
public class RetentionEstimator {

    private static final double DECAY_RATE = 0.5;

    public double estimate(double daysSinceReview, int intervalDays) {
        if (daysSinceReview < 0) return 1.0;
        double retention = Math.exp(-DECAY_RATE * daysSinceReview / Math.max(intervalDays, 1));
        return Math.min(1.0, Math.max(0.0, retention));
    }

    public double estimate(CardState state, Instant now) {
        if (state.lastReviewedAt() == null) return 0.0;
        double days = Duration.between(state.lastReviewedAt(), now).toMinutes() / (24.0 * 60.0);
        return estimate(days, state.intervalDays());
    }
}
