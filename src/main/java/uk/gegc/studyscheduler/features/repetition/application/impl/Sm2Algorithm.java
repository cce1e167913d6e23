package uk.gegc.studyscheduler.features.repetition.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.repetition.application.SrsAlgorithm;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.repetition.domain.model.ReviewGrade;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

@Component
public class Sm2Algorithm implements SrsAlgorithm {

    private static final int AGAIN_INTERVAL_DAYS = 1;
    private static final int FIRST_SUCCESS_INTERVAL_DAYS = 1;
    private static final int SECOND_SUCCESS_INTERVAL_DAYS = 6;
    /** Intervals saturate at one hundred years. */
    public static final int MAX_INTERVAL_DAYS = 36_500;

    @Override
    public CardState schedule(CardState state, ReviewGrade grade, Instant now) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(grade, "grade");
        Objects.requireNonNull(now, "now");

        if (grade.isFailure()) {
            return state.toBuilder()
                    .repetitions(0)
                    .intervalDays(AGAIN_INTERVAL_DAYS)
                    .dueAt(now.plus(AGAIN_INTERVAL_DAYS, ChronoUnit.DAYS))
                    .lastReviewedAt(now)
                    .build();
        }

        int repetitions = state.repetitions() + 1;
        double updatedEase = calculateUpdatedEase(state.easeFactor(), grade.quality());
        int intervalDays = computeIntervalDays(repetitions, state.intervalDays(), updatedEase);

        return state.toBuilder()
                .repetitions(repetitions)
                .easeFactor(updatedEase)
                .intervalDays(intervalDays)
                .dueAt(now.plus(intervalDays, ChronoUnit.DAYS))
                .lastReviewedAt(now)
                .build();
    }

    @Override
    public CardState initialState(String cardId, Instant now) {
        return CardState.initial(cardId, now);
    }

    private int computeIntervalDays(int repetitions, int previousIntervalDays, double updatedEase) {
        if (repetitions == 1) return FIRST_SUCCESS_INTERVAL_DAYS;
        if (repetitions == 2) return SECOND_SUCCESS_INTERVAL_DAYS;
        // Half-up on the decimal product: 5 * 2.3 must give 12, not the 11 binary doubles would round to
        BigDecimal interval = BigDecimal.valueOf(previousIntervalDays)
                .multiply(BigDecimal.valueOf(updatedEase))
                .setScale(0, RoundingMode.HALF_UP);
        return interval.min(BigDecimal.valueOf(MAX_INTERVAL_DAYS)).intValue();
    }

    private double calculateUpdatedEase(double currentEaseFactor, int quality) {
        double updatedEase = currentEaseFactor
                + (0.1 - (5 - quality) * (0.08 + (5 - quality) * 0.02));
        return Math.max(updatedEase, CardState.MIN_EASE_FACTOR);
    }
}
