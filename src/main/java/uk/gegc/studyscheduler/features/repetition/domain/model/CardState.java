package uk.gegc.studyscheduler.features.repetition.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Objects;

/**
 * Memory-strength state of one flashcard for one learner.
 *
 * @param cardId         opaque card identifier
 * @param easeFactor     SM-2 ease, never below {@link #MIN_EASE_FACTOR}
 * @param intervalDays   days until the next review after the last one
 * @param repetitions    consecutive successful reviews
 * @param dueAt          instant from which the card is due
 * @param lastReviewedAt instant of the last review, null for a card never reviewed
 */
@Builder(toBuilder = true)
public record CardState(
        String cardId,
        double easeFactor,
        int intervalDays,
        int repetitions,
        Instant dueAt,
        Instant lastReviewedAt
) {

    public static final double MIN_EASE_FACTOR = 1.3;
    public static final double DEFAULT_EASE_FACTOR = 2.5;

    public CardState {
        Objects.requireNonNull(cardId, "cardId");
        Objects.requireNonNull(dueAt, "dueAt");
        if (Double.isNaN(easeFactor) || easeFactor < MIN_EASE_FACTOR) {
            throw new IllegalArgumentException("easeFactor must be >= 1.3, got " + easeFactor);
        }
        if (intervalDays < 0) {
            throw new IllegalArgumentException("intervalDays must be >= 0, got " + intervalDays);
        }
        if (repetitions < 0) {
            throw new IllegalArgumentException("repetitions must be >= 0, got " + repetitions);
        }
    }

    /**
     * State of a card on first exposure: immediately due.
     */
    public static CardState initial(String cardId, Instant now) {
        return new CardState(cardId, DEFAULT_EASE_FACTOR, 0, 0, now, null);
    }

    public boolean isDue(Instant now) {
        return !dueAt.isAfter(now);
    }

    public CardMaturity maturity() {
        return CardMaturity.of(repetitions, intervalDays);
    }
}
