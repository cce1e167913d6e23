package uk.gegc.studyscheduler.features.repetition.domain.model;

import lombok.Getter;

/**
 * Simplified four-button rating shown to learners, mapped onto SM-2 quality scores.
 */
@Getter
public enum RepetitionRating {
    AGAIN(0),
    HARD(3),
    GOOD(4),
    EASY(5);

    private final int sm2Value;

    RepetitionRating(int sm2Value) {
        this.sm2Value = sm2Value;
    }
}
